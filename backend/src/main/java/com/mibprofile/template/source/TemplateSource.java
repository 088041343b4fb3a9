package com.mibprofile.template.source;

import java.util.List;

/**
 * Remote source of truth for reference templates. Both operations fail independently.
 */
public interface TemplateSource {

    /**
     * Authoritative template paths starting with {@code prefix} and ending with {@code suffix}, in source listing
     * order.
     *
     * @throws TemplateSourceException when the listing cannot be fetched or read
     */
    List<String> listPaths(String prefix, String suffix);

    /**
     * Raw text of one template.
     *
     * @throws TemplateSourceException on fetch failure, timeout, or an undecodable payload
     */
    String fetchContent(String path);
}
