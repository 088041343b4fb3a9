package com.mibprofile.template.source;

/**
 * Thrown when the remote template source cannot list or return content (HTTP error, timeout, bad payload).
 */
public class TemplateSourceException extends RuntimeException {

    public TemplateSourceException(String message) {
        super(message);
    }

    public TemplateSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
