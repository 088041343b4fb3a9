package com.mibprofile.domain;

import java.util.List;

/**
 * Result of one profile generation: the classified symbols that went in, the reference template chosen for it and
 * the rendered document text.
 *
 * @param referencePathUsed template path picked by the selector; may be the fixed fallback path
 * @param generatedContent  rendered profile (YAML) or, in augmented mode, the generator's opaque output
 */
public record Profile(
        String mibName,
        List<SymbolEntry> metrics,
        List<SymbolEntry> traps,
        String referencePathUsed,
        String generatedContent) {
}
