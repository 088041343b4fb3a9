package com.mibprofile.generation;

import com.mibprofile.domain.SymbolEntry;

import java.util.List;

/**
 * Input of the augmented profile generation.
 *
 * @param referenceContent content of the selected reference template; empty when it is not cached
 */
public record GenerationRequest(
        String targetName,
        String referenceContent,
        List<SymbolEntry> metrics,
        List<SymbolEntry> traps) {
}
