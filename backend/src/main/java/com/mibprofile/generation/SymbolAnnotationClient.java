package com.mibprofile.generation;

import com.mibprofile.domain.SymbolEntry;

import java.util.List;
import java.util.Map;

/**
 * Explains symbols for the operator picking what to monitor.
 */
public interface SymbolAnnotationClient {

    /**
     * Annotations keyed by symbol name, only for symbols the service answered for. Empty when annotation is
     * disabled or failed; never throws.
     */
    Map<String, SymbolAnnotation> annotate(String mibName, List<SymbolEntry> symbols);
}
