package com.mibprofile.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Classifier output: metric candidates (scalar, column) and trap candidates (notification, trap), each ordered by name.
 */
public record ClassifiedSet(List<SymbolEntry> metrics, List<SymbolEntry> traps) {

    public ClassifiedSet {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        traps = traps == null ? List.of() : List.copyOf(traps);
    }

    public static ClassifiedSet empty() {
        return new ClassifiedSet(List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return metrics.isEmpty() && traps.isEmpty();
    }
}
