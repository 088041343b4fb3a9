package com.mibprofile.generation;

/**
 * Operator-facing note on one symbol.
 *
 * @param description short explanation of what the symbol reports
 * @param importance  monitoring importance as answered, e.g. High or Low; {@code -} when unknown
 */
public record SymbolAnnotation(String description, String importance) {

    public static final SymbolAnnotation UNKNOWN = new SymbolAnnotation("", "-");
}
