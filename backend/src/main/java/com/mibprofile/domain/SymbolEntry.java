package com.mibprofile.domain;

/**
 * One named leaf of a compiled MIB symbol table. Request-scoped; never persisted.
 *
 * @param name        symbol name, unique within one table
 * @param oid         dotted numeric OID
 * @param nodeType    node kind as reported by the compiler
 * @param description compiler-supplied description; may be null
 */
public record SymbolEntry(String name, String oid, NodeType nodeType, String description) {
}
