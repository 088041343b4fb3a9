package com.mibprofile.symbol;

/**
 * Thrown when no usable symbol data can be extracted: the compiler produced nothing, or the symbol table is not a
 * JSON object. API layer maps to 422 EXTRACTION_FAILED.
 */
public class SymbolExtractionException extends RuntimeException {

    public SymbolExtractionException(String message) {
        super(message);
    }

    public SymbolExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
