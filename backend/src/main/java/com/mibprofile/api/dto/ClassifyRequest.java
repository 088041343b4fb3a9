package com.mibprofile.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/symbols/classify request body. {@code symbols} is the compiled symbol table
 * {@code {symbolName: {oid, nodetype, description}}}. With {@code annotate} the classified symbols are also
 * explained by the generation service.
 */
public record ClassifyRequest(
        @NotBlank(message = "INVALID_MIB_NAME")
        String mibName,

        @NotNull(message = "MISSING_SYMBOLS")
        JsonNode symbols,

        Boolean annotate
) {
}
