package com.mibprofile.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.List;
import java.util.Map;

/**
 * POST /api/v1/profiles request body. Exactly one of {@code symbols} (compiled symbol table) or {@code mibSource}
 * (raw MIB text, compiled server side) is expected; {@code symbols} wins when both are present.
 * Null entries in {@code selectedSymbols} or null {@code trapDescriptions} values are rejected by the controller.
 * The MIB name doubles as the compiler's module file name, hence the pattern.
 */
public record ProfileRequest(
        @NotBlank(message = "INVALID_MIB_NAME")
        @Pattern(regexp = "[A-Za-z0-9][A-Za-z0-9._-]*", message = "INVALID_MIB_NAME")
        String mibName,

        JsonNode symbols,

        String mibSource,

        List<String> selectedSymbols,

        Map<String, String> trapDescriptions,

        Boolean augmented
) {
}
