package com.mibprofile.generation;

import java.util.Optional;

/**
 * External generator that writes a complete profile from classified symbols and a reference template.
 * Its output is opaque and non-deterministic; it is passed through, never parsed.
 */
public interface ProfileGenerationClient {

    Optional<String> generate(GenerationRequest request);
}
