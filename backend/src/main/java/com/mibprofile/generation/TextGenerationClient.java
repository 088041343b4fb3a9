package com.mibprofile.generation;

import java.util.Optional;

/**
 * Single-prompt text completion. The answer is opaque text; callers must validate anything they rely on.
 */
public interface TextGenerationClient {

    /**
     * Complete the prompt. Empty when generation is disabled or the call failed.
     */
    Optional<String> complete(String prompt);
}
