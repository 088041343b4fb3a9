package com.mibprofile.generation;

import java.util.Optional;

/**
 * Used when generation is disabled: never answers.
 */
public class NoopTextGenerationClient implements TextGenerationClient {

    @Override
    public Optional<String> complete(String prompt) {
        return Optional.empty();
    }
}
