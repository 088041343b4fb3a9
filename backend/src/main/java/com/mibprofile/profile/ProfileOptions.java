package com.mibprofile.profile;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Caller choices for one profile build.
 *
 * @param selectedSymbols  symbol names to keep; empty keeps every classified symbol; null names are ignored
 * @param trapDescriptions trap name to description, overriding the compiler description; null entries are ignored
 * @param augmented        pass the result through the generation collaborator
 */
public record ProfileOptions(Set<String> selectedSymbols, Map<String, String> trapDescriptions, boolean augmented) {

    public ProfileOptions {
        selectedSymbols = selectedSymbols == null ? Set.of() : selectedSymbols.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
        trapDescriptions = trapDescriptions == null ? Map.of() : trapDescriptions.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static ProfileOptions defaults() {
        return new ProfileOptions(Set.of(), Map.of(), false);
    }
}
