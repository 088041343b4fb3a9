package com.mibprofile.api.dto;

import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.SymbolEntry;
import com.mibprofile.generation.SymbolAnnotation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * POST /api/v1/symbols/classify response. {@code annotations} is keyed by symbol name and empty unless annotation
 * was requested and answered.
 */
public record ClassifyResponse(
        String mibName,
        List<SymbolEntry> metrics,
        List<SymbolEntry> traps,
        Map<String, SymbolAnnotation> annotations) {

    public static ClassifyResponse of(String mibName, ClassifiedSet classified) {
        return new ClassifyResponse(mibName, classified.metrics(), classified.traps(), Map.of());
    }

    /**
     * Attach annotations in classified order. Once the service answered for any symbol, every classified symbol
     * gets an entry, {@link SymbolAnnotation#UNKNOWN} where it was not answered; answers for other names are dropped.
     */
    public static ClassifyResponse of(String mibName, ClassifiedSet classified, Map<String, SymbolAnnotation> answered) {
        if (answered == null || answered.isEmpty()) {
            return of(mibName, classified);
        }
        Map<String, SymbolAnnotation> annotations = new LinkedHashMap<>();
        Stream.concat(classified.metrics().stream(), classified.traps().stream())
                .forEach(s -> annotations.put(s.name(), answered.getOrDefault(s.name(), SymbolAnnotation.UNKNOWN)));
        return new ClassifyResponse(mibName, classified.metrics(), classified.traps(), annotations);
    }
}
