package com.mibprofile.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.domain.SymbolEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Symbol annotation through a text completion model. The model is asked for a JSON object
 * {@code {symbol: {desc, importance}}}; answers about symbols that were not asked for are dropped. Only the first
 * {@code maxSymbols} symbols are sent.
 */
@RequiredArgsConstructor
@Slf4j
public class LlmSymbolAnnotationClient implements SymbolAnnotationClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TextGenerationClient client;
    private final int maxSymbols;

    @Override
    public Map<String, SymbolAnnotation> annotate(String mibName, List<SymbolEntry> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return Map.of();
        }
        List<SymbolEntry> asked = symbols.stream().limit(Math.max(maxSymbols, 0)).toList();
        try {
            return client.complete(buildPrompt(mibName, asked))
                    .map(answer -> parse(answer, asked.stream().map(SymbolEntry::name).collect(Collectors.toSet())))
                    .orElse(Map.of());
        } catch (RuntimeException e) {
            log.warn("Symbol annotation failed for {}: {}", mibName, e.getMessage());
            return Map.of();
        }
    }

    static String buildPrompt(String mibName, List<SymbolEntry> symbols) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a network monitoring expert.\n")
                .append("Explain the following SNMP OID symbols of ").append(mibName).append(" in English.\n")
                .append("Also determine the importance (High/Low) for monitoring.\n")
                .append("Return ONLY valid JSON mapping each symbol to its description and importance, e.g.\n")
                .append("{\"oid_name\": {\"desc\": \"Explanation here\", \"importance\": \"High\"}}\n\n")
                .append("Symbols:\n");
        for (SymbolEntry s : symbols) {
            sb.append(s.name()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Reads the outermost JSON object of the answer, tolerating text around it. Unreadable answers give no
     * annotations.
     */
    static Map<String, SymbolAnnotation> parse(String answer, Set<String> askedNames) {
        if (answer == null) {
            return Map.of();
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("Symbol annotation answer has no JSON object");
            return Map.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(answer.substring(start, end + 1));
        } catch (Exception e) {
            log.warn("Symbol annotation answer unreadable: {}", e.getMessage());
            return Map.of();
        }
        Map<String, SymbolAnnotation> annotations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode info = field.getValue();
            if (!askedNames.contains(field.getKey()) || !info.isObject()) {
                continue;
            }
            annotations.put(field.getKey(), new SymbolAnnotation(
                    info.path("desc").asText(""),
                    info.path("importance").asText("-")));
        }
        return annotations;
    }
}
