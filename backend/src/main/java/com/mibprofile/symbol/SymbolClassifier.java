package com.mibprofile.symbol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.NodeType;
import com.mibprofile.domain.SymbolEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a compiled symbol table into metric candidates (scalar, column) and trap candidates (notification, trap).
 * Entries are processed in name order; entries without an OID (abstract, non-leaf) and non-leaf kinds such as
 * table or row are dropped. Stateless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SymbolClassifier {

    private final ObjectMapper objectMapper;

    /**
     * Classify a symbol table given as JSON text.
     *
     * @throws SymbolExtractionException when the text is not readable JSON or not an object
     */
    public ClassifiedSet classify(String symbolTableJson) {
        if (symbolTableJson == null || symbolTableJson.isBlank()) {
            throw new SymbolExtractionException("Symbol table is empty");
        }
        try {
            return classify(objectMapper.readTree(symbolTableJson));
        } catch (JsonProcessingException e) {
            throw new SymbolExtractionException("Symbol table is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Classify a symbol table of the form {@code {symbolName: {oid, nodetype|nodeType, description}}}.
     * Non-object entries are skipped.
     *
     * @throws SymbolExtractionException when the table itself is missing or not an object
     */
    public ClassifiedSet classify(JsonNode symbolTable) {
        if (symbolTable == null || !symbolTable.isObject()) {
            throw new SymbolExtractionException("Symbol table is not a JSON object");
        }
        Map<String, SymbolEntry> byName = new TreeMap<>();
        int skipped = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = symbolTable.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode info = field.getValue();
            if (info == null || !info.isObject()) {
                skipped++;
                continue;
            }
            byName.put(field.getKey(), toEntry(field.getKey(), info));
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed symbol entries", skipped);
        }
        return split(byName.values());
    }

    /**
     * Classify already-parsed entries. Duplicate names collapse to the last one seen.
     */
    public ClassifiedSet classifyEntries(List<SymbolEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return ClassifiedSet.empty();
        }
        Map<String, SymbolEntry> byName = new TreeMap<>();
        for (SymbolEntry entry : entries) {
            if (entry == null || entry.name() == null) {
                continue;
            }
            byName.put(entry.name(), entry);
        }
        return split(byName.values());
    }

    private static ClassifiedSet split(Collection<SymbolEntry> sortedEntries) {
        List<SymbolEntry> metrics = new ArrayList<>();
        List<SymbolEntry> traps = new ArrayList<>();
        for (SymbolEntry entry : sortedEntries) {
            if (entry.oid() == null || entry.oid().isBlank()) {
                continue;
            }
            NodeType type = entry.nodeType() == null ? NodeType.OTHER : entry.nodeType();
            if (type.isMetric()) {
                metrics.add(entry);
            } else if (type.isTrap()) {
                traps.add(entry);
            }
        }
        return new ClassifiedSet(metrics, traps);
    }

    private static SymbolEntry toEntry(String name, JsonNode info) {
        String rawType = text(info, "nodetype");
        if (rawType == null) {
            rawType = text(info, "nodeType");
        }
        if (rawType == null) {
            // pysmi reports NOTIFICATION-TYPE / TRAP-TYPE only through "class"
            rawType = text(info, "class");
        }
        return new SymbolEntry(name, text(info, "oid"), NodeType.fromCompilerValue(rawType), text(info, "description"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
