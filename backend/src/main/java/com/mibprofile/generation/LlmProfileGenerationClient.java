package com.mibprofile.generation;

import com.mibprofile.domain.SymbolEntry;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Profile generation through a text completion model: the reference template is given as the format exemplar and
 * the classified symbols as the content to cover.
 */
@RequiredArgsConstructor
public class LlmProfileGenerationClient implements ProfileGenerationClient {

    private final TextGenerationClient client;

    @Override
    public Optional<String> generate(GenerationRequest request) {
        if (request == null) {
            return Optional.empty();
        }
        return client.complete(buildPrompt(request))
                .filter(text -> !text.isBlank());
    }

    static String buildPrompt(GenerationRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a network monitoring expert writing a ktranslate SNMP profile in YAML for the MIB ")
                .append(request.targetName()).append(".\n")
                .append("Follow the structure and conventions of the reference profile. ")
                .append("Group related metrics and give each trap a short operator-facing description.\n")
                .append("Keep sysobjectid as 1.3.6.1.4.1.CHANGE_THIS. Return only the YAML document.\n\n");
        String reference = request.referenceContent();
        if (reference != null && !reference.isBlank()) {
            sb.append("Reference profile:\n").append(reference).append("\n\n");
        }
        appendSymbols(sb, "Metrics", request.metrics());
        appendSymbols(sb, "Traps", request.traps());
        return sb.toString();
    }

    private static void appendSymbols(StringBuilder sb, String title, List<SymbolEntry> symbols) {
        sb.append(title).append(" (name, OID, description):\n");
        if (symbols != null) {
            for (SymbolEntry s : symbols) {
                sb.append("- ").append(s.name()).append(", ").append(s.oid());
                if (s.description() != null && !s.description().isBlank()) {
                    sb.append(", ").append(s.description().strip().replaceAll("\\s+", " "));
                }
                sb.append('\n');
            }
        }
        sb.append('\n');
    }
}
