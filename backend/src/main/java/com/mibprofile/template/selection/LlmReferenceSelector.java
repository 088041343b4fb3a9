package com.mibprofile.template.selection;

import com.mibprofile.generation.TextGenerationClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Asks the generation client to pick a reference template from the keyword shortlist. Any client failure, empty
 * answer, or answer that is not one of the offered paths defers to the keyword selector, so the result is always a
 * candidate or the fallback path.
 */
@RequiredArgsConstructor
@Slf4j
public class LlmReferenceSelector implements ReferenceSelector {

    private final TextGenerationClient client;
    private final KeywordReferenceSelector keywordSelector;
    private final int maxCandidates;

    @Override
    public String select(String targetName, List<String> candidatePaths) {
        if (candidatePaths == null || candidatePaths.isEmpty()) {
            return keywordSelector.select(targetName, candidatePaths);
        }
        try {
            List<String> shortlist = keywordSelector.rank(targetName, candidatePaths, maxCandidates);
            Optional<String> picked = client.complete(buildPrompt(targetName, shortlist))
                    .map(LlmReferenceSelector::extractPath)
                    .filter(shortlist::contains);
            if (picked.isPresent()) {
                return picked.get();
            }
            log.debug("LLM gave no usable reference for {}; using keyword selection", targetName);
        } catch (RuntimeException e) {
            log.warn("LLM reference selection failed for {}: {}", targetName, e.getMessage());
        }
        return keywordSelector.select(targetName, candidatePaths);
    }

    static String buildPrompt(String targetName, List<String> shortlist) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a network monitoring expert choosing a reference SNMP profile.\n")
                .append("Target MIB module: ").append(targetName).append('\n')
                .append("Pick the single profile path below whose device family or MIB coverage best matches the target.\n")
                .append("Answer with the path only, exactly as written, and nothing else.\n\n")
                .append("Paths:\n");
        for (String path : shortlist) {
            sb.append(path).append('\n');
        }
        return sb.toString();
    }

    static String extractPath(String answer) {
        if (answer == null) {
            return "";
        }
        for (String line : answer.split("\\R")) {
            String candidate = line.strip();
            while (!candidate.isEmpty() && "`'\"".indexOf(candidate.charAt(0)) >= 0) {
                candidate = candidate.substring(1);
            }
            while (!candidate.isEmpty() && "`'\"".indexOf(candidate.charAt(candidate.length() - 1)) >= 0) {
                candidate = candidate.substring(0, candidate.length() - 1);
            }
            candidate = candidate.strip();
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }
}
