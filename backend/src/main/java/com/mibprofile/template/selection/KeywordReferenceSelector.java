package com.mibprofile.template.selection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic token-overlap selection. The target name is lowercased, '-' and '_' become spaces, and generic
 * schema-suffix and version tokens are dropped. A candidate scores one point per remaining token found as a
 * substring of its lowercased path. Highest score wins, then shortest path, then earliest position in the input.
 * Score zero everywhere (or no candidates) yields the fallback path.
 */
public class KeywordReferenceSelector implements ReferenceSelector {

    static final Set<String> STOPWORDS = Set.of(
            "mib", "mibs", "smi", "tc", "textual", "conventions",
            "v1", "v2", "v2c", "v3");

    private static final Comparator<Scored> RANKING = Comparator
            .comparingInt(Scored::score).reversed()
            .thenComparingInt(s -> s.path().length())
            .thenComparingInt(Scored::index);

    private final String fallbackPath;

    public KeywordReferenceSelector(String fallbackPath) {
        if (fallbackPath == null || fallbackPath.isBlank()) {
            throw new IllegalArgumentException("fallbackPath must not be blank");
        }
        this.fallbackPath = fallbackPath;
    }

    @Override
    public String select(String targetName, List<String> candidatePaths) {
        if (candidatePaths == null || candidatePaths.isEmpty()) {
            return fallbackPath;
        }
        List<String> tokens = tokenize(targetName);
        if (tokens.isEmpty()) {
            return fallbackPath;
        }
        String best = null;
        int bestScore = 0;
        for (String path : candidatePaths) {
            if (path == null || path.isEmpty()) {
                continue;
            }
            int score = score(tokens, path);
            if (score > bestScore || (score > 0 && score == bestScore && path.length() < best.length())) {
                best = path;
                bestScore = score;
            }
        }
        return best != null ? best : fallbackPath;
    }

    /**
     * Candidates in ranking order (score desc, length asc, input order), at most {@code limit}. Zero-score
     * candidates are included after all scoring ones.
     */
    public List<String> rank(String targetName, List<String> candidatePaths, int limit) {
        if (candidatePaths == null || candidatePaths.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<String> tokens = tokenize(targetName);
        List<Scored> scored = new ArrayList<>();
        for (int i = 0; i < candidatePaths.size(); i++) {
            String path = candidatePaths.get(i);
            if (path == null || path.isEmpty()) {
                continue;
            }
            scored.add(new Scored(path, score(tokens, path), i));
        }
        scored.sort(RANKING);
        return scored.stream().limit(limit).map(Scored::path).toList();
    }

    public String getFallbackPath() {
        return fallbackPath;
    }

    static List<String> tokenize(String targetName) {
        if (targetName == null || targetName.isBlank()) {
            return List.of();
        }
        String normalized = targetName.toLowerCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split("\\s+")) {
            if (!token.isEmpty() && !STOPWORDS.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static int score(List<String> tokens, String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String token : tokens) {
            if (lower.contains(token)) {
                score++;
            }
        }
        return score;
    }

    private record Scored(String path, int score, int index) {
    }
}
