package com.mibprofile.template.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.template.config.GitHubSourceProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Template source backed by a GitHub repository: GET git/trees/{branch}?recursive=1 for the listing and
 * GET contents/{path}?ref={branch} (base64 payload) per template. Each call is bounded by its own timeout;
 * content fetches also take a permit from the shared rate limiter.
 */
@Slf4j
public class GitHubTemplateSource implements TemplateSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GitHubSourceProperties properties;
    private final WebClient webClient;
    private final RateLimiter contentRateLimiter;

    public GitHubTemplateSource(GitHubSourceProperties properties, WebClient.Builder builder, RateLimiter contentRateLimiter) {
        this.properties = properties;
        this.contentRateLimiter = contentRateLimiter;
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeaders(headers -> {
                    headers.set(HttpHeaders.ACCEPT, "application/vnd.github+json");
                    headers.set("X-GitHub-Api-Version", "2022-11-28");
                    if (properties.getToken() != null && !properties.getToken().isBlank()) {
                        headers.setBearerAuth(properties.getToken());
                    }
                })
                .codecs(c -> c.defaultCodecs().maxInMemorySize(properties.getMaxResponseBytes()))
                .build();
    }

    @Override
    public List<String> listPaths(String prefix, String suffix) {
        String body;
        try {
            body = webClient.get()
                    .uri("/repos/{owner}/{repo}/git/trees/{branch}?recursive=1",
                            properties.getOwner(), properties.getRepository(), properties.getBranch())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getListingTimeoutMs()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new TemplateSourceException("GitHub tree listing failed: " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new TemplateSourceException("GitHub tree listing failed: " + messageOf(e), e);
        }
        return parseTreePaths(body, prefix, suffix);
    }

    @Override
    public String fetchContent(String path) {
        if (!contentRateLimiter.acquirePermission()) {
            throw new TemplateSourceException("Rate limiter permit not granted for " + path);
        }
        String body;
        try {
            body = webClient.get()
                    .uri("/repos/{owner}/{repo}/contents/" + path + "?ref={branch}",
                            properties.getOwner(), properties.getRepository(), properties.getBranch())
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getItemTimeoutMs()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new TemplateSourceException("GitHub contents fetch failed for " + path + ": " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new TemplateSourceException("GitHub contents fetch failed for " + path + ": " + messageOf(e), e);
        }
        return decodeContent(body, path);
    }

    static List<String> parseTreePaths(String json, String prefix, String suffix) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new TemplateSourceException("GitHub tree listing is not valid JSON", e);
        }
        JsonNode tree = root == null ? null : root.path("tree");
        if (tree == null || !tree.isArray()) {
            throw new TemplateSourceException("GitHub tree listing has no tree array");
        }
        if (root.path("truncated").asBoolean(false)) {
            log.warn("GitHub tree listing is truncated; corpus coverage will be incomplete");
        }
        String p = prefix == null ? "" : prefix;
        String s = suffix == null ? "" : suffix;
        List<String> paths = new ArrayList<>();
        for (JsonNode item : tree) {
            JsonNode pathNode = item.path("path");
            if (!pathNode.isTextual()) {
                continue;
            }
            String type = item.path("type").asText("blob");
            if (!"blob".equals(type)) {
                continue;
            }
            String path = pathNode.asText();
            if (path.startsWith(p) && path.endsWith(s)) {
                paths.add(path);
            }
        }
        return paths;
    }

    static String decodeContent(String json, String path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new TemplateSourceException("GitHub contents response is not valid JSON for " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new TemplateSourceException("GitHub contents response is not an object for " + path);
        }
        String encoding = root.path("encoding").asText("");
        JsonNode content = root.path("content");
        if (!"base64".equals(encoding) || !content.isTextual()) {
            throw new TemplateSourceException("Unsupported contents encoding '" + encoding + "' for " + path);
        }
        try {
            byte[] raw = Base64.getMimeDecoder().decode(content.asText());
            return new String(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new TemplateSourceException("Invalid base64 content for " + path, e);
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
