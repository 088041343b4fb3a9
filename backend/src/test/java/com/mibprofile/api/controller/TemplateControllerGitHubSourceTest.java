package com.mibprofile.api.controller;

import com.mibprofile.template.cache.InMemoryTemplateCache;
import com.mibprofile.template.config.GitHubSourceProperties;
import com.mibprofile.template.config.TemplateSyncProperties;
import com.mibprofile.template.selection.KeywordReferenceSelector;
import com.mibprofile.template.source.GitHubTemplateSource;
import com.mibprofile.template.sync.TemplateSyncStatusRecorder;
import com.mibprofile.template.sync.TemplateSyncWorker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Drives the template endpoints through the real GitHub source. Responses arrive asynchronously, as they do over a
 * real connection, so the source has to wait for them off the event loop.
 */
class TemplateControllerGitHubSourceTest {

    private static final String TREE_JSON = """
            {"sha":"abc","truncated":false,"tree":[
              {"path":"profiles/kentik_snmp/_general/if-mib.yml","type":"blob"},
              {"path":"profiles/kentik_snmp/cisco/cisco-asa.yml","type":"blob"},
              {"path":"profiles/kentik_snmp/cisco/README.md","type":"blob"}
            ]}
            """;

    private InMemoryTemplateCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryTemplateCache();
    }

    private WebTestClient client(Function<ClientRequest, ClientResponse> github) {
        GitHubSourceProperties props = new GitHubSourceProperties();
        props.setBaseUrl("https://api.github.test");
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(req -> Mono.just(github.apply(req)).delayElement(Duration.ofMillis(20)));
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(10))
                .limitForPeriod(10)
                .timeoutDuration(Duration.ZERO)
                .build());
        GitHubTemplateSource source = new GitHubTemplateSource(props, builder, limiter);
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        TemplateSyncWorker worker = new TemplateSyncWorker(source, cache, new TemplateSyncProperties(), event -> { }, clock);

        TemplateController controller = new TemplateController(worker, mock(TemplateSyncStatusRecorder.class), cache,
                new KeywordReferenceSelector("profiles/kentik_snmp/_general/generic.yml"));
        return WebTestClient.bindToController(controller)
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header("Content-Type", "application/json")
                .body(body)
                .build();
    }

    private static String contentsJson(String text) {
        String encoded = Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
        return "{\"encoding\":\"base64\",\"content\":\"" + encoded + "\"}";
    }

    @Test
    @DisplayName("POST /templates/sync lists and fetches through GitHub and returns the run result")
    void syncThroughGitHub() {
        WebTestClient webTestClient = client(req -> req.url().getPath().contains("/git/trees/")
                ? json(HttpStatus.OK, TREE_JSON)
                : json(HttpStatus.OK, contentsJson("metrics: []\n")));

        webTestClient.post()
                .uri("/api/v1/templates/sync")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("COMPLETE")
                .jsonPath("$.itemsSynced").isEqualTo(2)
                .jsonPath("$.authoritativeSize").isEqualTo(2);

        assertThat(cache.store).containsOnlyKeys(
                "profiles/kentik_snmp/_general/if-mib.yml",
                "profiles/kentik_snmp/cisco/cisco-asa.yml");
        assertThat(cache.store.get("profiles/kentik_snmp/cisco/cisco-asa.yml")).isEqualTo("metrics: []\n");
    }

    @Test
    @DisplayName("GitHub listing error is 502 SYNC_LISTING_FAILED with the upstream status")
    void listingErrorThroughGitHub() {
        WebTestClient webTestClient = client(req -> json(HttpStatus.FORBIDDEN, "{\"message\":\"rate limited\"}"));

        webTestClient.post()
                .uri("/api/v1/templates/sync")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SYNC_LISTING_FAILED")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("403"));
        assertThat(cache.store).isEmpty();
    }

    @Test
    @DisplayName("GET /templates/select ranks what the sync cached")
    void selectAfterSync() {
        WebTestClient webTestClient = client(req -> req.url().getPath().contains("/git/trees/")
                ? json(HttpStatus.OK, TREE_JSON)
                : json(HttpStatus.OK, contentsJson("traps: []\n")));

        webTestClient.post().uri("/api/v1/templates/sync").exchange().expectStatus().isOk();

        webTestClient.get()
                .uri(uri -> uri.path("/api/v1/templates/select").queryParam("target", "CISCO-ASA-MIB").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.path").isEqualTo("profiles/kentik_snmp/cisco/cisco-asa.yml");
    }
}
