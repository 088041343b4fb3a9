package com.mibprofile.template.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * GitHub repository holding the reference profile corpus. Documented in application.yml under
 * mibprofile.source.github.
 */
@ConfigurationProperties(prefix = "mibprofile.source.github")
@NoArgsConstructor
@Getter
@Setter
public class GitHubSourceProperties {

    /** GitHub REST API base URL (GitHub Enterprise: https://host/api/v3). */
    private String baseUrl = "https://api.github.com";

    private String owner = "kentik";

    private String repository = "snmp-profiles";

    private String branch = "main";

    /** Optional token; unauthenticated calls are limited to 60 requests per hour. */
    private String token = "";

    /** Timeout for the recursive tree listing. Failure aborts the sync run. */
    private long listingTimeoutMs = 10_000;

    /** Timeout for a single contents fetch. Failure skips that item only. */
    private long itemTimeoutMs = 5_000;

    /** Local budget for contents fetches (requests per second). */
    private int maxRequestsPerSecond = 10;

    /** How long a contents fetch may wait for a rate-limiter permit before it counts as failed. */
    private long limiterTimeoutMs = 2_000;

    /** Max buffered response size; the recursive tree of a large repository exceeds the 256 KB default. */
    private int maxResponseBytes = 16 * 1024 * 1024;
}
