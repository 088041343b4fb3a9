package com.mibprofile.template.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Template sync job config. Each run fetches at most {@code quota} missing templates, so repeated runs converge on
 * full corpus coverage.
 */
@ConfigurationProperties(prefix = "mibprofile.sync")
@NoArgsConstructor
@Getter
@Setter
public class TemplateSyncProperties {

    /** Whether the scheduled job runs. Manual trigger through the API works regardless. */
    private boolean enabled = true;

    /** Delay between the end of one scheduled run and the start of the next. */
    private long intervalMs = 3_600_000;

    private long initialDelayMs = 30_000;

    /** Max templates fetched per run. */
    private int quota = 20;

    /** Only corpus paths starting with this prefix are synced. */
    private String pathPrefix = "profiles/kentik_snmp/";

    /** Only corpus paths ending with this suffix are synced. */
    private String pathSuffix = ".yml";

    /** Id of the template_sync_status document for this corpus. */
    private String corpusId = "kentik-snmp-profiles";
}
