package com.mibprofile.template.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reference template selection.
 */
@ConfigurationProperties(prefix = "mibprofile.selection")
@NoArgsConstructor
@Getter
@Setter
public class SelectionProperties {

    /** keyword (deterministic) or llm (asks the generation client, keyword on any failure). */
    private String strategy = "keyword";

    /** Returned when no candidate scores above zero or there are no candidates. */
    private String fallbackPath = "profiles/kentik_snmp/_general/generic.yml";

    /** Candidates listed in the llm prompt; the keyword ranking decides which ones. */
    private int maxLlmCandidates = 50;
}
