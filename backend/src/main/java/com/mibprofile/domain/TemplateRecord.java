package com.mibprofile.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cached reference template mirrored from the remote corpus. Keyed by its corpus path (document id), so a write is a
 * full replacement of the previous content for that path, never a patch.
 */
@Document(collection = "template_cache")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TemplateRecord {

    /** Corpus path, e.g. profiles/kentik_snmp/cisco/cisco-asa.yml. */
    @Id
    @EqualsAndHashCode.Include
    private String path;
    /** Raw template text (YAML). */
    private String content;
    private Instant lastUpdated;
}
