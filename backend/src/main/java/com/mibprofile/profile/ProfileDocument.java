package com.mibprofile.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Monitoring profile as written to YAML. Key names and order are part of the output format.
 */
@JsonPropertyOrder({"metrics", "traps", "sysobjectid"})
public record ProfileDocument(List<MetricEntry> metrics, List<TrapEntry> traps, String sysobjectid) {

    /** Device identifier placeholder the operator replaces. */
    public static final String SYSOBJECTID_PLACEHOLDER = "1.3.6.1.4.1.CHANGE_THIS";

    @JsonPropertyOrder({"MIB", "symbol"})
    public record MetricEntry(@JsonProperty("MIB") String mib, SymbolRef symbol) {
    }

    @JsonPropertyOrder({"MIB", "symbol", "description"})
    public record TrapEntry(@JsonProperty("MIB") String mib, SymbolRef symbol, String description) {
    }

    @JsonPropertyOrder({"OID", "name"})
    public record SymbolRef(@JsonProperty("OID") String oid, String name) {
    }
}
