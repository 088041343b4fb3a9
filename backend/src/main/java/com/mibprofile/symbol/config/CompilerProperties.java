package com.mibprofile.symbol.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * External MIB compiler (pysmi mibdump) settings.
 */
@ConfigurationProperties(prefix = "mibprofile.compiler")
@NoArgsConstructor
@Getter
@Setter
public class CompilerProperties {

    /** Executable to run; must be on PATH or absolute. */
    private String command = "mibdump";

    /**
     * Extra MIB source locations passed as --mib-source, searched for imported modules
     * (directories or pysmi URL templates such as https://mibs.pysnmp.com/asn1/@mib@).
     */
    private List<String> mibSources = new ArrayList<>(List.of("/usr/share/snmp/mibs"));

    /** Scratch directory for compiler output; blank means java.io.tmpdir. */
    private String workDir = "";

    /** Wall-clock limit for one compile. */
    private long timeoutMs = 60_000;
}
