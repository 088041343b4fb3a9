package com.mibprofile.api.dto;

import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.NodeType;
import com.mibprofile.domain.SymbolEntry;
import com.mibprofile.generation.SymbolAnnotation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifyResponseTest {

    private static final ClassifiedSet IF_MIB = new ClassifiedSet(
            List.of(new SymbolEntry("ifInOctets", "1.3.6.1.2.1.2.2.1.10", NodeType.COLUMN, null),
                    new SymbolEntry("ifOutOctets", "1.3.6.1.2.1.2.2.1.16", NodeType.COLUMN, null)),
            List.of(new SymbolEntry("linkDown", "1.3.6.1.6.3.1.1.5.3", NodeType.NOTIFICATION, null)));

    @Test
    @DisplayName("answered symbols keep their annotation, the rest get the unknown marker, strangers are dropped")
    void mergeAnnotations() {
        ClassifyResponse response = ClassifyResponse.of("IF-MIB", IF_MIB, Map.of(
                "ifInOctets", new SymbolAnnotation("Octets received", "High"),
                "sysUpTime", new SymbolAnnotation("Uptime", "Low")));

        assertThat(response.mibName()).isEqualTo("IF-MIB");
        assertThat(response.annotations()).containsExactly(
                Map.entry("ifInOctets", new SymbolAnnotation("Octets received", "High")),
                Map.entry("ifOutOctets", SymbolAnnotation.UNKNOWN),
                Map.entry("linkDown", SymbolAnnotation.UNKNOWN));
    }

    @Test
    @DisplayName("no answer leaves annotations empty and the classification intact")
    void noAnswer() {
        ClassifyResponse response = ClassifyResponse.of("IF-MIB", IF_MIB, Map.of());

        assertThat(response.annotations()).isEmpty();
        assertThat(response.metrics()).hasSize(2);
        assertThat(response.traps()).extracting(SymbolEntry::name).containsExactly("linkDown");
    }
}
