package com.mibprofile.symbol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.NodeType;
import com.mibprofile.domain.SymbolEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolClassifierTest {

    private final SymbolClassifier classifier = new SymbolClassifier(new ObjectMapper());

    @Test
    @DisplayName("column goes to metrics, table is dropped")
    void columnAndTable() {
        ClassifiedSet result = classifier.classify("""
                {"ifInOctets":{"oid":"1.3.6.1.2.1.2.2.1.10","nodeType":"column"},
                 "ifTable":{"oid":"1.3.6.1.2.1.2.2","nodeType":"table"}}
                """);

        assertThat(result.metrics()).extracting(SymbolEntry::name).containsExactly("ifInOctets");
        assertThat(result.metrics().get(0).nodeType()).isEqualTo(NodeType.COLUMN);
        assertThat(result.traps()).isEmpty();
    }

    @Test
    @DisplayName("buckets are name-ordered; notification/trap go to traps with description")
    void orderingAndTraps() {
        ClassifiedSet result = classifier.classify("""
                {"sysUpTime":{"oid":"1.3.6.1.2.1.1.3","nodetype":"scalar"},
                 "linkUp":{"oid":"1.3.6.1.6.3.1.1.5.4","nodetype":"notification","description":"A link came up"},
                 "ifDescr":{"oid":"1.3.6.1.2.1.2.2.1.2","nodetype":"column"},
                 "coldStart":{"oid":"1.3.6.1.6.3.1.1.5.1","nodetype":"trap"},
                 "ifEntry":{"oid":"1.3.6.1.2.1.2.2.1","nodetype":"row"}}
                """);

        assertThat(result.metrics()).extracting(SymbolEntry::name).containsExactly("ifDescr", "sysUpTime");
        assertThat(result.traps()).extracting(SymbolEntry::name).containsExactly("coldStart", "linkUp");
        assertThat(result.traps().get(1).description()).isEqualTo("A link came up");
        assertThat(result.traps().get(0).description()).isNull();
    }

    @Test
    @DisplayName("entries without OID and non-object entries are skipped")
    void missingOidAndMalformedEntries() {
        ClassifiedSet result = classifier.classify("""
                {"ifMIB":{"nodetype":"scalar"},
                 "meta":"not an entry",
                 "list":[1,2],
                 "ifSpeed":{"oid":"1.3.6.1.2.1.2.2.1.5","nodetype":"column"}}
                """);

        assertThat(result.metrics()).extracting(SymbolEntry::name).containsExactly("ifSpeed");
    }

    @Test
    @DisplayName("compiler class field is used when nodetype is absent")
    void classFallback() {
        ClassifiedSet result = classifier.classify("""
                {"authenticationFailure":{"oid":"1.3.6.1.6.3.1.1.5.5","class":"notificationtype"}}
                """);

        assertThat(result.traps()).extracting(SymbolEntry::name).containsExactly("authenticationFailure");
    }

    @Test
    @DisplayName("unreadable or non-object input is an extraction failure")
    void unreadableInput() {
        assertThatThrownBy(() -> classifier.classify("not json {"))
                .isInstanceOf(SymbolExtractionException.class);
        assertThatThrownBy(() -> classifier.classify("[1,2,3]"))
                .isInstanceOf(SymbolExtractionException.class);
        assertThatThrownBy(() -> classifier.classify("  "))
                .isInstanceOf(SymbolExtractionException.class);
    }

    @Test
    @DisplayName("duplicate names collapse to the last entry seen")
    void duplicatesLastWins() {
        ClassifiedSet result = classifier.classifyEntries(List.of(
                new SymbolEntry("ifSpeed", "1.1", NodeType.COLUMN, "first"),
                new SymbolEntry("ifAlias", "1.2", NodeType.COLUMN, null),
                new SymbolEntry("ifSpeed", "1.3", NodeType.COLUMN, "second")));

        assertThat(result.metrics()).extracting(SymbolEntry::name).containsExactly("ifAlias", "ifSpeed");
        assertThat(result.metrics().get(1).oid()).isEqualTo("1.3");
        assertThat(result.metrics().get(1).description()).isEqualTo("second");
    }

    @Test
    @DisplayName("empty object classifies to an empty set")
    void emptyTable() {
        assertThat(classifier.classify("{}").isEmpty()).isTrue();
    }
}
