package com.mibprofile.generation;

import com.mibprofile.domain.NodeType;
import com.mibprofile.domain.SymbolEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmSymbolAnnotationClientTest {

    @Mock
    TextGenerationClient textGenerationClient;

    private static final List<SymbolEntry> SYMBOLS = List.of(
            new SymbolEntry("ifInOctets", "1.3.6.1.2.1.2.2.1.10", NodeType.COLUMN, null),
            new SymbolEntry("linkDown", "1.3.6.1.6.3.1.1.5.3", NodeType.NOTIFICATION, null));

    @Test
    @DisplayName("answer wrapped in prose is read and keyed by symbol")
    void annotate() {
        when(textGenerationClient.complete(anyString())).thenReturn(Optional.of("""
                Here you go:
                {"ifInOctets": {"desc": "Octets received", "importance": "High"},
                 "linkDown": {"desc": "Link went down", "importance": "Low"}}
                """));

        Map<String, SymbolAnnotation> annotations =
                new LlmSymbolAnnotationClient(textGenerationClient, 50).annotate("IF-MIB", SYMBOLS);

        assertThat(annotations)
                .containsEntry("ifInOctets", new SymbolAnnotation("Octets received", "High"))
                .containsEntry("linkDown", new SymbolAnnotation("Link went down", "Low"));
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGenerationClient).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("IF-MIB").contains("ifInOctets\nlinkDown\n").contains("High/Low");
    }

    @Test
    @DisplayName("symbols that were not asked for and non-object entries are dropped; missing fields default")
    void parseFiltersAndDefaults() {
        Map<String, SymbolAnnotation> annotations = LlmSymbolAnnotationClient.parse(
                "{\"ifInOctets\":{\"desc\":\"Octets\"},\"sysUpTime\":{\"desc\":\"x\"},\"linkDown\":\"High\"}",
                Set.of("ifInOctets", "linkDown"));

        assertThat(annotations).containsOnlyKeys("ifInOctets");
        assertThat(annotations.get("ifInOctets")).isEqualTo(new SymbolAnnotation("Octets", "-"));
    }

    @Test
    @DisplayName("no answer, unreadable answer or a failing client give no annotations")
    void softFailure() {
        LlmSymbolAnnotationClient client = new LlmSymbolAnnotationClient(textGenerationClient, 50);

        when(textGenerationClient.complete(anyString())).thenReturn(Optional.empty());
        assertThat(client.annotate("IF-MIB", SYMBOLS)).isEmpty();

        when(textGenerationClient.complete(anyString())).thenReturn(Optional.of("I cannot help with that."));
        assertThat(client.annotate("IF-MIB", SYMBOLS)).isEmpty();

        when(textGenerationClient.complete(anyString())).thenReturn(Optional.of("{\"ifInOctets\": {\"desc\": "));
        assertThat(client.annotate("IF-MIB", SYMBOLS)).isEmpty();

        when(textGenerationClient.complete(anyString())).thenThrow(new IllegalStateException("connection reset"));
        assertThat(client.annotate("IF-MIB", SYMBOLS)).isEmpty();
    }

    @Test
    @DisplayName("only the first maxSymbols symbols are sent; no symbols means no call")
    void limit() {
        List<SymbolEntry> many = IntStream.range(0, 5)
                .mapToObj(i -> new SymbolEntry("sym" + i, "1.3.6." + i, NodeType.SCALAR, null))
                .toList();
        when(textGenerationClient.complete(anyString())).thenReturn(Optional.of("{}"));

        new LlmSymbolAnnotationClient(textGenerationClient, 2).annotate("X-MIB", many);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGenerationClient).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("sym0\nsym1\n").doesNotContain("sym2");
    }

    @Test
    @DisplayName("empty symbol list is not sent")
    void emptySymbols() {
        assertThat(new LlmSymbolAnnotationClient(textGenerationClient, 50).annotate("IF-MIB", List.of())).isEmpty();
        verifyNoInteractions(textGenerationClient);
    }
}
