package com.mibprofile.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileOptionsTest {

    @Test
    @DisplayName("null selections and overrides mean none")
    void nullsAreEmpty() {
        ProfileOptions options = new ProfileOptions(null, null, false);

        assertThat(options.selectedSymbols()).isEmpty();
        assertThat(options.trapDescriptions()).isEmpty();
    }

    @Test
    @DisplayName("null symbol names are dropped from the selection")
    void nullSymbolNameIgnored() {
        Set<String> selected = new HashSet<>(Arrays.asList("ifInOctets", null));

        ProfileOptions options = new ProfileOptions(selected, Map.of(), false);

        assertThat(options.selectedSymbols()).containsExactly("ifInOctets");
    }

    @Test
    @DisplayName("trap overrides with a null description are dropped")
    void nullTrapDescriptionIgnored() {
        Map<String, String> overrides = new HashMap<>();
        overrides.put("linkDown", "Link lost");
        overrides.put("linkUp", null);

        ProfileOptions options = new ProfileOptions(Set.of(), overrides, false);

        assertThat(options.trapDescriptions()).containsExactly(Map.entry("linkDown", "Link lost"));
    }

    @Test
    @DisplayName("options are a snapshot of the caller's collections")
    void defensiveCopy() {
        Set<String> selected = new HashSet<>(Set.of("ifInOctets"));
        ProfileOptions options = new ProfileOptions(selected, Map.of(), false);

        selected.add("ifOutOctets");

        assertThat(options.selectedSymbols()).containsExactly("ifInOctets");
    }
}
