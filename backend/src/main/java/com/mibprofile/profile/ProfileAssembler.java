package com.mibprofile.profile;

import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.SymbolEntry;
import com.mibprofile.profile.ProfileDocument.MetricEntry;
import com.mibprofile.profile.ProfileDocument.SymbolRef;
import com.mibprofile.profile.ProfileDocument.TrapEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic structural merge of classified symbols into a {@link ProfileDocument}. Pure: same input, same
 * document; entry order follows the classified (name) order.
 */
@Component
public class ProfileAssembler {

    /**
     * Apply symbol selection and trap description overrides. An empty selection keeps everything.
     */
    public ClassifiedSet prepare(ClassifiedSet classified, ProfileOptions options) {
        Set<String> selected = options.selectedSymbols();
        Map<String, String> overrides = options.trapDescriptions();
        List<SymbolEntry> metrics = classified.metrics().stream()
                .filter(s -> selected.isEmpty() || selected.contains(s.name()))
                .toList();
        List<SymbolEntry> traps = classified.traps().stream()
                .filter(s -> selected.isEmpty() || selected.contains(s.name()))
                .map(s -> overrides.containsKey(s.name())
                        ? new SymbolEntry(s.name(), s.oid(), s.nodeType(), overrides.get(s.name()))
                        : s)
                .toList();
        return new ClassifiedSet(metrics, traps);
    }

    public ProfileDocument assemble(String mibName, ClassifiedSet classified) {
        List<MetricEntry> metrics = classified.metrics().stream()
                .map(s -> new MetricEntry(mibName, new SymbolRef(s.oid(), s.name())))
                .toList();
        List<TrapEntry> traps = classified.traps().stream()
                .map(s -> new TrapEntry(mibName, new SymbolRef(s.oid(), s.name()),
                        s.description() != null ? s.description() : ""))
                .toList();
        return new ProfileDocument(metrics, traps, ProfileDocument.SYSOBJECTID_PLACEHOLDER);
    }
}
