package com.mibprofile.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.Profile;
import com.mibprofile.generation.GenerationRequest;
import com.mibprofile.generation.ProfileGenerationClient;
import com.mibprofile.symbol.SymbolClassifier;
import com.mibprofile.symbol.SymbolExtractionException;
import com.mibprofile.symbol.compiler.MibCompiler;
import com.mibprofile.template.cache.TemplateCache;
import com.mibprofile.template.selection.ReferenceSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a profile: classify symbols, pick a reference template from the cache, assemble and render. Augmented
 * builds hand the result to the generation collaborator and pass its answer through untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileService {

    private final SymbolClassifier symbolClassifier;
    private final MibCompiler mibCompiler;
    private final TemplateCache templateCache;
    private final ReferenceSelector referenceSelector;
    private final ProfileAssembler profileAssembler;
    private final ProfileYamlRenderer profileYamlRenderer;
    private final ProfileGenerationClient profileGenerationClient;

    /**
     * @throws SymbolExtractionException when the compiler yields no symbol table or no metric/trap symbol
     */
    public Profile buildFromMibSource(String mibName, String mibSource, ProfileOptions options) {
        JsonNode symbolTable = mibCompiler.compileSource(mibName, mibSource)
                .orElseThrow(() -> new SymbolExtractionException("MIB " + mibName + " could not be compiled"));
        return buildFromSymbolTable(mibName, symbolTable, options);
    }

    /**
     * @throws SymbolExtractionException when the table is unreadable or has no metric/trap symbol
     */
    public Profile buildFromSymbolTable(String mibName, JsonNode symbolTable, ProfileOptions options) {
        return build(mibName, symbolClassifier.classify(symbolTable), options);
    }

    public Profile build(String mibName, ClassifiedSet classified, ProfileOptions options) {
        if (classified.isEmpty()) {
            throw new SymbolExtractionException("MIB " + mibName + " has no metric or trap symbols");
        }
        ClassifiedSet prepared = profileAssembler.prepare(classified, options);

        List<String> candidates = new ArrayList<>(templateCache.listPaths());
        String referencePath = referenceSelector.select(mibName, candidates);
        log.debug("Profile {}: reference {} out of {} cached templates", mibName, referencePath, candidates.size());

        String content = profileYamlRenderer.render(profileAssembler.assemble(mibName, prepared));
        if (options.augmented()) {
            content = augment(mibName, referencePath, prepared).orElse(content);
        }
        return new Profile(mibName, prepared.metrics(), prepared.traps(), referencePath, content);
    }

    private Optional<String> augment(String mibName, String referencePath, ClassifiedSet prepared) {
        String referenceContent = templateCache.get(referencePath).orElse("");
        Optional<String> generated = profileGenerationClient.generate(
                new GenerationRequest(mibName, referenceContent, prepared.metrics(), prepared.traps()));
        if (generated.isEmpty()) {
            log.warn("Profile {}: generation returned nothing, using deterministic document", mibName);
        }
        return generated;
    }
}
