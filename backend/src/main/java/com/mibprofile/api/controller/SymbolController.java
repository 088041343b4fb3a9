package com.mibprofile.api.controller;

import com.mibprofile.api.dto.ClassifyRequest;
import com.mibprofile.api.dto.ClassifyResponse;
import com.mibprofile.domain.ClassifiedSet;
import com.mibprofile.domain.SymbolEntry;
import com.mibprofile.generation.SymbolAnnotationClient;
import com.mibprofile.symbol.SymbolClassifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.stream.Stream;

/**
 * POST /symbols/classify. Annotation calls the generation service, so annotated requests run on the bounded
 * elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/symbols")
@RequiredArgsConstructor
public class SymbolController {

    private final SymbolClassifier symbolClassifier;
    private final SymbolAnnotationClient symbolAnnotationClient;

    @PostMapping("/classify")
    public Mono<ResponseEntity<ClassifyResponse>> classify(@Valid @RequestBody ClassifyRequest request) {
        String mibName = request.mibName().trim();
        ClassifiedSet classified = symbolClassifier.classify(request.symbols());
        if (!Boolean.TRUE.equals(request.annotate()) || classified.isEmpty()) {
            return Mono.just(ResponseEntity.ok(ClassifyResponse.of(mibName, classified)));
        }
        List<SymbolEntry> symbols = Stream.concat(classified.metrics().stream(), classified.traps().stream()).toList();
        return Mono.fromCallable(() -> symbolAnnotationClient.annotate(mibName, symbols))
                .subscribeOn(Schedulers.boundedElastic())
                .map(answered -> ResponseEntity.ok(ClassifyResponse.of(mibName, classified, answered)));
    }
}
