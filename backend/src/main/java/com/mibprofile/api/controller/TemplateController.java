package com.mibprofile.api.controller;

import com.mibprofile.api.dto.SelectionResponse;
import com.mibprofile.domain.TemplateSyncStatus;
import com.mibprofile.template.cache.TemplateCache;
import com.mibprofile.template.selection.ReferenceSelector;
import com.mibprofile.template.sync.SyncRunResult;
import com.mibprofile.template.sync.TemplateSyncStatusRecorder;
import com.mibprofile.template.sync.TemplateSyncWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;

/**
 * POST /templates/sync (run one sync now), GET /templates/sync/status, GET /templates/select.
 * Handlers call blocking collaborators (remote listing, Mongo, optional LLM selection), so each one runs on the
 * bounded elastic scheduler instead of the event loop.
 */
@RestController
@RequestMapping("/api/v1/templates")
@RequiredArgsConstructor
public class TemplateController {

    private final TemplateSyncWorker templateSyncWorker;
    private final TemplateSyncStatusRecorder templateSyncStatusRecorder;
    private final TemplateCache templateCache;
    private final ReferenceSelector referenceSelector;

    @PostMapping("/sync")
    public Mono<ResponseEntity<SyncRunResult>> sync() {
        return Mono.fromCallable(templateSyncWorker::runOnce)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/sync/status")
    public Mono<ResponseEntity<TemplateSyncStatus>> status() {
        return Mono.fromCallable(() -> templateSyncStatusRecorder.latest()
                        .map(ResponseEntity::ok)
                        .orElse(ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/select")
    public Mono<ResponseEntity<SelectionResponse>> select(@RequestParam String target) {
        return Mono.fromCallable(() -> {
                    String path = referenceSelector.select(target, new ArrayList<>(templateCache.listPaths()));
                    return ResponseEntity.ok(new SelectionResponse(target, path));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
