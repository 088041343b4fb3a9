package com.mibprofile.api.controller;

import com.mibprofile.api.dto.ErrorBody;
import com.mibprofile.api.dto.ProfileRequest;
import com.mibprofile.domain.Profile;
import com.mibprofile.profile.ProfileOptions;
import com.mibprofile.profile.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * POST /profiles: build a monitoring profile from a symbol table or raw MIB source. Builds compile MIBs, read the
 * template cache and may call the generation service, so they run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @PostMapping
    public Mono<ResponseEntity<?>> build(@Valid @RequestBody ProfileRequest request) {
        if ((request.symbols() == null || request.symbols().isNull())
                && (request.mibSource() == null || request.mibSource().isBlank())) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("MISSING_SYMBOLS", "Either symbols or mibSource is required")));
        }
        if (request.selectedSymbols() != null && request.selectedSymbols().contains(null)) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_SELECTED_SYMBOL", "selectedSymbols must not contain null")));
        }
        if (request.trapDescriptions() != null && request.trapDescriptions().containsValue(null)) {
            return Mono.just(ResponseEntity.badRequest()
                    .body(ErrorBody.of("INVALID_TRAP_DESCRIPTION", "trapDescriptions values must not be null")));
        }
        ProfileOptions options = new ProfileOptions(
                request.selectedSymbols() != null ? new HashSet<>(request.selectedSymbols()) : Set.of(),
                request.trapDescriptions() != null ? request.trapDescriptions() : Map.of(),
                Boolean.TRUE.equals(request.augmented()));
        String mibName = request.mibName().trim();
        return Mono.fromCallable(() -> build(mibName, request, options))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(ResponseEntity::ok);
    }

    private Profile build(String mibName, ProfileRequest request, ProfileOptions options) {
        if (request.symbols() != null && !request.symbols().isNull()) {
            return profileService.buildFromSymbolTable(mibName, request.symbols(), options);
        }
        return profileService.buildFromMibSource(mibName, request.mibSource(), options);
    }
}
