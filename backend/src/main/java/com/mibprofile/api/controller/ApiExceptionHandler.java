package com.mibprofile.api.controller;

import com.mibprofile.api.dto.ErrorBody;
import com.mibprofile.symbol.SymbolExtractionException;
import com.mibprofile.template.sync.TemplateSyncListingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) to 400, extraction failures to 422 and sync listing failures to 502, all with
 * ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(SymbolExtractionException.class)
    public ResponseEntity<ErrorBody> handleExtraction(SymbolExtractionException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of("EXTRACTION_FAILED", ex.getMessage()));
    }

    @ExceptionHandler(TemplateSyncListingException.class)
    public ResponseEntity<ErrorBody> handleSyncListing(TemplateSyncListingException ex) {
        log.error("Template sync request aborted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("SYNC_LISTING_FAILED", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_MIB_NAME" -> "MIB name must be a module name (letters, digits, '.', '_', '-')";
            case "MISSING_SYMBOLS" -> "Symbol table is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
