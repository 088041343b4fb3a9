package com.mibprofile.template.sync;

import lombok.Getter;

/**
 * Thrown when a sync run cannot fetch the authoritative listing; the run is aborted before any item is fetched.
 * API layer maps to 502 SYNC_LISTING_FAILED.
 */
@Getter
public class TemplateSyncListingException extends RuntimeException {

    /** FAILED result recorded for the aborted run. */
    private final SyncRunResult result;

    public TemplateSyncListingException(String message, Throwable cause, SyncRunResult result) {
        super(message, cause);
        this.result = result;
    }
}
