package com.mibprofile.template.sync;

/**
 * Published after every sync run, including aborted ones.
 */
public record TemplateSyncCompletedEvent(SyncRunResult result) {
}
