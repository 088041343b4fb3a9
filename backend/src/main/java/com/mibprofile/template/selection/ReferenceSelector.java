package com.mibprofile.template.selection;

import java.util.List;

/**
 * Picks the reference template that best fits a target MIB.
 */
public interface ReferenceSelector {

    /**
     * Select one path for the target.
     *
     * @param targetName     MIB module name, e.g. "IF-MIB"
     * @param candidatePaths cached template paths; order is the tie-break of last resort
     * @return a member of {@code candidatePaths}, or the fixed fallback path; never null, never throws
     */
    String select(String targetName, List<String> candidatePaths);
}
