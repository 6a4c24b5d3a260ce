package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;

import java.util.List;

public interface CallStatementExtractor {
    /**
     * Scans source text line by line and returns the call sites in source order.
     * Returned entries carry an empty caller; a source without CALLs yields an empty list.
     */
    List<CallInfo> extract(String sourceCode);
}
