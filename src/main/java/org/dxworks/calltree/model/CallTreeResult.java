package org.dxworks.calltree.model;

import java.util.List;

public class CallTreeResult {
    public final List<ProgramNode> rootNodes;
    public final List<CallInfo> allCalls;
    public final List<String> missingPrograms;
    // Declared for consumers but not populated; cycles are reported on the nodes themselves.
    public final List<List<String>> cyclicReferences;

    public CallTreeResult(List<ProgramNode> rootNodes, List<CallInfo> allCalls,
                          List<String> missingPrograms, List<List<String>> cyclicReferences) {
        this.rootNodes = List.copyOf(rootNodes);
        this.allCalls = List.copyOf(allCalls);
        this.missingPrograms = List.copyOf(missingPrograms);
        this.cyclicReferences = List.copyOf(cyclicReferences);
    }

    public static CallTreeResult empty() {
        return new CallTreeResult(List.of(), List.of(), List.of(), List.of());
    }
}
