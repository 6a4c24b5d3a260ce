package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;
import org.dxworks.calltree.model.CallTreeResult;
import org.dxworks.calltree.model.ProgramNode;
import org.dxworks.calltree.model.ProgramType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the call forest over the registered programs.
 *
 * <p>Roots are the programs no registered program calls. When every program is called by
 * some other one (the graph is made of cycles) the first registered program becomes the
 * single root. Expansion stops at a program already on the current root-to-node path,
 * which is flagged cyclic; the same program can be expanded normally on a sibling path.</p>
 */
public final class CallTreeBuilder {

    private final ProgramRegistry registry;
    private final CallCache callCache;

    public CallTreeBuilder(ProgramRegistry registry, CallCache callCache) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.callCache = Objects.requireNonNull(callCache, "callCache");
    }

    public CallTreeResult analyze() {
        if (registry.isEmpty()) {
            return CallTreeResult.empty();
        }

        List<String> programNames = registry.names();
        List<CallInfo> allCalls = new ArrayList<>();
        Set<String> missingPrograms = new LinkedHashSet<>();

        for (String programName : programNames) {
            List<CallInfo> calls = callCache.getCallsForProgram(programName);
            allCalls.addAll(calls);
            for (CallInfo call : calls) {
                if (!registry.contains(call.calleeProgram)) {
                    missingPrograms.add(call.calleeProgram);
                }
            }
        }

        Set<String> calledPrograms = allCalls.stream()
                .map(call -> call.calleeProgram)
                .collect(Collectors.toSet());
        List<String> rootPrograms = programNames.stream()
                .filter(program -> !calledPrograms.contains(program))
                .collect(Collectors.toCollection(ArrayList::new));

        if (rootPrograms.isEmpty()) {
            rootPrograms.add(programNames.get(0));
        }

        List<ProgramNode> rootNodes = new ArrayList<>();
        for (String rootProgram : rootPrograms) {
            rootNodes.add(buildNode(rootProgram, Set.of()));
        }

        return new CallTreeResult(rootNodes, allCalls, new ArrayList<>(missingPrograms), List.of());
    }

    /**
     * @param visitedPath names on the path from the root down to (excluding) this node
     */
    public ProgramNode buildNode(String programName, Set<String> visitedPath) {
        List<CallInfo> calls = callCache.getCallsForProgram(programName);
        boolean isFound = registry.contains(programName);
        ProgramType type = typeOf(programName);

        if (visitedPath.contains(programName)) {
            return ProgramNode.cyclic(programName, type, calls, isFound);
        }

        Set<String> childPath = new HashSet<>(visitedPath);
        childPath.add(programName);

        List<ProgramNode> children = new ArrayList<>(calls.size());
        for (CallInfo call : calls) {
            children.add(buildNode(call.calleeProgram, childPath));
        }

        return new ProgramNode(programName, type, children, calls, isFound, false);
    }

    // Missing programs have no source to classify and are reported as COBOL.
    private ProgramType typeOf(String programName) {
        return registry.sourceOf(programName)
                .map(DialectClassifier::classify)
                .orElse(ProgramType.COBOL);
    }
}
