package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;
import org.dxworks.calltree.model.ProgramType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-program memo of extracted call sites, scoped to one analyzer.
 * Unregistered names yield an empty list and are not cached, so a later registration is seen.
 */
public final class CallCache {

    private static final Map<ProgramType, CallStatementExtractor> EXTRACTORS = new EnumMap<>(ProgramType.class);

    static {
        EXTRACTORS.put(ProgramType.COBOL, new CobolCallStatementExtractor());
        EXTRACTORS.put(ProgramType.CL, new ClCallStatementExtractor());
    }

    private final ProgramRegistry registry;
    private final Map<String, List<CallInfo>> callsByProgram = new HashMap<>();

    public CallCache(ProgramRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public List<CallInfo> getCallsForProgram(String programName) {
        List<CallInfo> cached = callsByProgram.get(programName);
        if (cached != null) {
            return cached;
        }

        Optional<String> source = registry.sourceOf(programName);
        if (source.isEmpty()) {
            return List.of();
        }

        CallStatementExtractor extractor = EXTRACTORS.get(DialectClassifier.classify(source.get()));
        List<CallInfo> calls = new ArrayList<>();
        for (CallInfo call : extractor.extract(source.get())) {
            calls.add(call.withCallerProgram(programName));
        }

        List<CallInfo> result = List.copyOf(calls);
        callsByProgram.put(programName, result);
        return result;
    }

    public boolean isCached(String programName) {
        return callsByProgram.containsKey(programName);
    }

    public void invalidate(String programName) {
        callsByProgram.remove(programName);
    }

    public void clear() {
        callsByProgram.clear();
    }
}
