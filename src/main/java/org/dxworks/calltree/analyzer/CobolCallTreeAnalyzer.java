package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;
import org.dxworks.calltree.model.CallTreeResult;
import org.dxworks.calltree.model.ProgramType;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Resolves CALL relationships between registered COBOL and CL programs.
 *
 * <p>Register sources with {@link #addProgram}, then call {@link #analyzeCallTree()}.
 * The registry and call cache live as long as the instance. All public methods lock
 * on the instance, so one analyzer may be shared between threads.</p>
 */
public class CobolCallTreeAnalyzer {

    private final ProgramRegistry registry = new ProgramRegistry();
    private final CallCache callCache = new CallCache(registry);
    private final CallTreeBuilder treeBuilder = new CallTreeBuilder(registry, callCache);

    public synchronized void addProgram(String name, String sourceCode) {
        addProgram(name, sourceCode, ProgramType.COBOL);
    }

    /**
     * Registers (or replaces) a program source under its normalized name and drops any
     * calls cached for that name.
     *
     * @param typeHint accepted for callers that know the dialect; extraction always
     *                 classifies the source itself
     */
    public synchronized void addProgram(String name, String sourceCode, ProgramType typeHint) {
        String programName = registry.put(name, sourceCode);
        callCache.invalidate(programName);
    }

    public synchronized CallTreeResult analyzeCallTree() {
        return treeBuilder.analyze();
    }

    public synchronized String printCallTree(CallTreeResult result) {
        Objects.requireNonNull(result, "result");
        return CallTreePrinter.print(result, registry.size());
    }

    public synchronized void printDebugInfo(PrintStream out) {
        out.println("=== Debug Info ===");
        out.println("Registered Programs: " + registry.size());

        for (String programName : registry.names()) {
            List<CallInfo> calls = callCache.getCallsForProgram(programName);
            int length = registry.sourceOf(programName).map(String::length).orElse(0);
            out.println(programName + ": " + calls.size() + " calls, " + length + " chars");
            for (CallInfo call : calls) {
                out.println("  -> " + call.calleeProgram + " (line: " + call.lineNumber + ")");
            }
        }
    }

    public synchronized int getProgramCount() {
        return registry.size();
    }

    public synchronized boolean hasProgram(String name) {
        return registry.contains(ProgramNameNormalizer.normalize(name));
    }

    public synchronized List<String> getProgramNames() {
        return registry.names();
    }

    public synchronized void clearCache() {
        callCache.clear();
    }

    public synchronized void clear() {
        registry.clear();
        callCache.clear();
    }

    synchronized boolean isCached(String name) {
        return callCache.isCached(ProgramNameNormalizer.normalize(name));
    }
}
