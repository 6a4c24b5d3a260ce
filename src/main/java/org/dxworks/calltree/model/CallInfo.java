package org.dxworks.calltree.model;

import java.util.Objects;

/**
 * One textual CALL site. {@code callerProgram} is empty straight out of an extractor
 * and gets stamped with the owning program's name by the call cache.
 */
public class CallInfo {
    public final String callerProgram;
    public final String calleeProgram;
    public final int lineNumber; // 1-based
    public final String callStatement;

    public CallInfo(String callerProgram, String calleeProgram, int lineNumber, String callStatement) {
        this.callerProgram = callerProgram == null ? "" : callerProgram;
        this.calleeProgram = Objects.requireNonNull(calleeProgram, "calleeProgram");
        this.lineNumber = lineNumber;
        this.callStatement = callStatement == null ? "" : callStatement;
    }

    public static CallInfo unattributed(String calleeProgram, int lineNumber, String callStatement) {
        return new CallInfo("", calleeProgram, lineNumber, callStatement);
    }

    public CallInfo withCallerProgram(String callerProgram) {
        return new CallInfo(callerProgram, calleeProgram, lineNumber, callStatement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallInfo)) return false;
        CallInfo other = (CallInfo) o;
        return lineNumber == other.lineNumber
                && callerProgram.equals(other.callerProgram)
                && calleeProgram.equals(other.calleeProgram)
                && callStatement.equals(other.callStatement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callerProgram, calleeProgram, lineNumber, callStatement);
    }

    @Override
    public String toString() {
        return callerProgram + " -> " + calleeProgram + " (line " + lineNumber + ")";
    }
}
