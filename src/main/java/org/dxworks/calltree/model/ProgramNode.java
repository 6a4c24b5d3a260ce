package org.dxworks.calltree.model;

import java.util.List;

/**
 * A program in the call forest. {@code cyclic} means the name already appears on the
 * path from the root to this node; such nodes are never expanded.
 */
public class ProgramNode {
    public final String name;
    public final ProgramType type;
    public final List<ProgramNode> children;
    public final List<CallInfo> calls;
    public final boolean isFound;
    public final boolean cyclic;

    public ProgramNode(String name, ProgramType type, List<ProgramNode> children,
                       List<CallInfo> calls, boolean isFound, boolean cyclic) {
        this.name = name;
        this.type = type;
        this.children = List.copyOf(children);
        this.calls = List.copyOf(calls);
        this.isFound = isFound;
        this.cyclic = cyclic;
    }

    public static ProgramNode cyclic(String name, ProgramType type, List<CallInfo> calls, boolean isFound) {
        return new ProgramNode(name, type, List.of(), calls, isFound, true);
    }
}
