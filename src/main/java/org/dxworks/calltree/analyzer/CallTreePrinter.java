package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallTreeResult;
import org.dxworks.calltree.model.ProgramNode;
import org.dxworks.calltree.model.ProgramType;

/**
 * Plain-text rendering of a call forest: summary counts, the missing programs, then each
 * root tree indented two spaces per level. Found programs are marked {@code +}, missing
 * ones {@code x}. Subtrees below {@link #MAX_DEPTH} are not printed even when built.
 */
public final class CallTreePrinter {

    public static final int MAX_DEPTH = 10;

    private CallTreePrinter() {
        // utility class
    }

    public static String print(CallTreeResult result, int totalPrograms) {
        StringBuilder output = new StringBuilder();
        output.append("=== COBOL Call Tree Analysis ===\n\n");

        output.append("Total Programs: ").append(totalPrograms).append('\n');
        output.append("Total Calls: ").append(result.allCalls.size()).append('\n');
        output.append("Missing Programs: ").append(result.missingPrograms.size()).append('\n');
        output.append("Root Programs: ").append(result.rootNodes.size()).append("\n\n");

        if (!result.missingPrograms.isEmpty()) {
            output.append("Missing Programs:\n");
            for (String program : result.missingPrograms) {
                output.append("  - ").append(program).append('\n');
            }
            output.append('\n');
        }

        output.append("Call Tree Structure:\n");
        for (ProgramNode rootNode : result.rootNodes) {
            printNode(rootNode, 0, output);
        }
        return output.toString();
    }

    private static void printNode(ProgramNode node, int depth, StringBuilder output) {
        output.append("  ".repeat(depth))
                .append(node.isFound ? '+' : 'x')
                .append(' ')
                .append(node.name)
                .append(node.type == ProgramType.CL ? " [CL]" : " [COBOL]");
        if (node.cyclic) {
            output.append(" (CYCLIC)");
        }
        output.append('\n');

        if (depth < MAX_DEPTH) {
            for (ProgramNode child : node.children) {
                printNode(child, depth + 1, output);
            }
        }
    }
}
