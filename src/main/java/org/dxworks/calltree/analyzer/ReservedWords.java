package org.dxworks.calltree.analyzer;

import java.util.Locale;
import java.util.Set;

/**
 * COBOL verbs and clause keywords that a loose CALL pattern can pick up as a target.
 */
final class ReservedWords {

    private static final Set<String> WORDS = Set.of(
            "LENGTH", "SUBSTR", "INSPECT", "STRING", "UNSTRING",
            "ACCEPT", "DISPLAY", "MOVE", "ADD", "SUBTRACT",
            "MULTIPLY", "DIVIDE", "COMPUTE", "IF", "ELSE",
            "END-IF", "PERFORM", "EXIT", "STOP", "GOBACK",
            "TO", "FROM", "USING", "RETURNING", "GIVING", "BY",
            "INTO", "THROUGH", "THRU", "UNTIL", "VARYING",
            "WITH", "POINTER", "REFERENCE", "CONTENT", "VALUE"
    );

    private ReservedWords() {
    }

    static boolean isReserved(String name) {
        return name != null && WORDS.contains(name.toUpperCase(Locale.ROOT));
    }
}
