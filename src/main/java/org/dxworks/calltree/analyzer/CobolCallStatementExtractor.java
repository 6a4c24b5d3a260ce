package org.dxworks.calltree.analyzer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * COBOL {@code CALL} statements. Both patterns are anchored at the start of the trimmed
 * line, so a CALL mentioned mid-line (inside a literal, after another verb) is ignored.
 */
public class CobolCallStatementExtractor extends LineCallStatementExtractor {

    private static final String PROGRAM_NAME = "[A-Z0-9\\-_]+";

    // CALL 'PROGRAM-NAME' / CALL "PROGRAM-NAME" [USING ...] [RETURNING ...]
    private static final Pattern QUOTED_CALL = Pattern.compile(
            "^\\s*CALL\\s+['\"](" + PROGRAM_NAME + ")['\"](?:\\s+USING.*?)?(?:\\s+RETURNING.*?)?",
            Pattern.CASE_INSENSITIVE);

    // CALL PROGRAM-NAME [USING ...] [RETURNING ...] [.]  (statement must end the line)
    private static final Pattern BARE_CALL = Pattern.compile(
            "^\\s*CALL\\s+(" + PROGRAM_NAME + ")(?:\\s+USING.*?)?(?:\\s+RETURNING.*?)?(?:\\s*\\.?\\s*$)",
            Pattern.CASE_INSENSITIVE);

    public CobolCallStatementExtractor() {
        super(List.of("*", "//"), List.of(QUOTED_CALL, BARE_CALL));
    }
}
