package org.dxworks.calltree.analyzer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * CL {@code CALL} commands. Unlike COBOL these are not anchored: a CALL nested in
 * {@code IF ... THEN(CALL PGM(X))} is found, and a line may carry more than one.
 */
public class ClCallStatementExtractor extends LineCallStatementExtractor {

    private static final String PROGRAM_NAME = "[A-Z0-9\\-_]+";

    // CALL PGM(PROGRAM-NAME)
    private static final Pattern CALL_PGM = Pattern.compile(
            "CALL\\s+PGM\\s*\\(\\s*(" + PROGRAM_NAME + ")\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    // CALL 'PROGRAM-NAME' [PARM(...)]
    private static final Pattern QUOTED_CALL = Pattern.compile(
            "CALL\\s+['\"](" + PROGRAM_NAME + ")['\"](?:\\s+PARM.*?)?",
            Pattern.CASE_INSENSITIVE);

    // CALL PROGRAM-NAME.LIBRARY, only the program part is kept
    private static final Pattern LIBRARY_QUALIFIED_CALL = Pattern.compile(
            "CALL\\s+(" + PROGRAM_NAME + ")\\.(" + PROGRAM_NAME + ")(?:\\s|$)",
            Pattern.CASE_INSENSITIVE);

    // CALL PROGRAM-NAME [PARM(...)]
    private static final Pattern BARE_CALL = Pattern.compile(
            "CALL\\s+(" + PROGRAM_NAME + ")(?:\\s+PARM.*?)?(?:\\s|$)",
            Pattern.CASE_INSENSITIVE);

    public ClCallStatementExtractor() {
        super(List.of("/*", "//"), List.of(CALL_PGM, QUOTED_CALL, LIBRARY_QUALIFIED_CALL, BARE_CALL));
    }
}
