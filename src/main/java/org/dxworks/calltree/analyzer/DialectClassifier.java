package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.ProgramType;

import java.util.regex.Pattern;

/**
 * Heuristic dialect detection from source text.
 *
 * <p>A source is CL when it contains the literal token {@code "PGM "} (the CL program
 * header, case-sensitive) or a {@code CALL PGM(...)} command (any case). Everything else
 * is COBOL. A COBOL program mentioning {@code "PGM "} in a comment or literal is
 * misclassified; this is accepted.</p>
 */
public final class DialectClassifier {

    private static final String CL_PROGRAM_TOKEN = "PGM ";
    private static final Pattern CL_CALL_PGM = Pattern.compile("CALL\\s+PGM\\s*\\(", Pattern.CASE_INSENSITIVE);

    private DialectClassifier() {
        // utility class
    }

    public static ProgramType classify(String sourceCode) {
        if (sourceCode == null) return ProgramType.COBOL;

        if (sourceCode.contains(CL_PROGRAM_TOKEN) || CL_CALL_PGM.matcher(sourceCode).find()) {
            return ProgramType.CL;
        }
        return ProgramType.COBOL;
    }
}
