package org.dxworks.calltree.analyzer;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical program identifiers: known source extensions stripped, upper-cased, trimmed.
 * "custinq.cbl " is not stripped (.cbl is not a registered extension) but "custinq.cob " is.
 */
public final class ProgramNameNormalizer {

    private static final Pattern SOURCE_EXTENSION =
            Pattern.compile("\\.(cob|cobol|cpy|copy|cl|cle)$", Pattern.CASE_INSENSITIVE);

    private ProgramNameNormalizer() {
        // utility class
    }

    public static String normalize(String name) {
        if (name == null) return "";

        // Strip until stable so that normalize(normalize(x)) == normalize(x),
        // e.g. "A.CPY.COB" or "A.cob " need more than one pass.
        String current = name.trim();
        while (true) {
            Matcher matcher = SOURCE_EXTENSION.matcher(current);
            if (!matcher.find()) {
                break;
            }
            current = current.substring(0, matcher.start()).trim();
        }
        return current.toUpperCase(Locale.ROOT);
    }
}
