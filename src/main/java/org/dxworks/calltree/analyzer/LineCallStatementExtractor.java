package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented CALL scanner shared by the dialect extractors.
 * Each non-comment line is trimmed and run through every pattern in order; group 1 of
 * each match is the callee. Several patterns may match the same line.
 */
abstract class LineCallStatementExtractor implements CallStatementExtractor {

    private final List<String> commentPrefixes;
    private final List<Pattern> callPatterns;

    protected LineCallStatementExtractor(List<String> commentPrefixes, List<Pattern> callPatterns) {
        this.commentPrefixes = List.copyOf(commentPrefixes);
        this.callPatterns = List.copyOf(callPatterns);
    }

    @Override
    public List<CallInfo> extract(String sourceCode) {
        List<CallInfo> calls = new ArrayList<>();
        if (sourceCode == null || sourceCode.isEmpty()) {
            return calls;
        }

        String[] lines = sourceCode.split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            String trimmedLine = lines[index].trim();
            if (trimmedLine.isEmpty() || isComment(trimmedLine)) {
                continue;
            }

            for (Pattern pattern : callPatterns) {
                Matcher matcher = pattern.matcher(trimmedLine);
                while (matcher.find()) {
                    String calleeName = matcher.group(1).toUpperCase(Locale.ROOT);
                    if (!ReservedWords.isReserved(calleeName)) {
                        calls.add(CallInfo.unattributed(calleeName, index + 1, trimmedLine));
                    }
                }
            }
        }
        return calls;
    }

    private boolean isComment(String trimmedLine) {
        for (String prefix : commentPrefixes) {
            if (trimmedLine.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
