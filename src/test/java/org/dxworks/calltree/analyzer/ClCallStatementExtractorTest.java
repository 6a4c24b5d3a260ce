package org.dxworks.calltree.analyzer;

import org.dxworks.calltree.model.CallInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClCallStatementExtractorTest {

    private final ClCallStatementExtractor extractor = new ClCallStatementExtractor();

    @Test
    void extractsCallPgm() {
        List<CallInfo> calls = extractor.extract(String.join("\n",
                "PGM",
                "/* CALL PGM(OLD) */",
                "CALL PGM(Q)",
                "ENDPGM"));

        assertEquals(List.of("Q"), callees(calls));
        assertEquals(3, calls.get(0).lineNumber);
        assertEquals("CALL PGM(Q)", calls.get(0).callStatement);
    }

    @Test
    void extractsCallPgmWithSpacingAndParameters() {
        List<CallInfo> calls = extractor.extract("CALL PGM( ORDENTRY ) PARM(&DATE &USER)");

        assertEquals(List.of("ORDENTRY"), callees(calls));
    }

    @Test
    void extractsQuotedCall() {
        assertEquals(List.of("RPT01"), callees(extractor.extract("CALL 'RPT01' PARM(&X)")));
    }

    @Test
    void keepsProgramPartOfLibraryQualifiedCall() {
        assertEquals(List.of("BATCHRPT"), callees(extractor.extract("CALL BATCHRPT.QGPL")));
    }

    @Test
    void extractsBareCall() {
        assertEquals(List.of("CLEANUP"), callees(extractor.extract("CALL CLEANUP")));
        assertEquals(List.of("CLEANUP"), callees(extractor.extract("CALL CLEANUP PARM(&A)")));
    }

    @Test
    void findsCallsNestedInCommands() {
        List<CallInfo> calls = extractor.extract("IF COND(&RC *EQ 0) THEN(CALL PGM(NEXTSTEP))");

        assertEquals(List.of("NEXTSTEP"), callees(calls));
    }

    @Test
    void skipsCommentLines() {
        assertTrue(extractor.extract("/* CALL PGM(A) */\n// CALL B").isEmpty());
    }

    @Test
    void dropsReservedWords() {
        assertTrue(extractor.extract("CALL MOVE").isEmpty());
    }

    private static List<String> callees(List<CallInfo> calls) {
        return calls.stream().map(c -> c.calleeProgram).collect(Collectors.toList());
    }
}
