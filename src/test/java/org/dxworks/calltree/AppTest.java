package org.dxworks.calltree;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.calltree.model.CallTreeResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void analyzesSampleCorpusIntoJsonl() throws Exception {
        Path output = tempDir.resolve("out/calltree.jsonl");

        CallTreeResult result = App.run(Paths.get("src/test/resources/samples"), output,
                CalltreeConfig.with(20000, false));

        // cl/ sorts before cobol/, so NIGHTLY is registered first
        assertEquals(List.of("NIGHTLY", "MAINMENU"),
                result.rootNodes.stream().map(n -> n.name).collect(Collectors.toList()));
        assertEquals(List.of("BATCHRPT", "PRICING"), result.missingPrograms);

        List<JsonNode> records = TestUtils.readJsonLines(output);
        assertEquals(List.of("run", "calltree", "done"),
                records.stream().map(r -> r.get("kind").asText()).collect(Collectors.toList()));

        assertEquals(5, records.get(0).get("total_files").asInt());

        JsonNode tree = records.get(1);
        assertEquals(8, tree.get("allCalls").size());
        assertEquals("NIGHTLY", tree.get("rootNodes").get(0).get("name").asText());
        assertEquals("CL", tree.get("rootNodes").get(0).get("type").asText());
        assertTrue(tree.get("rootNodes").get(0).get("isFound").asBoolean());
        assertEquals(0, tree.get("cyclicReferences").size());

        assertEquals(5, records.get(2).get("programs_registered").asInt());
        assertEquals(0, records.get(2).get("files_with_errors").asInt());
    }

    @Test
    void skipsUnrecognisedAndOversizedFiles() throws Exception {
        Files.writeString(tempDir.resolve("main.cob"), "       CALL 'SUB1'.\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("sub1.COB"), "       GOBACK.\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("notes.txt"), "CALL 'NOTES'.\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("big.cob"), "A\nB\nC\nCALL 'HUGE'.\n", StandardCharsets.UTF_8);

        List<Path> files = App.collectSourceFiles(tempDir, 3);

        assertEquals(List.of("main.cob", "sub1.COB"),
                files.stream().map(p -> p.getFileName().toString()).collect(Collectors.toList()));
    }

    @Test
    void registersFileUnderNormalizedNameWithoutBom() throws Exception {
        Files.writeString(tempDir.resolve("main.cob"), "\uFEFFCALL 'SUB1'.\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("sub1.cob"), "GOBACK.\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("calltree.jsonl");

        CallTreeResult result = App.run(tempDir, output, CalltreeConfig.with(100, false));

        assertEquals(1, result.rootNodes.size());
        assertEquals("MAIN", result.rootNodes.get(0).name);
        assertTrue(result.rootNodes.get(0).children.get(0).isFound);
        assertTrue(result.missingPrograms.isEmpty());
    }

    @Test
    void unreadableFileBecomesErrorRecord() throws Exception {
        Files.writeString(tempDir.resolve("main.cob"), "CALL 'SUB1'.\n", StandardCharsets.UTF_8);
        Files.write(tempDir.resolve("broken.cob"), new byte[]{(byte) 0xC3, (byte) 0x28, '\n'});
        Path output = tempDir.resolve("calltree.jsonl");

        CallTreeResult result = App.run(tempDir, output, CalltreeConfig.with(100, false));

        assertEquals(List.of("SUB1"), result.missingPrograms);

        List<JsonNode> records = TestUtils.readJsonLines(output);
        assertEquals(List.of("run", "error", "calltree", "done"),
                records.stream().map(r -> r.get("kind").asText()).collect(Collectors.toList()));
        assertTrue(records.get(1).get("file").asText().endsWith("broken.cob"));
        assertEquals(1, records.get(3).get("files_with_errors").asInt());
        assertEquals(1, records.get(3).get("programs_registered").asInt());
    }
}
