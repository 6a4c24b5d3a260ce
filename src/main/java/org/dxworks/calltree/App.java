package org.dxworks.calltree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.calltree.analyzer.CobolCallTreeAnalyzer;
import org.dxworks.calltree.model.CallTreeResult;
import org.dxworks.calltree.model.ProgramType;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar calltree.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a COBOL/CL source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Recognised extensions: .cob .cobol .cpy .copy (COBOL), .cl .cle (CL)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        run(input, Paths.get(args[1]), CalltreeConfig.load());
    }

    public static CallTreeResult run(Path input, Path jsonlOutput, CalltreeConfig config) throws IOException {
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting call tree analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        CobolCallTreeAnalyzer analyzer = new CobolCallTreeAnalyzer();
        int errorCount = 0;
        CallTreeResult result;

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeLine(writer, runInfo);

            // Sequential and sorted: registration order decides the fallback root
            int current = 0;
            for (Path file : files) {
                ProgramType type = LanguageDetector.detectLanguage(file).orElse(ProgramType.COBOL);
                current++;
                System.out.println("[" + current + "/" + files.size() + "] Registering " +
                                   type.getName() + ": " + file.getFileName());
                try {
                    registerFile(analyzer, file, type);
                } catch (IOException e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());
                    writeLine(writer, error);

                    errorCount++;
                    System.err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                }
            }

            result = analyzer.analyzeCallTree();

            ObjectNode treeRecord = MAPPER.createObjectNode();
            treeRecord.put("kind", "calltree");
            treeRecord.setAll((ObjectNode) MAPPER.valueToTree(result));
            writeLine(writer, treeRecord);

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("programs_registered", analyzer.getProgramCount());
            doneInfo.put("files_with_errors", errorCount);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Programs registered: " + analyzer.getProgramCount());
        System.out.println("Call sites: " + result.allCalls.size());
        System.out.println("Missing programs: " + result.missingPrograms.size());
        if (errorCount > 0) {
            System.out.println("Errors: " + errorCount);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));

        if (config.isPrintTree()) {
            System.out.println();
            System.out.print(analyzer.printCallTree(result));
        }

        return result;
    }

    public static void registerFile(CobolCallTreeAnalyzer analyzer, Path file, ProgramType type) throws IOException {
        String sourceCode = Files.readString(file, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        analyzer.addProgram(file.getFileName().toString(), sourceCode, type);
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                files.addAll(stream.filter(Files::isRegularFile)
                        .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                        .filter(p -> withinMaxLines(p, maxFileLines))
                        .sorted()
                        .collect(Collectors.toList()));
            }
        } else if (Files.isRegularFile(input)) {
            if (LanguageDetector.detectLanguage(input).isPresent() && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // Unreadable files are kept so that reading them is reported as an error record
            return true;
        }
    }

    private static void writeLine(BufferedWriter writer, Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
        writer.flush();
    }
}
