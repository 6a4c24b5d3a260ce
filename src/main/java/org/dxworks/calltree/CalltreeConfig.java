package org.dxworks.calltree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CalltreeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "calltree-config.yml";
    private static final boolean DEFAULT_PRINT_TREE = true;

    private final int maxFileLines;
    private final boolean printTree;

    private CalltreeConfig(int maxFileLines, boolean printTree) {
        this.maxFileLines = maxFileLines;
        this.printTree = printTree;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isPrintTree() {
        return printTree;
    }

    public static CalltreeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CalltreeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectivePrintTree = (yamlConfig.printTree != null)
                        ? yamlConfig.printTree
                        : DEFAULT_PRINT_TREE;

                return new CalltreeConfig(effectiveMaxFileLines, effectivePrintTree);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CalltreeConfig with(int maxFileLines, boolean printTree) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CalltreeConfig(effectiveMaxFileLines, printTree);
    }

    private static CalltreeConfig defaults() {
        return new CalltreeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_PRINT_TREE);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean printTree;
    }
}
