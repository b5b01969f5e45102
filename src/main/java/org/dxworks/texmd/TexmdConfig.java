package org.dxworks.texmd;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.texmd.latex.LatexContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TexmdConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "texmd-config.yml";

    private final int maxFileLines;
    private final Map<String, String> macros;
    private final Map<String, String> environments;

    private TexmdConfig(int maxFileLines, Map<String, String> macros, Map<String, String> environments) {
        this.maxFileLines = maxFileLines;
        this.macros = Collections.unmodifiableMap(macros);
        this.environments = Collections.unmodifiableMap(environments);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Extra macro argument specs, layered over the built-in table.
     */
    public Map<String, String> getMacros() {
        return macros;
    }

    public Map<String, String> getEnvironments() {
        return environments;
    }

    public LatexContext latexContext() {
        return LatexContext.defaultContext().extendedWith(macros, environments);
    }

    public static TexmdConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TexmdConfig load(Path configPath) {
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
                return new TexmdConfig(effectiveMaxFileLines,
                        validSpecs(yamlConfig.macros, "macro"),
                        validSpecs(yamlConfig.environments, "environment"));
            }
        } catch (IOException e) {
            System.err.println("[TexmdConfig] Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static TexmdConfig with(int maxFileLines, Map<String, String> macros, Map<String, String> environments) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new TexmdConfig(effectiveMaxFileLines,
                validSpecs(macros, "macro"),
                validSpecs(environments, "environment"));
    }

    private static TexmdConfig defaults() {
        return new TexmdConfig(DEFAULT_MAX_FILE_LINES, Map.of(), Map.of());
    }

    private static Map<String, String> validSpecs(Map<String, String> specs, String what) {
        Map<String, String> valid = new LinkedHashMap<>();
        if (specs == null) {
            return valid;
        }
        for (Map.Entry<String, String> e : specs.entrySet()) {
            String spec = e.getValue() == null ? "" : e.getValue();
            if (e.getKey() == null || !LatexContext.isValidSpec(spec)) {
                System.err.println("[TexmdConfig] Ignoring invalid " + what + " spec '" + spec + "' for " + e.getKey());
                continue;
            }
            valid.put(e.getKey(), spec);
        }
        return valid;
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Map<String, String> macros;
        public Map<String, String> environments;
    }
}
