package org.dxworks.trustforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class TrustforgeConfig {

    private static final String CONFIG_FILE_NAME = "trustforge-config.yml";
    private static final String DEFAULT_THEME_PATH = "themes/neutral.yaml";
    private static final String DEFAULT_OUT_DIR = "out";
    private static final String DEFAULT_TEMPLATES_DIR = "templates";
    private static final String DEFAULT_POLICIES_DIR = "policies";
    private static final String DEFAULT_LATEX_ENGINE = "xelatex";
    private static final int DEFAULT_LATEX_TIMEOUT_SECONDS = 300;

    static final String ENV_THEME = "TRUSTFORGE_THEME";
    static final String ENV_OUT = "TRUSTFORGE_OUT";

    private final String themePath;
    private final Path outDir;
    private final Path templatesDir;
    private final Path policiesDir;
    private final String latexEngine;
    private final int latexTimeoutSeconds;
    private final String defaultFooter;

    private TrustforgeConfig(String themePath, Path outDir, Path templatesDir, Path policiesDir,
                             String latexEngine, int latexTimeoutSeconds, String defaultFooter) {
        this.themePath = themePath;
        this.outDir = outDir;
        this.templatesDir = templatesDir;
        this.policiesDir = policiesDir;
        this.latexEngine = latexEngine;
        this.latexTimeoutSeconds = latexTimeoutSeconds;
        this.defaultFooter = defaultFooter;
    }

    public String getThemePath() {
        return themePath;
    }

    public Path getOutDir() {
        return outDir;
    }

    public Path getTemplatesDir() {
        return templatesDir;
    }

    public Path getPoliciesDir() {
        return policiesDir;
    }

    public String getLatexEngine() {
        return latexEngine;
    }

    public int getLatexTimeoutSeconds() {
        return latexTimeoutSeconds;
    }

    /**
     * Footer used when a policy does not declare one. May be null.
     */
    public String getDefaultFooter() {
        return defaultFooter;
    }

    public static TrustforgeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME), System.getenv());
    }

    static TrustforgeConfig load(Path configPath, Map<String, String> env) {
        YamlConfig yamlConfig = null;
        if (Files.exists(configPath)) {
            try {
                ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
                yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            } catch (IOException e) {
                System.err.println("[TrustforgeConfig] Ignoring unreadable " + configPath + ": " + e.getMessage());
            }
        }
        if (yamlConfig == null) {
            yamlConfig = new YamlConfig();
        }

        String themePath = firstNonBlank(env.get(ENV_THEME), yamlConfig.themePath, DEFAULT_THEME_PATH);
        String outDir = firstNonBlank(env.get(ENV_OUT), yamlConfig.outDir, DEFAULT_OUT_DIR);
        String templatesDir = firstNonBlank(yamlConfig.templatesDir, DEFAULT_TEMPLATES_DIR);
        String policiesDir = firstNonBlank(yamlConfig.policiesDir, DEFAULT_POLICIES_DIR);
        String latexEngine = firstNonBlank(yamlConfig.latexEngine, DEFAULT_LATEX_ENGINE);
        int timeout = (yamlConfig.latexTimeoutSeconds != null && yamlConfig.latexTimeoutSeconds > 0)
                ? yamlConfig.latexTimeoutSeconds
                : DEFAULT_LATEX_TIMEOUT_SECONDS;

        return new TrustforgeConfig(themePath, Paths.get(outDir), Paths.get(templatesDir), Paths.get(policiesDir),
                latexEngine, timeout, blankToNull(yamlConfig.defaultFooter));
    }

    public static TrustforgeConfig with(String themePath, Path outDir, Path templatesDir) {
        return new TrustforgeConfig(
                themePath != null ? themePath : DEFAULT_THEME_PATH,
                outDir != null ? outDir : Paths.get(DEFAULT_OUT_DIR),
                templatesDir != null ? templatesDir : Paths.get(DEFAULT_TEMPLATES_DIR),
                Paths.get(DEFAULT_POLICIES_DIR),
                DEFAULT_LATEX_ENGINE,
                DEFAULT_LATEX_TIMEOUT_SECONDS,
                null);
    }

    public TrustforgeConfig withDefaultFooter(String footer) {
        return new TrustforgeConfig(themePath, outDir, templatesDir, policiesDir, latexEngine,
                latexTimeoutSeconds, blankToNull(footer));
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static class YamlConfig {
        public String themePath;
        public String outDir;
        public String templatesDir;
        public String policiesDir;
        public String latexEngine;
        public Integer latexTimeoutSeconds;
        public String defaultFooter;
    }
}
