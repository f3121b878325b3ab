package de.mirkosertic.kbindexer.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Central configuration of the indexer.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables and system properties
 * 2. Explicit config file, or the first existing of ./config/kbi.yaml, ./config/kbi.yml,
 *    ./kbi.yaml, ./kbi.yml and ~/.kbindexer/config.yaml
 * 3. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DIRECTORIES = "KBI_DIRECTORIES";
    private static final String ENV_KEYWORD_FILES = "KBI_KEYWORD_FILES";
    private static final String ENV_OUTPUT_FILE = "KBI_OUTPUT_FILE";
    private static final String PROP_DEBUG = "kbi.debug";
    private static final String CONFIG_DIR = ".kbindexer";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private List<String> includeDirectories = new ArrayList<>(List.of("."));
    private List<String> excludePatterns = new ArrayList<>();
    private List<String> keywordFiles = new ArrayList<>();
    private String outputFile = "keyword-index.json";
    private Map<String, FileTypeConfig> fileTypes = new LinkedHashMap<>();
    private int threadPoolSize = 4;
    private long treeCacheSize = 10_000;
    private boolean debug = false;
    private @Nullable Path sourceFile;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from classpath defaults, the discovered config file and the environment.
     */
    public static ApplicationConfig load() {
        return load(null);
    }

    /**
     * Load configuration, reading {@code explicitConfig} instead of discovering a config file.
     *
     * @throws InvalidConfigurationException if the explicit file does not exist or any value is invalid
     */
    public static ApplicationConfig load(final @Nullable Path explicitConfig) {
        final ApplicationConfig config = defaults();

        final Path configFile = explicitConfig != null ? explicitConfig : discoverConfigFile();
        if (explicitConfig != null && !Files.exists(explicitConfig)) {
            throw new InvalidConfigurationException("Config file not found: " + explicitConfig);
        }
        if (configFile != null) {
            config.loadFromFile(configFile);
        }

        config.applyEnvironmentOverrides(System::getenv);
        config.validate();

        logger.info("Configuration loaded: source={}, directories={}, keywordFiles={}, fileTypes={}",
                config.sourceFile == null ? "defaults" : config.sourceFile,
                config.includeDirectories, config.keywordFiles.size(), config.fileTypes.keySet());

        return config;
    }

    /**
     * Application defaults from the classpath only.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    /**
     * Configuration built from a YAML document on top of the classpath defaults, without
     * environment overrides. Used for tests and embedding.
     */
    public static ApplicationConfig fromYaml(final String yamlContent) {
        final ApplicationConfig config = defaults();
        config.applyYamlConfig(parseYaml(yamlContent));
        config.validate();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = ApplicationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> yaml = new Yaml().load(is);
                if (yaml != null) {
                    applyYamlConfig(yaml);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configFile) {
        try (final InputStream is = Files.newInputStream(configFile)) {
            final Map<String, Object> yaml = new Yaml().load(is);
            if (yaml != null) {
                applyYamlConfig(yaml);
            }
            this.sourceFile = configFile;
            logger.debug("Loaded config from: {}", configFile);
        } catch (final IOException e) {
            throw new InvalidConfigurationException("Cannot read config file " + configFile, e);
        } catch (final YAMLException | ClassCastException e) {
            throw new InvalidConfigurationException("Malformed config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parseYaml(final String yamlContent) {
        try {
            final Map<String, Object> yaml = new Yaml().load(yamlContent);
            return yaml == null ? Map.of() : yaml;
        } catch (final YAMLException | ClassCastException e) {
            throw new InvalidConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    static @Nullable Path discoverConfigFile() {
        final Path cwd = Paths.get("").toAbsolutePath();
        final List<Path> candidates = List.of(
                cwd.resolve("config").resolve("kbi.yaml"),
                cwd.resolve("config").resolve("kbi.yml"),
                cwd.resolve("kbi.yaml"),
                cwd.resolve("kbi.yml"),
                getUserConfigPath());
        for (final Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> yaml) {
        final Object root = yaml.get("kbi");
        if (!(root instanceof Map)) {
            return;
        }
        final Map<String, Object> kbiConfig = (Map<String, Object>) root;

        final Map<String, Object> directories = section(kbiConfig, "directories");
        if (directories.containsKey("include")) {
            this.includeDirectories = resolveAll(stringList(directories.get("include"), "directories.include"));
        }
        if (directories.containsKey("exclude")) {
            this.excludePatterns = stringList(directories.get("exclude"), "directories.exclude");
        }

        final Map<String, Object> keywords = section(kbiConfig, "keywords");
        if (keywords.containsKey("files")) {
            this.keywordFiles = resolveAll(stringList(keywords.get("files"), "keywords.files"));
        }

        final Map<String, Object> output = section(kbiConfig, "output");
        if (output.get("file") != null) {
            this.outputFile = resolveVariables(output.get("file").toString());
        }

        final Map<String, Object> fileTypesConfig = section(kbiConfig, "file-types");
        for (final Map.Entry<String, Object> entry : fileTypesConfig.entrySet()) {
            applyFileType(entry.getKey(), entry.getValue());
        }

        final Map<String, Object> indexing = section(kbiConfig, "indexing");
        if (indexing.containsKey("thread-pool-size")) {
            this.threadPoolSize = number(indexing.get("thread-pool-size"), "indexing.thread-pool-size").intValue();
        }
        if (indexing.containsKey("tree-cache-size")) {
            this.treeCacheSize = number(indexing.get("tree-cache-size"), "indexing.tree-cache-size").longValue();
        }

        if (kbiConfig.containsKey("debug")) {
            this.debug = Boolean.TRUE.equals(kbiConfig.get("debug"));
        }
    }

    @SuppressWarnings("unchecked")
    private void applyFileType(final String name, final Object value) {
        if (!(value instanceof Map)) {
            throw new InvalidConfigurationException("file-types." + name + " must be a mapping");
        }
        final Map<String, Object> typeConfig = (Map<String, Object>) value;
        final FileTypeConfig existing = fileTypes.get(name);

        final Object handler = typeConfig.get("handler");
        final String handlerName = handler != null ? handler.toString()
                : existing != null ? existing.handler() : name;
        final List<String> extensions = typeConfig.containsKey("extensions")
                ? stringList(typeConfig.get("extensions"), "file-types." + name + ".extensions")
                : existing != null ? existing.extensions() : List.of();

        fileTypes.put(name, new FileTypeConfig(name, handlerName, extensions));
    }

    void applyEnvironmentOverrides(final Function<String, String> environment) {
        final List<String> envDirectories = splitCommaSeparated(environment.apply(ENV_DIRECTORIES));
        if (!envDirectories.isEmpty()) {
            this.includeDirectories = envDirectories;
            logger.info("Directories from environment: {}", envDirectories);
        }

        final List<String> envKeywordFiles = splitCommaSeparated(environment.apply(ENV_KEYWORD_FILES));
        if (!envKeywordFiles.isEmpty()) {
            this.keywordFiles = envKeywordFiles;
            logger.info("Keyword files from environment: {}", envKeywordFiles);
        }

        final String envOutput = environment.apply(ENV_OUTPUT_FILE);
        if (envOutput != null && !envOutput.isBlank()) {
            this.outputFile = envOutput.trim();
        }

        final String propDebug = System.getProperty(PROP_DEBUG);
        if (propDebug != null && !propDebug.isBlank()) {
            this.debug = Boolean.parseBoolean(propDebug.trim());
        }
    }

    /**
     * @throws InvalidConfigurationException if a value violates the configuration schema
     */
    void validate() {
        if (fileTypes.isEmpty()) {
            throw new InvalidConfigurationException("At least one file type must be configured");
        }
        for (final FileTypeConfig fileType : fileTypes.values()) {
            if (fileType.extensions().isEmpty()) {
                throw new InvalidConfigurationException("File type '" + fileType.name() + "' has no extensions");
            }
            for (final String extension : fileType.extensions()) {
                if (!extension.startsWith(".") || extension.length() < 2) {
                    throw new InvalidConfigurationException("Extension '" + extension + "' of file type '"
                            + fileType.name() + "' must start with a dot");
                }
            }
        }
        if (threadPoolSize < 1) {
            throw new InvalidConfigurationException("indexing.thread-pool-size must be positive but was " + threadPoolSize);
        }
        if (treeCacheSize < 1) {
            throw new InvalidConfigurationException("indexing.tree-cache-size must be positive but was " + treeCacheSize);
        }
        if (outputFile == null || outputFile.isBlank()) {
            throw new InvalidConfigurationException("output.file must not be empty");
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> config, final String key) {
        final Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new InvalidConfigurationException(key + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static List<String> stringList(final Object value, final String key) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (!(value instanceof List<?> list)) {
            throw new InvalidConfigurationException(key + " must be a list");
        }
        final List<String> result = new ArrayList<>();
        for (final Object element : list) {
            if (element != null) {
                result.add(element.toString());
            }
        }
        return result;
    }

    private static Number number(final Object value, final String key) {
        if (!(value instanceof Number n)) {
            throw new InvalidConfigurationException(key + " must be a number");
        }
        return n;
    }

    private static List<String> splitCommaSeparated(final String value) {
        final List<String> result = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return result;
        }
        for (final String part : value.split(",")) {
            final String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static List<String> resolveAll(final List<String> values) {
        final List<String> resolved = new ArrayList<>(values.size());
        for (final String value : values) {
            resolved.add(resolveVariables(value));
        }
        return resolved;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf('}', start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    public List<String> getIncludeDirectories() {
        return List.copyOf(includeDirectories);
    }

    public List<String> getExcludePatterns() {
        return List.copyOf(excludePatterns);
    }

    public List<String> getKeywordFiles() {
        return List.copyOf(keywordFiles);
    }

    public String getOutputFile() {
        return outputFile;
    }

    /**
     * File types in configuration order; adapters are consulted in this order.
     */
    public List<FileTypeConfig> getFileTypes() {
        return List.copyOf(fileTypes.values());
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public long getTreeCacheSize() {
        return treeCacheSize;
    }

    public boolean isDebug() {
        return debug;
    }

    public @Nullable Path getSourceFile() {
        return sourceFile;
    }
}
