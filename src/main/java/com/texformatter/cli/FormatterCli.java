package com.texformatter.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.texformatter.api.FormatterResult;
import com.texformatter.api.error.FormatterError;
import com.texformatter.config.ConfigurationLoader;
import com.texformatter.config.FormatterConfig;
import com.texformatter.core.DocumentFormatter;
import com.texformatter.plugins.FileType;
import com.texformatter.plugins.latex.LatexFormatterPlugin;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxError;
import com.texformatter.syntax.SyntaxTree;
import com.texformatter.syntax.SyntaxTreePrinter;
import com.texformatter.util.ErrorFormatter;
import com.texformatter.util.LoggerUtil;

/**
 * Command line interface of the LaTeX formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".texformatter.yml";

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one CLI invocation and returns the process exit code.
     */
    static int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));
        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        try {
            return switch (args[0]) {
                case "format" -> _formatFiles(args, true);
                case "check" -> _formatFiles(args, false);
                case "init" -> _initializeConfig(args);
                case "tree" -> _printTree(args);
                case "--version", "-v" -> {
                    _printVersion();
                    yield 0;
                }
                case "--help", "-h" -> {
                    _printUsage();
                    yield 0;
                }
                default -> {
                    _printError("Unknown command: " + args[0]);
                    _printUsage();
                    yield 1;
                }
            };
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details in the log");
            }
            return 1;
        }
    }

    private static void _printVersion() {
        System.out.println("LaTeX Formatter version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "LaTeX Formatter CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  texformat init [--force]          - Initialize configuration file");
        System.out.println("  texformat format <path>           - Format files in path");
        System.out.println("  texformat check <path>            - Report files that need formatting");
        System.out.println("  texformat tree <file>             - Print the syntax tree of a file");
        System.out.println("  texformat --help|-h               - Show this help");
        System.out.println("  texformat --version|-v            - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (simplified)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --line-length=<num>               - Override general.lineLength");
        System.out.println("  --tab-width=<num>                 - Override general.tabWidth");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    /**
     * Shared driver of {@code format} and {@code check}. With {@code write} changed files are
     * rewritten, otherwise they are only reported.
     */
    private static int _formatFiles(String[] args, boolean write) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        int threads = _getIntOption(args, "--threads", Runtime.getRuntime().availableProcessors());
        FormatterConfig config = _loadConfig(args);

        List<Path> files = _findFiles(path,
                config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                config.getPluginConfig(ConfigurationLoader.LATEX_PLUGIN, "extensions", new ArrayList<String>()),
                _getOptionValue(args, "--include"));
        _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));

        Instant start = Instant.now();
        Map<Path, FormatterResult> results;
        try (DocumentFormatter formatter = _createFormatter(config)) {
            results = formatter.formatFiles(files, threads);
        }

        int changedCount = 0;
        int errorCount = 0;
        Map<Path, List<FormatterError>> errorsByFile = new LinkedHashMap<>();

        for (Path file : files) {
            FormatterResult result = results.get(file);
            if (result == null) {
                _printError("No result for: " + file);
                errorCount++;
                continue;
            }
            if (!result.getErrors().isEmpty()) {
                errorsByFile.put(file, result.getErrors());
            }
            if (!result.isSuccessful()) {
                _printError((write ? "Failed to format: " : "Cannot check: ") + file);
                result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                errorCount++;
                continue;
            }
            if (!result.hasChanges()) {
                if (verbose) {
                    _printSuccess("  OK: " + file);
                }
                continue;
            }
            changedCount++;
            if (write) {
                Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                _printSuccess("Formatted: " + file);
            } else {
                _printWarning("File needs formatting: " + file);
            }
        }

        Duration duration = Duration.between(start, Instant.now());
        System.out.println();
        System.out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
        System.out.println("  Processed files: " + files.size());
        System.out.println((write ? "  Reformatted files: " : "  Files needing formatting: ") + changedCount);
        System.out.println("  Files with errors: " + errorCount);

        if (!errorsByFile.isEmpty() && !ciMode) {
            System.out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
        }
        if (ciMode) {
            System.out.println("RESULT:files=" + files.size() +
                    ";changed=" + changedCount +
                    ";errors=" + errorCount);
        }

        if (errorCount > 0) {
            return 1;
        }
        return !write && changedCount > 0 ? 1 : 0;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return 0;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    private static int _printTree(String[] args) throws IOException {
        if (args.length < 2 || !Files.isRegularFile(Paths.get(args[1]))) {
            _printError("Error: Missing or invalid file argument");
            return 1;
        }
        SyntaxTree tree = LatexParser.parse(Files.readString(Paths.get(args[1]), StandardCharsets.UTF_8));
        System.out.println(SyntaxTreePrinter.print(tree.getRoot()));
        for (SyntaxError error : tree.getErrors()) {
            _printWarning(tree.lineOf(error.getOffset()) + ":" + tree.columnOf(error.getOffset())
                    + " " + error.getMessage());
        }
        return tree.hasErrors() ? 1 : 0;
    }

    /**
     * Loads the configuration file and applies the command line overrides.
     */
    static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
        }
        FormatterConfig config = ConfigurationLoader.loadConfig(Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME));

        int lineLength = _getIntOption(args, "--line-length", -1);
        if (lineLength > 0) {
            config = config.withGeneralConfig("lineLength", lineLength);
        }
        int tabWidth = _getIntOption(args, "--tab-width", -1);
        if (tabWidth >= 0) {
            config = config.withGeneralConfig("tabWidth", tabWidth);
        }
        return config;
    }

    private static DocumentFormatter _createFormatter(FormatterConfig config) {
        DocumentFormatter formatter = new DocumentFormatter(config);
        LatexFormatterPlugin plugin = new LatexFormatterPlugin();
        for (FileType type : FileType.values()) {
            if (type != FileType.UNKNOWN) {
                formatter.registerPlugin(type, plugin);
            }
        }
        return formatter;
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, List<String> extensions,
                                 String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> _isSupported(p, extensions))
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    static boolean _isSupported(Path file, List<String> extensions) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (extensions == null || extensions.isEmpty()) {
            return FileType.detect(file) != FileType.UNKNOWN;
        }
        return extensions.stream().anyMatch(ext -> fileName.endsWith("." + ext.toLowerCase(Locale.ROOT)));
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            return fileName.matches(_globToRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                String rest = pattern.substring(3);
                if (rest.contains("*") ? relativePath.matches("(.*/)?" + _globToRegex(rest)) : relativePath.endsWith(rest)) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 2))) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _globToRegex(String glob) {
        return glob
                .replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
    }

    static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static int _getIntOption(String[] args, String option, int defaultValue) {
        String value = _getOptionValue(args, option);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            _printWarning("Invalid value for " + option + ": " + value + ", using default");
            return defaultValue;
        }
    }

    static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
