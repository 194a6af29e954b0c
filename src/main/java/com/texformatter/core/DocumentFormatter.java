package com.texformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.texformatter.api.FormatterPlugin;
import com.texformatter.api.FormatterResult;
import com.texformatter.api.TexFormatter;
import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;
import com.texformatter.config.FormatterConfig;
import com.texformatter.plugins.FileType;
import com.texformatter.util.LoggerUtil;

/**
 * Thread-safe orchestrator delegating each file to the plugin registered for its
 * {@link FileType}. Batches run on a fixed thread pool; every file yields a result, failures
 * included.
 */
public class DocumentFormatter implements TexFormatter {
    private static final Logger logger = LoggerUtil.getLogger(DocumentFormatter.class);
    private static final long BATCH_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public DocumentFormatter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Registers and initializes a plugin for a file type, replacing any earlier one.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats a single file. Never throws; unexpected plugin failures become a
     * {@link Severity#FATAL} result carrying the original source.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            0, 0))
                    .build();
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Successfully formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return _failure(sourceCode, "Unexpected error: " + e.getMessage());
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported file below {@code directory} with {@code threadCount} workers.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return Collections.emptyMap();
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detect(path)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return Collections.emptyMap();
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return formatFiles(filesToProcess, threadCount);
    }

    /**
     * Reads and formats {@code files} in parallel. Read failures are reported as
     * {@link Severity#FATAL} results with no formatted code.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, formatFile(file, content));
                    } catch (IOException e) {
                        logger.log(Level.WARNING, "Failed to read file: " + file, e);
                        results.put(file, _failure(null, "Failed to read file: " + e.getMessage()));
                    }
                });
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(BATCH_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private static FormatterResult _failure(String sourceCode, String message) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(sourceCode)
                .addError(new FormatterError(Severity.FATAL, message, 0, 0, "Check the log file for details"))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes all plugins. A failing plugin does not prevent the others from being closed.
     */
    @Override
    public void close() {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
            }
        }
        plugins.clear();
    }
}
