package com.texformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.texformatter.util.LoggerUtil;

/**
 * Supported file types. Detection goes by extension first and sniffs the content of files
 * without a known extension.
 */
public enum FileType {
    TEX("tex"),
    STY("sty"),
    CLS("cls"),
    LTX("ltx"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int SNIFF_BYTES = 4096;

    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\\\(?:ProvidesPackage|NeedsTeXFormat)\\b");
    private static final Pattern CLASS_PATTERN = Pattern.compile("\\\\(?:ProvidesClass|LoadClass)\\b");
    private static final Pattern DOCUMENT_PATTERN = Pattern.compile(
            "\\\\(?:documentclass|begin\\s*\\{document\\}|section\\*?\\s*\\{|chapter\\*?\\s*\\{|usepackage)");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type of {@code filePath}, caching the answer per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = detectByExtension(filePath);
        if (type == UNKNOWN) {
            type = detectByContent(filePath);
        }
        typeCache.put(filePath, type);
        return type;
    }

    static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (fileName.substring(dot + 1)) {
            case "tex" -> TEX;
            case "sty" -> STY;
            case "cls" -> CLS;
            case "ltx" -> LTX;
            default -> UNKNOWN;
        };
    }

    /**
     * Sniffs the first few kilobytes of an extension-less file. Files with any other
     * extension stay unknown.
     */
    private static FileType detectByContent(Path filePath) {
        Path name = filePath.getFileName();
        if ((name != null && name.toString().contains(".")) || !Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            return detectContent(readHead(filePath));
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    static FileType detectContent(String content) {
        if (CLASS_PATTERN.matcher(content).find()) {
            return CLS;
        }
        if (PACKAGE_PATTERN.matcher(content).find()) {
            return STY;
        }
        if (DOCUMENT_PATTERN.matcher(content).find()) {
            return TEX;
        }
        return UNKNOWN;
    }

    private static String readHead(Path filePath) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] bytes = in.readNBytes(SNIFF_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    public String getDescription() {
        return switch (this) {
            case TEX -> "LaTeX document";
            case STY -> "LaTeX package";
            case CLS -> "LaTeX class";
            case LTX -> "LaTeX source";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
