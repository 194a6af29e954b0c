package com.texformatter.plugins.latex;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import com.texformatter.api.FormatterPlugin;
import com.texformatter.api.FormatterResult;
import com.texformatter.api.TextEdit;
import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;
import com.texformatter.config.ConfigurationLoader;
import com.texformatter.config.FormatterConfig;
import com.texformatter.layout.LatexFormatter;
import com.texformatter.syntax.LatexParser;
import com.texformatter.syntax.SyntaxError;
import com.texformatter.syntax.SyntaxTree;
import com.texformatter.util.LoggerUtil;

/**
 * Formats LaTeX documents, packages and classes.
 *
 * <p>Documents with syntax errors are returned unchanged with one {@link Severity#ERROR} per
 * problem, unless {@code plugins.latex.formatOnSyntaxError} is set, in which case the problems
 * are reported as warnings and the document is formatted anyway.
 */
public class LatexFormatterPlugin implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(LatexFormatterPlugin.class);
    private static final int TREE_CACHE_SIZE = 100;

    private LatexFormatter formatter = new LatexFormatter();
    private boolean formatOnSyntaxError;

    private final Map<String, SyntaxTree> treeCache = new LinkedHashMap<String, SyntaxTree>(TREE_CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, SyntaxTree> eldest) {
            return size() > TREE_CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();

    @Override
    public void initialize(FormatterConfig config) {
        int tabWidth = config.getGeneralConfig("tabWidth", ConfigurationLoader.DEFAULT_TAB_WIDTH);
        int lineLength = config.getGeneralConfig("lineLength", ConfigurationLoader.DEFAULT_LINE_LENGTH);
        this.formatter = new LatexFormatter(tabWidth, lineLength);
        this.formatOnSyntaxError = config.getPluginConfig(ConfigurationLoader.LATEX_PLUGIN, "formatOnSyntaxError", false);
        logger.fine("LaTeX plugin initialized: tabWidth=" + tabWidth + ", lineLength=" + lineLength);
    }

    public LatexFormatter getFormatter() {
        return formatter;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        SyntaxTree tree = parse(filePath, sourceCode);

        FormatterResult.Builder result = FormatterResult.builder();
        if (tree.hasErrors()) {
            Severity severity = formatOnSyntaxError ? Severity.WARNING : Severity.ERROR;
            for (SyntaxError error : tree.getErrors()) {
                result.addError(new FormatterError(
                        severity,
                        error.getMessage(),
                        tree.lineOf(error.getOffset()),
                        tree.columnOf(error.getOffset()),
                        "Fix the LaTeX syntax before formatting"));
            }
            if (!formatOnSyntaxError) {
                logger.fine("Skipping " + filePath + ": " + tree.getErrors().size() + " syntax errors");
                return result.successful(false).formattedCode(sourceCode).build();
            }
        }

        String formatted = formatter.format(tree.getRoot());
        if (formatted.isEmpty()) {
            return result.successful(true).formattedCode(sourceCode).build();
        }
        formatted = formatted + "\n";
        if (!formatted.equals(sourceCode)) {
            result.addEdit(TextEdit.replaceAll(sourceCode, formatted));
        }
        return result.successful(true).formattedCode(formatted).build();
    }

    /**
     * Parses {@code sourceCode}, reusing the tree of an identical earlier request.
     */
    private SyntaxTree parse(Path filePath, String sourceCode) {
        String cacheKey = filePath + ":" + sourceCode.hashCode();

        cacheLock.readLock().lock();
        try {
            SyntaxTree cached = treeCache.get(cacheKey);
            if (cached != null && cached.getSource().equals(sourceCode)) {
                return cached;
            }
        } finally {
            cacheLock.readLock().unlock();
        }

        SyntaxTree tree = LatexParser.parse(sourceCode);
        cacheLock.writeLock().lock();
        try {
            treeCache.put(cacheKey, tree);
        } finally {
            cacheLock.writeLock().unlock();
        }
        return tree;
    }

    @Override
    public void close() {
        cacheLock.writeLock().lock();
        try {
            treeCache.clear();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }
}
