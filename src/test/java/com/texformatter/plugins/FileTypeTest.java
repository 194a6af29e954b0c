package com.texformatter.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class FileTypeTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
            "paper.tex, TEX",
            "STYLE.STY, STY",
            "thesis.cls, CLS",
            "source.ltx, LTX",
            "notes.txt, UNKNOWN",
            "Makefile, UNKNOWN",
    })
    void detectsByExtension(String fileName, FileType expected) {
        assertThat(FileType.detectByExtension(Path.of(fileName))).isEqualTo(expected);
    }

    @Test
    void detectsByContent() {
        assertThat(FileType.detectContent("\\ProvidesClass{thesis}")).isEqualTo(FileType.CLS);
        assertThat(FileType.detectContent("\\NeedsTeXFormat{LaTeX2e}\n\\ProvidesPackage{x}")).isEqualTo(FileType.STY);
        assertThat(FileType.detectContent("\\documentclass{article}")).isEqualTo(FileType.TEX);
        assertThat(FileType.detectContent("\\section*{Intro}")).isEqualTo(FileType.TEX);
        assertThat(FileType.detectContent("plain text")).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void sniffsFilesWithoutExtension() throws IOException {
        Path document = Files.writeString(tempDir.resolve("README"), "\\documentclass{article}\n");
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "\\documentclass{article}\n");

        assertThat(FileType.detect(document)).isEqualTo(FileType.TEX);
        assertThat(FileType.detect(text)).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void cachesDetection() {
        FileType.clearCache();
        FileType.detect(tempDir.resolve("a.tex"));

        assertThat(FileType.getCacheSize()).isEqualTo(1);
        FileType.clearCache();
        assertThat(FileType.getCacheSize()).isZero();
    }

    @Test
    void describesTypes() {
        assertThat(FileType.STY.getDescription()).isEqualTo("LaTeX package");
        assertThat(FileType.TEX.getExtension()).isEqualTo("tex");
    }
}
