package com.texformatter.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.texformatter.api.error.FormatterError;
import com.texformatter.api.error.Severity;

final class TextEditTest {

    @Test
    void replaceAllEndsAfterLastCharacter() {
        TextEdit edit = TextEdit.replaceAll("ab\ncde", "x");

        assertThat(edit.getStartLine()).isZero();
        assertThat(edit.getStartColumn()).isZero();
        assertThat(edit.getEndLine()).isEqualTo(1);
        assertThat(edit.getEndColumn()).isEqualTo(3);
        assertThat(edit.getNewText()).isEqualTo("x");
        assertThat(edit).hasToString("TextEdit[0:0-1:3]");
    }

    @Test
    void trailingNewlineEndsOnNextLine() {
        TextEdit edit = TextEdit.replaceAll("a\n", "b");

        assertThat(edit.getEndLine()).isEqualTo(1);
        assertThat(edit.getEndColumn()).isZero();
    }

    @Test
    void emptyTextIsAnInsertion() {
        TextEdit edit = TextEdit.replaceAll("", "b");

        assertThat(edit.getEndLine()).isZero();
        assertThat(edit.getEndColumn()).isZero();
    }

    @Test
    void resultReportsChangesThroughEdits() {
        FormatterResult unchanged = FormatterResult.builder().successful(true).formattedCode("x").build();
        FormatterResult changed = FormatterResult.builder()
                .successful(true)
                .formattedCode("y")
                .addEdit(TextEdit.replaceAll("x", "y"))
                .addError(new FormatterError(Severity.INFO, "note", 0, 0))
                .build();

        assertThat(unchanged.hasChanges()).isFalse();
        assertThat(unchanged.getErrors()).isEmpty();
        assertThat(changed.hasChanges()).isTrue();
        assertThat(changed.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.INFO);
    }
}
