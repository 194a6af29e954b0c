package com.texformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.texformatter.api.error.FormatterError;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<TextEdit> edits;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.errors = builder.errors;
        this.edits = builder.edits;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<TextEdit> getEdits() {
        return edits;
    }

    /**
     * Whether formatting produced a different text than the input.
     */
    public boolean hasChanges() {
        return !edits.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private List<TextEdit> edits = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder addEdit(TextEdit edit) {
            this.edits.add(edit);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
