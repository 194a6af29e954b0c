package com.texformatter.api.error;

public enum Severity {
    FATAL,   // Unexpected failures that stop a file from being processed
    ERROR,   // Syntax errors, the file is left untouched
    WARNING, // Syntax errors tolerated by configuration
    INFO     // Informational messages about formatting
}
