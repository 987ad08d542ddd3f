package de.mirkosertic.pdfbatch.batch;

public enum LogLevel {
    INFO,
    WARNING,
    ERROR
}
