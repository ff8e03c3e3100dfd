package com.raditha.bytelift.cli;

/**
 * How decompiled declarations are printed.
 */
public enum OutputFormat {
    JAVA("java"),
    IL("il");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
