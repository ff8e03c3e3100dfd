package com.raditha.bytelift.io;

import com.raditha.bytelift.ByteliftException;

/**
 * Malformed IL text. Line and column are 1-based.
 */
public class ILParseException extends ByteliftException {

    private final int line;
    private final int column;

    public ILParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
