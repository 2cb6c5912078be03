package com.scanparse.exception;

/**
 * Exception thrown when a line contains a character no token can start with.
 * The whole line is abandoned; no tokens scanned before the character survive.
 */
public class LexicalException extends ScanParseException {

    private final char character;
    private final int column;

    public LexicalException(char character, int column) {
        super("Unexpected character '" + character + "' at column " + column);
        this.character = character;
        this.column = column;
    }

    public char getCharacter() {
        return character;
    }

    public int getColumn() {
        return column;
    }
}
