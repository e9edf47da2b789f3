package io.lighting.quill.view;

/**
 * Thrown when template source cannot be compiled. No partial template is produced.
 */
public class TemplateParseException extends IllegalArgumentException {
    private final int line;
    private final int column;

    public TemplateParseException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
