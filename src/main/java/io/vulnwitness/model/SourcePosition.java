package io.vulnwitness.model;

/**
 * Location of a function declaration or a call expression in the analyzed program.
 *
 * @param filename Source file name as reported by the upstream analysis
 * @param line     1-based line number
 * @param column   1-based column number
 */
public record SourcePosition(
        String filename,
        int line,
        int column
) {
    public SourcePosition {
        if (filename == null) {
            filename = "";
        }
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Line and column must not be negative: " + line + ":" + column);
        }
    }

    /**
     * Formats as "file:line:column".
     */
    @Override
    public String toString() {
        return filename + ":" + line + ":" + column;
    }
}
