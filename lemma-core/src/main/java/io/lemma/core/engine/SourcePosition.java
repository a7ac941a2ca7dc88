package io.lemma.core.engine;

/// A position in the source the session was started from.
///
/// @param file source file name, may be null when the session is not attached to a file
/// @param line one-based line number
/// @param column zero-based column
public record SourcePosition(String file, int line, int column) {

    public SourcePosition {
        if (line < 1) {
            throw new IllegalArgumentException("line must be positive, was " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative, was " + column);
        }
    }

    @Override
    public String toString() {
        String location = line + ":" + column;
        return file != null ? file + ":" + location : location;
    }
}
