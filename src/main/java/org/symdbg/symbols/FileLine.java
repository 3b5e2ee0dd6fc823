package org.symdbg.symbols;

import java.util.Objects;

/** A source file name and a 1-based line number. */
public class FileLine implements Comparable<FileLine> {
    public final String file;
    public final int line;

    public FileLine(String file, int line) {
        this.file = Objects.requireNonNull(file);
        this.line = line;
    }

    /** The part of the file name after the last slash. */
    public String fileNamePart() {
        var slash = file.lastIndexOf('/');
        if (slash == -1) return file;
        return file.substring(slash + 1);
    }

    @Override
    public int compareTo(FileLine other) {
        var byFile = file.compareTo(other.file);
        if (byFile != 0) return byFile;
        return Integer.compare(line, other.line);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof FileLine)) return false;
        var that = (FileLine) other;
        return this.line == that.line && this.file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line);
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
