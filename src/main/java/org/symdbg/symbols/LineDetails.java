package org.symdbg.symbols;

import java.util.Optional;

/** The line-table row covering an address: its source position and the absolute address range of the row. */
public class LineDetails {
    public final Optional<FileLine> fileLine;
    public final int column;
    /** Absolute address of the first byte of the row. */
    public final long begin;
    /** Absolute address one past the last byte of the row. */
    public final long end;

    public LineDetails(Optional<FileLine> fileLine, int column, long begin, long end) {
        this.fileLine = fileLine;
        this.column = column;
        this.begin = begin;
        this.end = end;
    }

    public static LineDetails empty() {
        return new LineDetails(Optional.empty(), 0, 0, 0);
    }

    public boolean isValid() {
        return fileLine.isPresent();
    }

    @Override
    public String toString() {
        return String.format("%s [0x%x, 0x%x)", fileLine.map(FileLine::toString).orElse("?"), begin, end);
    }
}
