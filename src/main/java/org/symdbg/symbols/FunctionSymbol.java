package org.symdbg.symbols;

import java.util.Optional;

public class FunctionSymbol extends Symbol {
    private final Optional<Identifier> containingClass;
    private final long begin, end;
    private final Optional<FileLine> declLine;

    public FunctionSymbol(
            Identifier fullName,
            Optional<Identifier> containingClass,
            long begin,
            long end,
            Optional<FileLine> declLine) {
        super(fullName);
        this.containingClass = containingClass;
        this.begin = begin;
        this.end = end;
        this.declLine = declLine;
    }

    /** The class this function is a member of, if any. Namespaces are not classes. */
    public Optional<Identifier> containingClass() {
        return containingClass;
    }

    /** Relative address of the first instruction. */
    public long begin() {
        return begin;
    }

    /** Relative address one past the last instruction. */
    public long end() {
        return end;
    }

    public boolean containsRelative(long address) {
        return Long.compareUnsigned(address, begin) >= 0 && Long.compareUnsigned(address, end) < 0;
    }

    public Optional<FileLine> declLine() {
        return declLine;
    }
}
