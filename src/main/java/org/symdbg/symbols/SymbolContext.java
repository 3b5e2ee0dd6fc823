package org.symdbg.symbols;

/** Translates between module-relative addresses and absolute addresses in a running process. */
public class SymbolContext {
    private static final SymbolContext RELATIVE = new SymbolContext(0);

    private final long relativeBase;

    public SymbolContext(long relativeBase) {
        this.relativeBase = relativeBase;
    }

    /** A context for when no load address is known; absolute and relative addresses are the same. */
    public static SymbolContext forRelativeAddresses() {
        return RELATIVE;
    }

    public boolean isRelative() {
        return relativeBase == 0;
    }

    public long relativeBase() {
        return relativeBase;
    }

    public long relativeToAbsolute(long relative) {
        return relative + relativeBase;
    }

    public long absoluteToRelative(long absolute) {
        return absolute - relativeBase;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SymbolContext)) return false;
        return ((SymbolContext) other).relativeBase == relativeBase;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(relativeBase);
    }

    @Override
    public String toString() {
        return String.format("SymbolContext(0x%x)", relativeBase);
    }
}
