package org.symdbg.symbols;

public class ResolveOptions {
    /** Raw addresses, used when every requested location is an address. */
    public static final ResolveOptions ADDRESSES_ONLY = new ResolveOptions(false, false);

    public static final ResolveOptions SYMBOLIZE = new ResolveOptions(true, false);

    /** What breakpoints on names and lines use, so the stop happens after parameters are set up. */
    public static final ResolveOptions SYMBOLIZE_SKIP_PROLOGUE = new ResolveOptions(true, true);

    public final boolean symbolize;
    /**
     * Advance addresses that land exactly on a function entry past the function prologue. Requires
     * {@link #symbolize}.
     */
    public final boolean skipFunctionPrologue;

    public ResolveOptions(boolean symbolize, boolean skipFunctionPrologue) {
        if (skipFunctionPrologue && !symbolize) {
            throw new IllegalArgumentException("skipFunctionPrologue requires symbolize");
        }
        this.symbolize = symbolize;
        this.skipFunctionPrologue = skipFunctionPrologue;
    }

    public static ResolveOptions of(boolean symbolize) {
        return symbolize ? SYMBOLIZE : ADDRESSES_ONLY;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ResolveOptions)) return false;
        var that = (ResolveOptions) other;
        return this.symbolize == that.symbolize && this.skipFunctionPrologue == that.skipFunctionPrologue;
    }

    @Override
    public int hashCode() {
        return (symbolize ? 1 : 0) + (skipFunctionPrologue ? 2 : 0);
    }

    @Override
    public String toString() {
        return "ResolveOptions(symbolize=" + symbolize + ", skipFunctionPrologue=" + skipFunctionPrologue + ")";
    }
}
