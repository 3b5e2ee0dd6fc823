package org.symdbg.symbols;

import java.util.OptionalLong;

public class VariableSymbol extends Symbol {
    private final OptionalLong address;
    private final boolean threadLocal;

    public VariableSymbol(Identifier fullName, OptionalLong address, boolean threadLocal) {
        super(fullName);
        this.address = address;
        this.threadLocal = threadLocal;
    }

    /** Relative address, empty when it can't be known statically. */
    public OptionalLong address() {
        if (threadLocal) return OptionalLong.empty();
        return address;
    }

    public boolean isThreadLocal() {
        return threadLocal;
    }
}
