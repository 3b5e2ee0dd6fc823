package org.symdbg.symbols;

/**
 * One owner's handle on a shared {@link ModuleSymbols}. Every handle must be closed exactly once; when the last
 * handle for a provider closes, {@link SystemSymbols} forgets it.
 */
public final class ModuleRef implements AutoCloseable {
    private final SharedModuleSymbols shared;
    private boolean closed;

    ModuleRef(SharedModuleSymbols shared) {
        this.shared = shared;
    }

    public ModuleSymbols get() {
        if (closed) throw new IllegalStateException("ModuleRef for " + shared.symbols.buildId() + " is closed");
        return shared.symbols;
    }

    /** A new handle on the same provider, for another owner. */
    public ModuleRef share() {
        if (closed) throw new IllegalStateException("ModuleRef for " + shared.symbols.buildId() + " is closed");
        return shared.acquire();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        shared.release();
    }
}
