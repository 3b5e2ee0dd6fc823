package org.symdbg.symbols;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/** The reference count behind every {@link ModuleRef} to one provider. */
class SharedModuleSymbols {
    final ModuleSymbols symbols;
    private final AtomicInteger refs = new AtomicInteger();
    private final Consumer<SharedModuleSymbols> onLastRelease;

    SharedModuleSymbols(ModuleSymbols symbols, Consumer<SharedModuleSymbols> onLastRelease) {
        this.symbols = symbols;
        this.onLastRelease = onLastRelease;
    }

    ModuleRef acquire() {
        refs.incrementAndGet();
        return new ModuleRef(this);
    }

    void release() {
        if (refs.decrementAndGet() == 0) onLastRelease.accept(this);
    }

    int refCount() {
        return refs.get();
    }
}
