package org.symdbg.symbols;

import java.util.Optional;

/** A module's symbols as they apply to one process: the shared provider plus where the module is loaded. */
public class LoadedModuleSymbols {
    private final String name, buildId;
    private final long loadAddress, debugAddress;
    private final SymbolContext symbolContext;
    private Optional<ModuleRef> symbols;

    LoadedModuleSymbols(String name, String buildId, long loadAddress, long debugAddress, Optional<ModuleRef> symbols) {
        this.name = name;
        this.buildId = buildId;
        this.loadAddress = loadAddress;
        this.debugAddress = debugAddress;
        this.symbolContext = new SymbolContext(loadAddress);
        this.symbols = symbols;
    }

    public String name() {
        return name;
    }

    public String buildId() {
        return buildId;
    }

    public long loadAddress() {
        return loadAddress;
    }

    public long debugAddress() {
        return debugAddress;
    }

    public SymbolContext symbolContext() {
        return symbolContext;
    }

    /** Empty when symbols for this module couldn't be loaded. */
    public Optional<ModuleSymbols> moduleSymbols() {
        return symbols.map(ModuleRef::get);
    }

    public ModuleSymbolStatus status() {
        ModuleSymbolStatus status;
        if (symbols.isPresent()) {
            status = symbols.get().get().getStatus().copy();
        } else {
            status = new ModuleSymbolStatus();
            status.buildId = buildId;
        }
        status.name = name;
        status.base = loadAddress;
        return status;
    }

    Optional<ModuleRef> symbolsRef() {
        return symbols;
    }

    void replaceSymbols(Optional<ModuleRef> replacement) {
        symbols.ifPresent(ModuleRef::close);
        symbols = replacement;
    }

    void release() {
        replaceSymbols(Optional.empty());
    }

    @Override
    public String toString() {
        return String.format("%s@0x%x", name, loadAddress);
    }
}
