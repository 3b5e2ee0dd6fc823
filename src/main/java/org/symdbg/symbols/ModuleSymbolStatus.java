package org.symdbg.symbols;

/** Summary of one module's symbols, for listing modules. */
public class ModuleSymbolStatus {
    public String buildId;
    /** Name of the binary. */
    public String name;
    /** Absolute load address, 0 when not loaded in a process. */
    public long base;
    public int functionsIndexed;
    public int filesIndexed;
    public boolean symbolsLoaded;
    /** Where the symbols came from, empty when they were not loaded from a file. */
    public String symbolFile = "";

    public ModuleSymbolStatus copy() {
        var copy = new ModuleSymbolStatus();
        copy.buildId = buildId;
        copy.name = name;
        copy.base = base;
        copy.functionsIndexed = functionsIndexed;
        copy.filesIndexed = filesIndexed;
        copy.symbolsLoaded = symbolsLoaded;
        copy.symbolFile = symbolFile;
        return copy;
    }

    @Override
    public String toString() {
        return String.format(
                "%s %s @ 0x%x (%s, %d functions, %d files)",
                name, buildId, base, symbolsLoaded ? "loaded" : "no symbols", functionsIndexed, filesIndexed);
    }
}
