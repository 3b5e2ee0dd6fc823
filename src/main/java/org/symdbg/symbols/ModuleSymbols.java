package org.symdbg.symbols;

import java.util.List;

/**
 * Symbols for one binary, identified by build ID. A provider does not know where the binary is loaded; callers
 * pass a {@link SymbolContext} for that. One provider is shared by every process that maps the same binary, so
 * implementations must be immutable after construction.
 */
public interface ModuleSymbols {
    String buildId();

    ModuleSymbolStatus getStatus();

    /**
     * Find every location in this module matching {@code input}. Address input always yields exactly one
     * location. Finding nothing is an empty list, not an error.
     */
    List<Location> resolveInputLocation(SymbolContext context, InputLocation input, ResolveOptions options);

    /** The line-table row covering {@code absoluteAddress}, or {@link LineDetails#empty()}. */
    LineDetails lineDetailsForAddress(SymbolContext context, long absoluteAddress);

    /** Full paths of indexed files that match {@code name} as described in {@link FileNames#matches}. */
    List<String> findFileMatches(String name);

    /** Every indexed definition with exactly this qualified name. */
    List<Symbol> findSymbols(Identifier name);
}
