package org.symdbg.symbols;

import java.util.Optional;

/** Where a name is being looked up from: which symbols are in play, and optionally which function it's written in. */
public class FindNameContext {
    public final Optional<ProcessSymbols> processSymbols;
    public final TargetSymbols targetSymbols;
    public final Optional<FunctionSymbol> enclosingFunction;

    public FindNameContext(
            Optional<ProcessSymbols> processSymbols,
            TargetSymbols targetSymbols,
            Optional<FunctionSymbol> enclosingFunction) {
        this.processSymbols = processSymbols;
        this.targetSymbols = targetSymbols;
        this.enclosingFunction = enclosingFunction;
    }

    public static FindNameContext forProcess(ProcessSymbols symbols) {
        return new FindNameContext(Optional.of(symbols), symbols.getTargetSymbols(), Optional.empty());
    }

    public static FindNameContext forTarget(TargetSymbols symbols) {
        return new FindNameContext(Optional.empty(), symbols, Optional.empty());
    }

    /** Lookups made from code at {@code address}, so names can be found relative to the function there. */
    public static FindNameContext forAddress(ProcessSymbols symbols, long address) {
        var found = symbols.resolveInputLocation(InputLocation.address(address), ResolveOptions.SYMBOLIZE);
        Optional<FunctionSymbol> function = Optional.empty();
        if (!found.isEmpty()) {
            var symbol = found.get(0).symbol();
            if (symbol.isPresent() && symbol.get() instanceof FunctionSymbol) {
                function = Optional.of((FunctionSymbol) symbol.get());
            }
        }
        return new FindNameContext(Optional.of(symbols), symbols.getTargetSymbols(), function);
    }

    /** The process symbols if there is a process, otherwise the target symbols. */
    public LocationResolver resolver() {
        if (processSymbols.isPresent()) return processSymbols.get();
        return targetSymbols;
    }
}
