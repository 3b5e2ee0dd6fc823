package org.symdbg.symbols;

import com.google.common.base.Suppliers;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The result of resolving an {@link InputLocation}. Locations are small values; they point at symbols but do
 * not keep the module that owns them loaded.
 */
public class Location {
    public enum State {
        /** No address. */
        INVALID,
        /** Address known, symbolization not attempted. */
        ADDRESS,
        /** Symbolization attempted. There may still be no symbol or line if none exists. */
        SYMBOLIZED,
        /** Matched a variable whose address is not known statically, like thread-local data. */
        UNLOCATED_VARIABLE
    }

    private static final Supplier<Optional<Symbol>> NO_SYMBOL = Optional::empty;

    private final State state;
    private final long address;
    private final Optional<FileLine> fileLine;
    private final int column;
    private final Supplier<Optional<Symbol>> symbol;
    private final SymbolContext symbolContext;

    private Location(
            State state,
            long address,
            Optional<FileLine> fileLine,
            int column,
            Supplier<Optional<Symbol>> symbol,
            SymbolContext symbolContext) {
        this.state = state;
        this.address = address;
        this.fileLine = fileLine;
        this.column = column;
        this.symbol = symbol;
        this.symbolContext = symbolContext;
    }

    public static Location invalid() {
        return new Location(State.INVALID, 0, Optional.empty(), 0, NO_SYMBOL, SymbolContext.forRelativeAddresses());
    }

    public static Location address(long address) {
        return address(address, SymbolContext.forRelativeAddresses());
    }

    /** An unsymbolized address that is known to come from the module {@code symbolContext} describes. */
    public static Location address(long address, SymbolContext symbolContext) {
        return new Location(State.ADDRESS, address, Optional.empty(), 0, NO_SYMBOL, symbolContext);
    }

    /** A symbolized location. The symbol is looked up the first time it's asked for. */
    public static Location symbolized(
            long address,
            Optional<FileLine> fileLine,
            int column,
            SymbolContext symbolContext,
            Supplier<Optional<Symbol>> symbol) {
        return new Location(State.SYMBOLIZED, address, fileLine, column, Suppliers.memoize(symbol::get), symbolContext);
    }

    public static Location symbolized(
            long address, Optional<FileLine> fileLine, int column, SymbolContext symbolContext, Symbol symbol) {
        var found = Optional.ofNullable(symbol);
        return new Location(State.SYMBOLIZED, address, fileLine, column, () -> found, symbolContext);
    }

    public static Location unlocatedVariable(VariableSymbol variable, SymbolContext symbolContext) {
        var found = Optional.<Symbol>of(variable);
        return new Location(State.UNLOCATED_VARIABLE, 0, Optional.empty(), 0, () -> found, symbolContext);
    }

    /** The same location moved to {@code newAddress}, used for unlocated variables and relative results. */
    public Location withAddress(long newAddress) {
        State newState;
        switch (state) {
            case INVALID:
                newState = State.ADDRESS;
                break;
            case UNLOCATED_VARIABLE:
                newState = State.SYMBOLIZED;
                break;
            default:
                newState = state;
        }
        return new Location(newState, newAddress, fileLine, column, symbol, symbolContext);
    }

    public State state() {
        return state;
    }

    public boolean isValid() {
        return state == State.ADDRESS || state == State.SYMBOLIZED;
    }

    public boolean isSymbolized() {
        return state == State.SYMBOLIZED;
    }

    public boolean hasAddress() {
        return isValid();
    }

    public long address() {
        return address;
    }

    public Optional<FileLine> fileLine() {
        return fileLine;
    }

    public int column() {
        return column;
    }

    public Optional<Symbol> symbol() {
        return symbol.get();
    }

    public SymbolContext symbolContext() {
        return symbolContext;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Location)) return false;
        var that = (Location) other;
        return this.state == that.state
                && this.address == that.address
                && this.column == that.column
                && this.fileLine.equals(that.fileLine)
                && this.symbolContext.equals(that.symbolContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, address, fileLine, column, symbolContext);
    }

    @Override
    public String toString() {
        var s = new StringBuilder();
        switch (state) {
            case INVALID:
                return "<invalid>";
            case UNLOCATED_VARIABLE:
                return symbol().map(Symbol::toString).orElse("<variable>") + " (no address)";
            default:
                s.append(String.format("0x%x", address));
        }
        var sym = symbol();
        if (sym.isPresent()) s.append(' ').append(sym.get());
        if (fileLine.isPresent()) s.append(" @ ").append(fileLine.get());
        return s.toString();
    }
}
