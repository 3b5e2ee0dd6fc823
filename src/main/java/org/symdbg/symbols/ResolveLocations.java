package org.symdbg.symbols;

import java.util.ArrayList;
import java.util.List;

/** Entry points for turning user input into locations, with the errors a user should see. */
public class ResolveLocations {
    /** How many candidates an ambiguity error lists before eliding the rest. */
    public static final int MAX_CANDIDATES = 10;

    private ResolveLocations() {}

    public static List<Location> resolveInputLocations(LocationResolver symbols, InputLocation input, boolean symbolize)
            throws ResolveException {
        return resolveInputLocations(symbols, List.of(input), symbolize);
    }

    /** Every location any of {@code inputs} matches, in input order. Fails when nothing matches. */
    public static List<Location> resolveInputLocations(
            LocationResolver symbols, List<InputLocation> inputs, boolean symbolize) throws ResolveException {
        var options = ResolveOptions.of(symbolize);
        var result = new ArrayList<Location>();
        for (var input : inputs) {
            result.addAll(symbols.resolveInputLocation(input, options));
        }
        if (result.isEmpty()) throw new ResolveException("Nothing matched this location.");
        return result;
    }

    /** Like {@link #resolveInputLocations(LocationResolver, List, boolean)} after expanding bare names. */
    public static List<Location> resolveInputLocations(
            FindNameContext context, List<InputLocation> inputs, boolean symbolize) throws ResolveException {
        var expanded = ExpandPermissive.expandInputLocations(context, inputs);
        return resolveInputLocations(context.resolver(), expanded, symbolize);
    }

    public static Location resolveUniqueInputLocation(LocationResolver symbols, InputLocation input, boolean symbolize)
            throws ResolveException {
        return unique(resolveInputLocations(symbols, input, symbolize));
    }

    /** The single location {@code inputs} match. Fails listing the candidates when there is more than one. */
    public static Location resolveUniqueInputLocation(
            LocationResolver symbols, List<InputLocation> inputs, boolean symbolize) throws ResolveException {
        return unique(resolveInputLocations(symbols, inputs, symbolize));
    }

    public static Location resolveUniqueInputLocation(
            FindNameContext context, List<InputLocation> inputs, boolean symbolize) throws ResolveException {
        return unique(resolveInputLocations(context, inputs, symbolize));
    }

    private static Location unique(List<Location> locations) throws ResolveException {
        if (locations.size() == 1) return locations.get(0);
        var message = new StringBuilder("This resolves to more than one location. Could be:\n");
        for (var i = 0; i < locations.size() && i < MAX_CANDIDATES; i++) {
            message.append(" ").append(describe(locations.get(i))).append('\n');
        }
        if (locations.size() > MAX_CANDIDATES) {
            message.append(String.format("...%d more omitted...\n", locations.size() - MAX_CANDIDATES));
        }
        throw new ResolveException(message.toString(), locations);
    }

    /** {@code file:line = 0x1234}, or just the address and symbol when there's no line. */
    static String describe(Location location) {
        if (location.fileLine().isPresent()) {
            return String.format("%s = 0x%x", location.fileLine().get(), location.address());
        }
        var symbol = location.symbol();
        if (symbol.isPresent()) return String.format("0x%x (%s)", location.address(), symbol.get());
        return String.format("0x%x", location.address());
    }
}
