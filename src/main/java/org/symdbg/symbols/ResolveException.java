package org.symdbg.symbols;

import java.util.List;

/** An input location matched nothing, or matched more than one location where one was required. */
public class ResolveException extends Exception {
    private final List<Location> candidates;

    public ResolveException(String message) {
        this(message, List.of());
    }

    public ResolveException(String message, List<Location> candidates) {
        super(message);
        this.candidates = List.copyOf(candidates);
    }

    /** Every location that matched when the match was ambiguous, empty when nothing matched. */
    public List<Location> candidates() {
        return candidates;
    }
}
