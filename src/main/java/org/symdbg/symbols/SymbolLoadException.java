package org.symdbg.symbols;

/** Symbols for a build ID could not be found or read. */
public class SymbolLoadException extends Exception {
    private final String buildId;

    public SymbolLoadException(String buildId, String message) {
        super(message);
        this.buildId = buildId;
    }

    public SymbolLoadException(String buildId, String message, Throwable cause) {
        super(message, cause);
        this.buildId = buildId;
    }

    public String buildId() {
        return buildId;
    }
}
