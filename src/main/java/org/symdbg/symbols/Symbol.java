package org.symdbg.symbols;

/** A named entity from a module's symbol table. Addresses held by symbols are module-relative. */
public abstract class Symbol {
    private final Identifier fullName;

    protected Symbol(Identifier fullName) {
        this.fullName = fullName;
    }

    public Identifier fullName() {
        return fullName;
    }

    @Override
    public String toString() {
        return fullName.toString();
    }
}
