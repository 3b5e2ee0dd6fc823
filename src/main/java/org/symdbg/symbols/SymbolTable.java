package org.symdbg.symbols;

import java.util.ArrayList;
import java.util.List;

/** On-disk form of a module's symbols, read with gson. All addresses are relative to the module's load address. */
public class SymbolTable {
    public String buildId;
    /** Name of the binary. */
    public String name;

    public List<Function> functions = new ArrayList<>();
    public List<Variable> variables = new ArrayList<>();

    public static class Function {
        /** Fully-qualified name, like {@code NS::Foo::Bar}. */
        public String name;
        /** Fully-qualified name of the class the function is a member of, null for free functions. */
        public String containingClass;
        public long begin;
        public long end;
        /** Address of the first instruction after the prologue, null when unknown. */
        public Long prologueEnd;
        /** Line table rows, sorted by address. A row covers up to the next row or the end of the function. */
        public List<Line> lines = new ArrayList<>();
    }

    public static class Line {
        public long address;
        public String file;
        public int line;
        public int column;

        public Line() {}

        public Line(long address, String file, int line) {
            this.address = address;
            this.file = file;
            this.line = line;
        }
    }

    public static class Variable {
        public String name;
        /** Null when the address isn't known statically. */
        public Long address;
        public boolean threadLocal;
    }
}
