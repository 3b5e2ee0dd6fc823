package org.symdbg.symbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A possibly-qualified symbol name like {@code ::NS::Foo::Bar}. Components are separated by {@code ::}; the
 * separator is not split when it appears inside a template argument list.
 */
public class Identifier {
    private final boolean global;
    private final List<String> components;

    public Identifier(boolean global, List<String> components) {
        this.global = global;
        this.components = List.copyOf(components);
    }

    public static Identifier parse(String name) {
        var global = name.startsWith("::");
        if (global) name = name.substring(2);
        var components = new ArrayList<String>();
        var depth = 0;
        var start = 0;
        for (var i = 0; i < name.length(); i++) {
            var c = name.charAt(i);
            if (c == '<' || c == '(') depth++;
            else if ((c == '>' || c == ')') && depth > 0) depth--;
            else if (depth == 0 && c == ':' && i + 1 < name.length() && name.charAt(i + 1) == ':') {
                components.add(name.substring(start, i));
                start = i + 2;
                i++;
            }
        }
        components.add(name.substring(start));
        return new Identifier(global, components);
    }

    /** True when written with a leading {@code ::}, which means it is never expanded against a scope. */
    public boolean isGlobal() {
        return global;
    }

    public List<String> components() {
        return components;
    }

    public String lastComponent() {
        return components.get(components.size() - 1);
    }

    /** The scope this name is declared in, or an empty identifier for a single component. */
    public Identifier parent() {
        if (components.size() <= 1) return new Identifier(global, List.of());
        return new Identifier(global, components.subList(0, components.size() - 1));
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /** Qualify {@code this} by {@code scope}, so {@code Bar} in {@code NS::Foo} is {@code NS::Foo::Bar}. */
    public Identifier qualifiedBy(Identifier scope) {
        var joined = new ArrayList<String>(scope.components);
        joined.addAll(components);
        return new Identifier(scope.global, joined);
    }

    /** The name without a leading {@code ::}, used for comparing against indexed symbols. */
    public String qualifiedName() {
        return String.join("::", components);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Identifier)) return false;
        var that = (Identifier) other;
        return this.global == that.global && this.components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(global, components);
    }

    @Override
    public String toString() {
        if (global) return "::" + qualifiedName();
        return qualifiedName();
    }
}
