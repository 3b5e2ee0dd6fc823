package org.symdbg.symbols;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Widens a bare name into the fully-qualified names it could mean from where it was written. A name written inside
 * a member function of {@code NS::Foo} could mean {@code NS::Foo::name}, one written inside the free function
 * {@code NS::helper} could mean {@code NS::name}, and either could always mean the name as written.
 * This is purely lexical; which candidates really exist is up to the resolver.
 */
public class ExpandPermissive {
    private ExpandPermissive() {}

    /** Candidates for {@code input}, most specific first, without duplicates. */
    public static List<InputLocation> expandInputLocation(FindNameContext context, InputLocation input) {
        return input.accept(
                new InputLocation.Visitor<List<InputLocation>>() {
                    @Override
                    public List<InputLocation> visitNone() {
                        return List.of(input);
                    }

                    @Override
                    public List<InputLocation> visitAddress(long address) {
                        return List.of(input);
                    }

                    @Override
                    public List<InputLocation> visitLine(FileLine line) {
                        return List.of(input);
                    }

                    @Override
                    public List<InputLocation> visitName(Identifier name) {
                        var names = new ArrayList<InputLocation>();
                        for (var candidate : expandName(context, name)) {
                            names.add(InputLocation.name(candidate));
                        }
                        return names;
                    }
                });
    }

    public static List<InputLocation> expandInputLocations(FindNameContext context, List<InputLocation> inputs) {
        var result = new LinkedHashSet<InputLocation>();
        for (var input : inputs) {
            result.addAll(expandInputLocation(context, input));
        }
        return new ArrayList<>(result);
    }

    static List<Identifier> expandName(FindNameContext context, Identifier name) {
        var result = new LinkedHashSet<Identifier>();
        if (!name.isGlobal() && context.enclosingFunction.isPresent()) {
            var scope = enclosingScope(context.enclosingFunction.get());
            if (!scope.isEmpty()) result.add(name.qualifiedBy(scope));
        }
        result.add(name);
        return new ArrayList<>(result);
    }

    /** The class or namespace the function is declared in; its containing class when the name has no scope. */
    private static Identifier enclosingScope(FunctionSymbol function) {
        var parent = function.fullName().parent();
        if (!parent.isEmpty()) return parent;
        return function.containingClass().orElse(parent);
    }
}
