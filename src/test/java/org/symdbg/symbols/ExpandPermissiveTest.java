package org.symdbg.symbols;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Optional;
import org.junit.Test;

public class ExpandPermissiveTest {
    static FindNameContext inClass(String containingClass) {
        var function =
                new FunctionSymbol(
                        Identifier.parse(containingClass + "::Run"),
                        Optional.of(Identifier.parse(containingClass)),
                        0x100,
                        0x200,
                        Optional.empty());
        return new FindNameContext(Optional.empty(), new TargetSymbols(), Optional.of(function));
    }

    @Test
    public void classScopedNameComesFirst() {
        var expanded = ExpandPermissive.expandInputLocation(inClass("NS::Foo"), InputLocation.name("Bar"));
        assertThat(expanded, contains(InputLocation.name("NS::Foo::Bar"), InputLocation.name("Bar")));
    }

    @Test
    public void freeFunctionUsesItsNamespace() {
        var helper =
                new FunctionSymbol(Identifier.parse("NS::helper"), Optional.empty(), 0x100, 0x200, Optional.empty());
        var context = new FindNameContext(Optional.empty(), new TargetSymbols(), Optional.of(helper));
        var expanded = ExpandPermissive.expandInputLocation(context, InputLocation.name("Bar"));
        assertThat(expanded, contains(InputLocation.name("NS::Bar"), InputLocation.name("Bar")));
    }

    @Test
    public void topLevelFunctionAddsNothing() {
        var main = new FunctionSymbol(Identifier.parse("main"), Optional.empty(), 0x100, 0x200, Optional.empty());
        var context = new FindNameContext(Optional.empty(), new TargetSymbols(), Optional.of(main));
        var expanded = ExpandPermissive.expandInputLocation(context, InputLocation.name("Bar"));
        assertThat(expanded, contains(InputLocation.name("Bar")));
    }

    @Test
    public void globalNamesAreNotExpanded() {
        var expanded = ExpandPermissive.expandInputLocation(inClass("NS::Foo"), InputLocation.name("::Bar"));
        assertThat(expanded, contains(InputLocation.name("::Bar")));
    }

    @Test
    public void noFunctionNoExpansion() {
        var context = FindNameContext.forTarget(new TargetSymbols());
        var expanded = ExpandPermissive.expandInputLocation(context, InputLocation.name("Bar"));
        assertThat(expanded, contains(InputLocation.name("Bar")));
    }

    @Test
    public void otherKindsPassThrough() {
        var context = inClass("NS::Foo");
        assertThat(
                ExpandPermissive.expandInputLocation(context, InputLocation.line("foo.cc", 3)),
                contains(InputLocation.line("foo.cc", 3)));
        assertThat(
                ExpandPermissive.expandInputLocation(context, InputLocation.address(0x1234)),
                contains(InputLocation.address(0x1234)));
    }

    @Test
    public void noDuplicates() {
        var context = inClass("NS::Foo");
        var expanded =
                ExpandPermissive.expandInputLocations(
                        context, List.of(InputLocation.name("Bar"), InputLocation.name("NS::Foo::Bar")));
        assertThat(
                expanded,
                contains(
                        InputLocation.name("NS::Foo::Bar"),
                        InputLocation.name("Bar"),
                        InputLocation.name("NS::Foo::NS::Foo::Bar")));
    }
}
