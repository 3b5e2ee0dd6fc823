package org.symdbg.symbols;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;
import static org.symdbg.symbols.SymbolTables.*;

import java.util.List;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;

public class TargetSymbolsTest {
    SystemSymbols system = new SystemSymbols(List.of(), Set.of());
    TargetSymbols target = new TargetSymbols();

    @Before
    public void addModule() throws SymbolLoadException {
        var table = table("aaaa", "a", function("main", 0x100, 0x140, line(0x100, "/src/main.cc", 3)));
        table.variables.add(variable("tls_state", null, true));
        system.injectModuleForTesting(module(table));
        try (var ref = system.getModule("a", "aaaa").get()) {
            target.addModule(ref);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void addressesAreRejected() {
        target.resolveInputLocation(InputLocation.address(0x100), ResolveOptions.ADDRESSES_ONLY);
    }

    @Test
    public void locationsHaveNoAddress() {
        var found = target.resolveInputLocation(InputLocation.name("main"), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0L));
        assertThat(found.get(0).fileLine().get().line, equalTo(3));

        var lines = target.resolveInputLocation(InputLocation.line("main.cc", 3), ResolveOptions.ADDRESSES_ONLY);
        assertThat(lines, hasSize(1));
        assertThat(lines.get(0).address(), equalTo(0L));
    }

    @Test
    public void unlocatedVariablesStayUnlocated() {
        var found = target.resolveInputLocation(InputLocation.name("tls_state"), ResolveOptions.SYMBOLIZE);
        assertThat(found.get(0).state(), equalTo(Location.State.UNLOCATED_VARIABLE));
    }

    @Test
    public void addingTwiceKeepsOneModule() throws SymbolLoadException {
        try (var ref = system.getModule("a", "aaaa").get()) {
            target.addModule(ref);
        }
        assertThat(target.getModuleSymbols(), hasSize(1));
    }

    @Test
    public void cloneSharesModules() {
        var clone = new TargetSymbols(target);
        target.removeAllModules();
        assertThat(clone.getModuleSymbols(), hasSize(1));
        assertThat(target.getModuleSymbols(), empty());
        assertThat(clone.findFileMatches("main.cc"), contains("/src/main.cc"));
    }
}
