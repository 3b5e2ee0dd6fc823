package org.symdbg.symbols;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;
import static org.symdbg.symbols.SymbolTables.*;

import java.util.Optional;
import org.junit.Test;

public class IndexedModuleSymbolsTest {
    static final long BASE = 0x10000;
    static final SymbolContext CONTEXT = new SymbolContext(BASE);

    IndexedModuleSymbols symbols = module(sampleTable());

    static SymbolTable sampleTable() {
        var main =
                function(
                        "main",
                        0x400,
                        0x480,
                        line(0x400, "/src/app/main.cc", 10),
                        line(0x410, "/src/app/main.cc", 11),
                        line(0x430, "/src/app/main.cc", 14));
        var bar =
                member(
                        "NS::Foo",
                        "Bar",
                        0x500,
                        0x540,
                        line(0x500, "/src/app/foo.cc", 20),
                        line(0x510, "/src/app/foo.cc", 21));
        bar.prologueEnd = 0x508L;
        var table = table("abc123", "app", main, bar);
        table.variables.add(variable("g_count", 0x2000L, false));
        table.variables.add(variable("tls_state", null, true));
        return table;
    }

    @Test
    public void addressWithoutSymbolizingIsIdentity() {
        var found =
                symbols.resolveInputLocation(CONTEXT, InputLocation.address(0x10450), ResolveOptions.ADDRESSES_ONLY);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10450L));
        assertThat(found.get(0).state(), equalTo(Location.State.ADDRESS));
    }

    @Test
    public void symbolizeAddress() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.address(0x10412), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        var location = found.get(0);
        assertTrue(location.isSymbolized());
        assertThat(location.address(), equalTo(0x10412L));
        assertThat(location.fileLine(), equalTo(Optional.of(new FileLine("/src/app/main.cc", 11))));
        assertThat(location.symbol().get().fullName(), equalTo(Identifier.parse("main")));
    }

    @Test
    public void addressOutsideAnyFunctionIsNotSymbolized() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.address(0x19000), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).state(), equalTo(Location.State.ADDRESS));
    }

    @Test
    public void functionEntry() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.name("main"), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10400L));
        assertThat(found.get(0).fileLine().get().line, equalTo(10));
    }

    @Test
    public void skipPrologueUsesSecondLineRow() {
        var found =
                symbols.resolveInputLocation(
                        CONTEXT, InputLocation.name("main"), ResolveOptions.SYMBOLIZE_SKIP_PROLOGUE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10410L));
        assertThat(found.get(0).fileLine().get().line, equalTo(11));
    }

    @Test
    public void skipPrologueUsesPrologueEnd() {
        var found =
                symbols.resolveInputLocation(
                        CONTEXT, InputLocation.name("NS::Foo::Bar"), ResolveOptions.SYMBOLIZE_SKIP_PROLOGUE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10508L));
    }

    @Test
    public void unsymbolizedNameKeepsModuleContext() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.name("main"), ResolveOptions.ADDRESSES_ONLY);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).state(), equalTo(Location.State.ADDRESS));
        assertThat(found.get(0).symbolContext(), equalTo(CONTEXT));
    }

    @Test
    public void unknownName() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.name("nope"), ResolveOptions.SYMBOLIZE);
        assertThat(found, empty());
    }

    @Test
    public void exactLine() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.line("main.cc", 11), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10410L));
    }

    @Test
    public void lineWithoutCodeMovesToNextLine() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.line("main.cc", 12), ResolveOptions.SYMBOLIZE);
        assertThat(found, hasSize(1));
        assertThat(found.get(0).address(), equalTo(0x10430L));
        assertThat(found.get(0).fileLine().get().line, equalTo(14));
    }

    @Test
    public void lineOutsideFunctions() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.line("main.cc", 99), ResolveOptions.SYMBOLIZE);
        assertThat(found, empty());
    }

    @Test
    public void fileNameMustMatchWholeComponents() {
        var found = symbols.resolveInputLocation(CONTEXT, InputLocation.line("ain.cc", 11), ResolveOptions.SYMBOLIZE);
        assertThat(found, empty());
    }

    @Test
    public void variables() {
        var global = symbols.resolveInputLocation(CONTEXT, InputLocation.name("g_count"), ResolveOptions.SYMBOLIZE);
        assertThat(global, hasSize(1));
        assertThat(global.get(0).address(), equalTo(0x12000L));

        var threadLocal =
                symbols.resolveInputLocation(CONTEXT, InputLocation.name("tls_state"), ResolveOptions.SYMBOLIZE);
        assertThat(threadLocal, hasSize(1));
        assertThat(threadLocal.get(0).state(), equalTo(Location.State.UNLOCATED_VARIABLE));
        assertFalse(threadLocal.get(0).isValid());
    }

    @Test
    public void lineDetails() {
        var details = symbols.lineDetailsForAddress(CONTEXT, 0x10415);
        assertTrue(details.isValid());
        assertThat(details.fileLine.get().line, equalTo(11));
        assertThat(details.begin, equalTo(0x10410L));
        assertThat(details.end, equalTo(0x10430L));
        assertFalse(symbols.lineDetailsForAddress(CONTEXT, 0x10600).isValid());
    }

    @Test
    public void status() {
        var status = symbols.getStatus();
        assertThat(status.buildId, equalTo("abc123"));
        assertThat(status.functionsIndexed, equalTo(2));
        assertThat(status.filesIndexed, equalTo(2));
        assertTrue(status.symbolsLoaded);
    }

    @Test
    public void findFileMatches() {
        assertThat(symbols.findFileMatches("foo.cc"), contains("/src/app/foo.cc"));
        assertThat(symbols.findFileMatches("app/main.cc"), contains("/src/app/main.cc"));
    }

    @Test
    public void functionsAboveTheSignBitAreFound() {
        var kernel =
                module(
                        table(
                                "k1",
                                "kernel",
                                function("low", 0x100, 0x140),
                                function("high", 0x8000000000000100L, 0x8000000000000140L)));
        var relative = SymbolContext.forRelativeAddresses();
        var found =
                kernel.resolveInputLocation(
                        relative, InputLocation.address(0x8000000000000120L), ResolveOptions.SYMBOLIZE);
        assertThat(found.get(0).symbol().get().fullName(), equalTo(Identifier.parse("high")));
        var low = kernel.resolveInputLocation(relative, InputLocation.address(0x120), ResolveOptions.SYMBOLIZE);
        assertThat(low.get(0).symbol().get().fullName(), equalTo(Identifier.parse("low")));
        assertThat(kernel.getStatus().functionsIndexed, equalTo(2));
    }
}
