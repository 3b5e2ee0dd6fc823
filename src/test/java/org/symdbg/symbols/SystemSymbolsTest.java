package org.symdbg.symbols;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import org.junit.Test;

public class SystemSymbolsTest {
    static final Path SYMBOLS = Paths.get("src/test/resources/symbols");

    SystemSymbols system = new SystemSymbols(List.of(SYMBOLS), Set.of("<vDSO>"));

    @Test
    public void loadBuildIdFile() throws SymbolLoadException {
        try (var ref = system.getModule("hello", "0123abcd").get()) {
            var symbols = ref.get();
            assertThat(symbols.buildId(), equalTo("0123abcd"));
            assertThat(symbols.getStatus().functionsIndexed, equalTo(2));
            assertThat(symbols.getStatus().symbolFile, endsWith("0123abcd.json"));
            var found =
                    symbols.resolveInputLocation(
                            new SymbolContext(0x1000),
                            InputLocation.name("hello::Greeter::Greet"),
                            ResolveOptions.SYMBOLIZE_SKIP_PROLOGUE);
            assertThat(found, hasSize(1));
            assertThat(found.get(0).address(), equalTo(0x1000L + 1288));
        }
    }

    @Test
    public void loadFromBuildIdDirectory() throws SymbolLoadException {
        try (var ref = system.getModule("libgreet.so", "fedc98").get()) {
            assertThat(ref.get().buildId(), equalTo("fedc98"));
            assertThat(ref.get().findSymbols(Identifier.parse("greet")), hasSize(1));
        }
    }

    @Test
    public void missingFile() {
        try {
            system.getModule("gone", "99999999");
            fail("Expected SymbolLoadException");
        } catch (SymbolLoadException e) {
            assertThat(e.buildId(), equalTo("99999999"));
        }
        assertFalse(system.hasModule("99999999"));
    }

    @Test(expected = SymbolLoadException.class)
    public void wrongBuildId() throws SymbolLoadException {
        system.getModule("wrong", "badbad");
    }

    @Test(expected = SymbolLoadException.class)
    public void malformedFile() throws SymbolLoadException {
        system.getModule("broken", "broken");
    }

    @Test
    public void modulesWithoutSymbols() throws SymbolLoadException {
        assertTrue(system.getModule("<vDSO>", "0123abcd").isEmpty());
        assertTrue(system.getModule("hello", "").isEmpty());
        assertTrue(system.getModule("hello", null).isEmpty());
        assertThat(system.moduleCount(), equalTo(0));
    }

    @Test
    public void sharedUntilLastRelease() throws SymbolLoadException {
        var first = system.getModule("hello", "0123abcd").get();
        var second = system.getModule("hello", "0123abcd").get();
        var provider = first.get();
        assertThat(second.get(), sameInstance(provider));
        var third = second.share();

        first.close();
        second.close();
        assertTrue(system.hasModule("0123abcd"));
        third.close();
        assertFalse(system.hasModule("0123abcd"));

        var reloaded = system.getModule("hello", "0123abcd").get();
        assertThat(reloaded.get(), not(sameInstance(provider)));
    }

    @Test(expected = IllegalStateException.class)
    public void closedRefCannotBeUsed() throws SymbolLoadException {
        var ref = system.getModule("hello", "0123abcd").get();
        ref.close();
        ref.get();
    }
}
