package org.symdbg.symbols;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

public class LocationTest {
    @Test
    public void withAddressLocatesVariables() {
        var variable = new VariableSymbol(Identifier.parse("tls_state"), OptionalLong.empty(), true);
        var unlocated = Location.unlocatedVariable(variable, SymbolContext.forRelativeAddresses());
        assertFalse(unlocated.isValid());
        var located = unlocated.withAddress(0x3000);
        assertThat(located.state(), equalTo(Location.State.SYMBOLIZED));
        assertThat(located.symbol(), equalTo(Optional.<Symbol>of(variable)));
    }

    @Test
    public void withAddressOnInvalid() {
        var located = Location.invalid().withAddress(0x10);
        assertThat(located.state(), equalTo(Location.State.ADDRESS));
        assertThat(located.address(), equalTo(0x10L));
    }

    @Test
    public void symbolIsLookedUpOnce() {
        var lookups = new AtomicInteger();
        var location =
                Location.symbolized(
                        0x1000,
                        Optional.empty(),
                        0,
                        new SymbolContext(0x1000),
                        () -> {
                            lookups.incrementAndGet();
                            return Optional.empty();
                        });
        assertThat(lookups.get(), equalTo(0));
        location.symbol();
        location.symbol();
        assertThat(lookups.get(), equalTo(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void prologueSkipRequiresSymbolizing() {
        new ResolveOptions(false, true);
    }
}
