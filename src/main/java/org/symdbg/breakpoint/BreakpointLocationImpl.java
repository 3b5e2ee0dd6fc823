package org.symdbg.breakpoint;

import java.util.OptionalLong;
import org.symdbg.DebuggedProcess;
import org.symdbg.symbols.InputLocation;
import org.symdbg.symbols.Location;
import org.symdbg.symbols.ResolveOptions;

class BreakpointLocationImpl implements BreakpointLocation {
    private final BreakpointImpl breakpoint;
    private final DebuggedProcess process;
    private final Location location;
    private boolean enabled = true;

    BreakpointLocationImpl(BreakpointImpl breakpoint, DebuggedProcess process, Location location) {
        this.breakpoint = breakpoint;
        this.process = process;
        this.location = location;
    }

    @Override
    public DebuggedProcess process() {
        return process;
    }

    @Override
    public long address() {
        return location.address();
    }

    @Override
    public Location getLocation() {
        if (location.isSymbolized()) return location;
        var found =
                process.symbols()
                        .resolveInputLocation(InputLocation.address(location.address()), ResolveOptions.SYMBOLIZE);
        if (found.isEmpty()) return location;
        return found.get(0);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        if (this.enabled == enabled) return;
        this.enabled = enabled;
        breakpoint.didChangeLocation();
    }

    /** Load address of the module this location was found in. Empty for raw addresses. */
    OptionalLong owningModule() {
        var context = location.symbolContext();
        if (context.isRelative()) return OptionalLong.empty();
        return OptionalLong.of(context.relativeBase());
    }

    /** Keep the user's choice when the same address is found again. */
    void copyEnabledFrom(BreakpointLocationImpl previous) {
        this.enabled = previous.enabled;
    }

    @Override
    public String toString() {
        return String.format("%s in %s%s", location, process, enabled ? "" : " (disabled)");
    }
}
