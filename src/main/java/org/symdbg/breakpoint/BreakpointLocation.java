package org.symdbg.breakpoint;

import org.symdbg.DebuggedProcess;
import org.symdbg.symbols.Location;

/** One address a breakpoint resolved to in one process. */
public interface BreakpointLocation {
    DebuggedProcess process();

    long address();

    /** The symbolized location, looked up on demand. */
    Location getLocation();

    boolean isEnabled();

    /** Enable or disable only this address. The agent is updated if anything changed. */
    void setEnabled(boolean enabled);
}
