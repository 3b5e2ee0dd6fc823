package org.symdbg.breakpoint;

import java.util.List;
import org.symdbg.agent.BreakpointStats;

public interface Breakpoint {
    /** Unique within the debug system and never reused. Also the ID the agent knows the breakpoint by. */
    int id();

    BreakpointSettings getSettings();

    /**
     * Replace the settings. Locations are resolved again in every process the new scope covers, and the agent is
     * updated. Failures to update the agent are reported to {@link BreakpointObserver}s later.
     *
     * @throws IllegalArgumentException for a watchpoint type without a positive {@code byteSize}
     */
    void setSettings(BreakpointSettings settings);

    /** Every resolved location in every process, enabled or not. */
    List<BreakpointLocation> getLocations();

    BreakpointStats getStats();
}
