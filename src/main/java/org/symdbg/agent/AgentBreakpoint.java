package org.symdbg.agent;

import java.util.ArrayList;
import java.util.List;

/** A breakpoint as the agent sees it: addresses only. */
public class AgentBreakpoint {
    public enum Type {
        SOFTWARE,
        HARDWARE,
        READ_WRITE,
        WRITE
    }

    public enum Stop {
        /** Record the hit and keep going. */
        NONE,
        THREAD,
        PROCESS,
        ALL
    }

    /** Assigned by the client when the breakpoint is created and never reused. */
    public int id;

    public Type type = Type.SOFTWARE;
    public String name = "";
    public Stop stop = Stop.ALL;
    /** Delete the breakpoint after the first hit. */
    public boolean oneShot;

    public List<ProcessBreakpointSettings> locations = new ArrayList<>();
}
