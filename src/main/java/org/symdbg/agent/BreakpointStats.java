package org.symdbg.agent;

/** Sent by the agent with every breakpoint hit. */
public class BreakpointStats {
    public int id;
    public int hitCount;
    /** Set for one-shot breakpoints that the agent has already removed. */
    public boolean shouldDelete;

    public BreakpointStats() {}

    public BreakpointStats(int id, int hitCount, boolean shouldDelete) {
        this.id = id;
        this.hitCount = hitCount;
        this.shouldDelete = shouldDelete;
    }
}
