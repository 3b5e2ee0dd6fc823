package org.symdbg.breakpoint;

import org.symdbg.DebugError;

public interface BreakpointObserver {
    /**
     * New locations were found for the breakpoint, because a process started or a module loaded. {@code
     * newlyBound} is false when only addresses the breakpoint already had were found again.
     */
    default void onBreakpointMatched(Breakpoint breakpoint, boolean newlyBound) {}

    /** The agent couldn't be updated. The breakpoint's local state is unchanged. */
    default void onBreakpointUpdateFailure(Breakpoint breakpoint, DebugError error) {}
}
