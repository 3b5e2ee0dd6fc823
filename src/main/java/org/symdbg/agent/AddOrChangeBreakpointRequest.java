package org.symdbg.agent;

/** Install a breakpoint, or replace the settings of one already installed with the same id. */
public class AddOrChangeBreakpointRequest {
    public AgentBreakpoint breakpoint;

    public AddOrChangeBreakpointRequest() {}

    public AddOrChangeBreakpointRequest(AgentBreakpoint breakpoint) {
        this.breakpoint = breakpoint;
    }
}
