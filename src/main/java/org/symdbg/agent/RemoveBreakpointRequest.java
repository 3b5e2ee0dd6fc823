package org.symdbg.agent;

public class RemoveBreakpointRequest {
    public int breakpointId;

    public RemoveBreakpointRequest() {}

    public RemoveBreakpointRequest(int breakpointId) {
        this.breakpointId = breakpointId;
    }
}
