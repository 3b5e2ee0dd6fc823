package org.symdbg.agent;

public class RemoveBreakpointReply {
    /** 0 on success, otherwise one of the codes in {@link AgentStatus}. */
    public int status;

    public RemoveBreakpointReply() {}

    public RemoveBreakpointReply(int status) {
        this.status = status;
    }
}
