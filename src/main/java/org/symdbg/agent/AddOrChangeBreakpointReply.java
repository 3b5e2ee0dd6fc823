package org.symdbg.agent;

public class AddOrChangeBreakpointReply {
    /** 0 on success, otherwise one of the codes in {@link AgentStatus}. */
    public int status;

    public AddOrChangeBreakpointReply() {}

    public AddOrChangeBreakpointReply(int status) {
        this.status = status;
    }
}
