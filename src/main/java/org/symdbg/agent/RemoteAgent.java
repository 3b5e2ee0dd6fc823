package org.symdbg.agent;

import java.util.concurrent.CompletableFuture;

/**
 * The debug agent on the other end of the transport. Requests are fire-and-forget; a future that completes
 * exceptionally means the transport failed, a reply with a non-zero status means the agent refused.
 */
public interface RemoteAgent {
    CompletableFuture<AddOrChangeBreakpointReply> addOrChangeBreakpoint(AddOrChangeBreakpointRequest request);

    CompletableFuture<RemoveBreakpointReply> removeBreakpoint(RemoveBreakpointRequest request);
}
