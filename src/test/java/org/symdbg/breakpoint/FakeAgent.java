package org.symdbg.breakpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.symdbg.agent.AddOrChangeBreakpointReply;
import org.symdbg.agent.AddOrChangeBreakpointRequest;
import org.symdbg.agent.AgentBreakpoint;
import org.symdbg.agent.AgentStatus;
import org.symdbg.agent.RemoteAgent;
import org.symdbg.agent.RemoveBreakpointReply;
import org.symdbg.agent.RemoveBreakpointRequest;

/** Records requests and answers them with {@link #status}, or holds the replies until the test completes them. */
class FakeAgent implements RemoteAgent {
    final List<AddOrChangeBreakpointRequest> adds = new ArrayList<>();
    final List<RemoveBreakpointRequest> removes = new ArrayList<>();
    final List<CompletableFuture<AddOrChangeBreakpointReply>> pendingAdds = new ArrayList<>();
    int status = AgentStatus.OK;
    RuntimeException transportError;
    boolean disconnected;
    boolean holdReplies;

    @Override
    public CompletableFuture<AddOrChangeBreakpointReply> addOrChangeBreakpoint(AddOrChangeBreakpointRequest request) {
        if (disconnected) throw new IllegalStateException("Not connected");
        adds.add(request);
        var reply = new CompletableFuture<AddOrChangeBreakpointReply>();
        if (holdReplies) {
            pendingAdds.add(reply);
        } else {
            complete(reply, new AddOrChangeBreakpointReply(status));
        }
        return reply;
    }

    @Override
    public CompletableFuture<RemoveBreakpointReply> removeBreakpoint(RemoveBreakpointRequest request) {
        if (disconnected) throw new IllegalStateException("Not connected");
        removes.add(request);
        var reply = new CompletableFuture<RemoveBreakpointReply>();
        complete(reply, new RemoveBreakpointReply(status));
        return reply;
    }

    private <T> void complete(CompletableFuture<T> reply, T value) {
        if (transportError != null) {
            reply.completeExceptionally(transportError);
        } else {
            reply.complete(value);
        }
    }

    AgentBreakpoint lastAdd() {
        return adds.get(adds.size() - 1).breakpoint;
    }

    int requestCount() {
        return adds.size() + removes.size();
    }
}
