package org.symdbg;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.Test;
import org.symdbg.agent.AddOrChangeBreakpointReply;
import org.symdbg.agent.AddOrChangeBreakpointRequest;
import org.symdbg.agent.BreakpointStats;
import org.symdbg.agent.ModuleInfo;
import org.symdbg.agent.RemoteAgent;
import org.symdbg.agent.RemoveBreakpointReply;
import org.symdbg.agent.RemoveBreakpointRequest;
import org.symdbg.symbols.LoadedModuleSymbols;

public class DebugSystemTest {
    RemoteAgent agent =
            new RemoteAgent() {
                @Override
                public CompletableFuture<AddOrChangeBreakpointReply> addOrChangeBreakpoint(
                        AddOrChangeBreakpointRequest request) {
                    return CompletableFuture.completedFuture(new AddOrChangeBreakpointReply(0));
                }

                @Override
                public CompletableFuture<RemoveBreakpointReply> removeBreakpoint(RemoveBreakpointRequest request) {
                    return CompletableFuture.completedFuture(new RemoveBreakpointReply(0));
                }
            };
    DebugSystem system =
            new DebugSystem(DebugSettings.load(Paths.get("src/test/resources/settings.json")), agent, new MessageLoop());
    List<String> events = new ArrayList<>();

    class RecordingObserver implements ProcessObserver, ThreadObserver, TargetObserver {
        @Override
        public void didCreateProcess(DebuggedProcess process, boolean autoattached) {
            events.add("create " + process.koid());
        }

        @Override
        public void willDestroyProcess(DebuggedProcess process, DestroyReason reason, int exitCode) {
            events.add("destroy " + process.koid() + " " + reason);
        }

        @Override
        public void didLoadModuleSymbols(DebuggedProcess process, LoadedModuleSymbols module) {
            events.add("load " + module.name());
        }

        @Override
        public void onSymbolLoadFailure(DebuggedProcess process, DebugError error) {
            events.add("failed " + error.type());
        }

        @Override
        public void willDestroyThread(DebuggedThread thread) {
            events.add("thread exit " + thread.koid());
        }

        @Override
        public void willDestroyTarget(Target target) {
            events.add("target gone " + target.id());
        }
    }

    void observe() {
        var observer = new RecordingObserver();
        system.addProcessObserver(observer);
        system.addThreadObserver(observer);
        system.addTargetObserver(observer);
    }

    @Test
    public void symbolsComeFromSettings() {
        observe();
        var target = system.createNewTarget();
        var process = target.processCreated(10, "hello", false);
        process.onModules(List.of(new ModuleInfo("hello", 0x1000, "0123abcd"), new ModuleInfo("x", 0x9000, "ffff")));
        assertThat(events, contains("create 10", "failed NOT_FOUND", "load hello"));
        assertThat(process.symbols().getStatus().get(0).functionsIndexed, equalTo(2));
    }

    @Test
    public void processExitEndsThreadsFirst() {
        var target = system.createNewTarget();
        var process = target.processCreated(10, "hello", false);
        process.threadCreated(11, "main");
        observe();
        target.processExited(3);
        assertThat(events, contains("thread exit 11", "destroy 10 EXIT"));
        assertTrue(target.process().isEmpty());
        assertThat(system.getProcesses(), empty());
    }

    @Test
    public void deleteTargetDetachesItsProcess() {
        var target = system.createNewTarget();
        target.processCreated(10, "hello", false);
        observe();
        system.deleteTarget(target);
        assertThat(events, contains("destroy 10 DETACH", "target gone " + target.id()));
        assertThat(system.getTargets(), empty());
    }

    @Test
    public void cloneKeepsSymbols() {
        var target = system.createNewTarget();
        var process = target.processCreated(10, "hello", false);
        process.onModules(List.of(new ModuleInfo("hello", 0x1000, "0123abcd")));
        var clone = system.cloneTarget(target);
        system.deleteTarget(target);
        assertThat(clone.symbols().getModuleSymbols(), hasSize(1));
        assertTrue(system.systemSymbols().hasModule("0123abcd"));
        system.deleteTarget(clone);
        assertFalse(system.systemSymbols().hasModule("0123abcd"));
    }

    @Test
    public void hitsOnUnknownBreakpointsAreIgnored() {
        system.onBreakpointsHit(List.of(new BreakpointStats(42, 1, true)));
        assertThat(system.getBreakpoints(), empty());
    }

    @Test(expected = IllegalStateException.class)
    public void oneProcessPerTarget() {
        var target = system.createNewTarget();
        target.processCreated(10, "hello", false);
        target.processCreated(11, "hello", false);
    }
}
