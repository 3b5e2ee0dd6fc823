package org.symdbg;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.symdbg.agent.BreakpointStats;
import org.symdbg.agent.RemoteAgent;
import org.symdbg.breakpoint.Breakpoint;
import org.symdbg.breakpoint.BreakpointImpl;
import org.symdbg.breakpoint.BreakpointObserver;
import org.symdbg.symbols.SystemSymbols;
import org.symdbg.symbols.TargetSymbols;

/** The root of a debugging session: targets, breakpoints, and the observers interested in them. */
public class DebugSystem {
    private final DebugSettings settings;
    private final RemoteAgent agent;
    private final MessageLoop loop;
    private final SystemSymbols systemSymbols;
    private final List<Target> targets = new ArrayList<>();
    private final List<BreakpointImpl> breakpoints = new ArrayList<>();
    private final List<ProcessObserver> processObservers = new ArrayList<>();
    private final List<ThreadObserver> threadObservers = new ArrayList<>();
    private final List<TargetObserver> targetObservers = new ArrayList<>();
    private final List<BreakpointObserver> breakpointObservers = new ArrayList<>();
    private int nextTargetId = 1;
    private int nextBreakpointId = 1;

    public DebugSystem(DebugSettings settings, RemoteAgent agent, MessageLoop loop) {
        this.settings = settings;
        this.agent = agent;
        this.loop = loop;
        this.systemSymbols = new SystemSymbols(settings.symbolPathList(), settings.symbolLessModuleSet());
    }

    public DebugSettings settings() {
        return settings;
    }

    public RemoteAgent agent() {
        return agent;
    }

    public MessageLoop loop() {
        return loop;
    }

    public SystemSymbols systemSymbols() {
        return systemSymbols;
    }

    // Targets

    public Target createNewTarget() {
        return addTarget(new TargetSymbols());
    }

    /** A new target that starts with the same symbols as {@code original}. */
    public Target cloneTarget(Target original) {
        return addTarget(new TargetSymbols(original.symbols()));
    }

    private Target addTarget(TargetSymbols symbols) {
        var target = new Target(this, nextTargetId++, symbols);
        targets.add(target);
        for (var observer : targetObservers()) {
            observer.didCreateTarget(target);
        }
        return target;
    }

    public void deleteTarget(Target target) {
        if (!targets.contains(target)) {
            throw new IllegalArgumentException(target + " is not part of this system");
        }
        target.detach();
        for (var observer : targetObservers()) {
            observer.willDestroyTarget(target);
        }
        targets.remove(target);
        target.symbols().removeAllModules();
        LOG.info("Deleted " + target);
    }

    public List<Target> getTargets() {
        return List.copyOf(targets);
    }

    /** Processes of every target that has one. */
    public List<DebuggedProcess> getProcesses() {
        var result = new ArrayList<DebuggedProcess>();
        for (var target : targets) {
            target.process().ifPresent(result::add);
        }
        return result;
    }

    // Breakpoints

    /** A breakpoint with default settings. It does nothing until settings with locations are applied. */
    public Breakpoint createNewBreakpoint() {
        var breakpoint = new BreakpointImpl(this);
        breakpoints.add(breakpoint);
        return breakpoint;
    }

    public void deleteBreakpoint(Breakpoint breakpoint) {
        var found = findBreakpoint(breakpoint.id());
        if (found.isEmpty() || found.get() != breakpoint) {
            throw new IllegalArgumentException("Breakpoint " + breakpoint.id() + " is not part of this system");
        }
        breakpoints.remove(found.get());
        found.get().destroy();
    }

    public List<Breakpoint> getBreakpoints() {
        return List.copyOf(breakpoints);
    }

    public Optional<Breakpoint> breakpointForId(int id) {
        return findBreakpoint(id).map(b -> b);
    }

    private Optional<BreakpointImpl> findBreakpoint(int id) {
        for (var breakpoint : breakpoints) {
            if (breakpoint.id() == id) return Optional.of(breakpoint);
        }
        return Optional.empty();
    }

    /** Breakpoint IDs are never reused within a system, so a late reply can't be confused with a newer breakpoint. */
    public int allocateBreakpointId() {
        return nextBreakpointId++;
    }

    /** The agent stopped on breakpoints and reported their updated statistics. */
    public void onBreakpointsHit(List<BreakpointStats> hits) {
        for (var stats : hits) {
            var found = findBreakpoint(stats.id);
            if (found.isEmpty()) {
                LOG.warning(String.format("Hit on unknown breakpoint %d", stats.id));
                continue;
            }
            var breakpoint = found.get();
            breakpoint.updateStats(stats);
            if (stats.shouldDelete) {
                // The agent already removed one-shot breakpoints on its side.
                breakpoint.backendBreakpointRemoved();
                deleteBreakpoint(breakpoint);
            }
        }
    }

    // Observers. Notification iterates over a copy so observers may unregister themselves.

    public void addProcessObserver(ProcessObserver observer) {
        processObservers.add(observer);
    }

    public void removeProcessObserver(ProcessObserver observer) {
        processObservers.remove(observer);
    }

    public List<ProcessObserver> processObservers() {
        return List.copyOf(processObservers);
    }

    public void addThreadObserver(ThreadObserver observer) {
        threadObservers.add(observer);
    }

    public void removeThreadObserver(ThreadObserver observer) {
        threadObservers.remove(observer);
    }

    public List<ThreadObserver> threadObservers() {
        return List.copyOf(threadObservers);
    }

    public void addTargetObserver(TargetObserver observer) {
        targetObservers.add(observer);
    }

    public void removeTargetObserver(TargetObserver observer) {
        targetObservers.remove(observer);
    }

    public List<TargetObserver> targetObservers() {
        return List.copyOf(targetObservers);
    }

    public void addBreakpointObserver(BreakpointObserver observer) {
        breakpointObservers.add(observer);
    }

    public void removeBreakpointObserver(BreakpointObserver observer) {
        breakpointObservers.remove(observer);
    }

    public List<BreakpointObserver> breakpointObservers() {
        return List.copyOf(breakpointObservers);
    }

    private static final Logger LOG = Logger.getLogger("main");
}
