package org.symdbg.breakpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.symdbg.DebugError;
import org.symdbg.DebugSystem;
import org.symdbg.DebuggedProcess;
import org.symdbg.DebuggedThread;
import org.symdbg.DestroyReason;
import org.symdbg.ErrorType;
import org.symdbg.ExecutionScope;
import org.symdbg.ProcessObserver;
import org.symdbg.Target;
import org.symdbg.TargetObserver;
import org.symdbg.ThreadObserver;
import org.symdbg.WeakHandle;
import org.symdbg.agent.AddOrChangeBreakpointRequest;
import org.symdbg.agent.AddressRange;
import org.symdbg.agent.AgentBreakpoint;
import org.symdbg.agent.AgentStatus;
import org.symdbg.agent.BreakpointStats;
import org.symdbg.agent.ProcessBreakpointSettings;
import org.symdbg.agent.RemoveBreakpointRequest;
import org.symdbg.symbols.ExpandPermissive;
import org.symdbg.symbols.FindNameContext;
import org.symdbg.symbols.InputLocation;
import org.symdbg.symbols.LoadedModuleSymbols;
import org.symdbg.symbols.Location;
import org.symdbg.symbols.ResolveOptions;

/**
 * Keeps a breakpoint's resolved addresses in step with the processes and modules it applies to, and mirrors the
 * enabled addresses to the agent.
 *
 * <p>Locations are resolved per process. A location found through a module remembers that module's load address,
 * and goes away when the module unloads. Raw addresses don't belong to any module.
 */
public class BreakpointImpl implements Breakpoint, ProcessObserver, ThreadObserver, TargetObserver {
    private final DebugSystem system;
    private final int id;
    private final WeakHandle.Factory<BreakpointImpl> weakFactory = new WeakHandle.Factory<>(this);
    private BreakpointSettings settings = new BreakpointSettings();
    private final Map<DebuggedProcess, TreeMap<Long, BreakpointLocationImpl>> processes = new LinkedHashMap<>();
    private BreakpointStats stats;
    /** The agent has been asked to install this breakpoint and hasn't been asked to remove it since. */
    private boolean installed;
    private boolean observingThreads;
    private boolean destroyed;

    public BreakpointImpl(DebugSystem system) {
        this.system = system;
        this.id = system.allocateBreakpointId();
        this.stats = new BreakpointStats(id, 0, false);
        system.addProcessObserver(this);
        system.addTargetObserver(this);
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public BreakpointSettings getSettings() {
        return settings.copy();
    }

    @Override
    public void setSettings(BreakpointSettings newSettings) {
        checkNotDestroyed();
        if (BreakpointSettings.typeHasSize(newSettings.type) && newSettings.byteSize <= 0) {
            throw new IllegalArgumentException(
                    String.format(
                            "%s breakpoints need a positive byte size, got %d", newSettings.type, newSettings.byteSize));
        }
        settings = newSettings.copy();
        for (var process : system.getProcesses()) {
            if (settings.scope.appliesTo(process)) {
                updateProcessLocations(process);
            } else {
                processes.remove(process);
            }
        }
        processes.keySet().removeIf(process -> !settings.scope.appliesTo(process));
        updateThreadObserver();
        syncBackend();
    }

    @Override
    public List<BreakpointLocation> getLocations() {
        var result = new ArrayList<BreakpointLocation>();
        for (var locations : processes.values()) {
            result.addAll(locations.values());
        }
        return result;
    }

    @Override
    public BreakpointStats getStats() {
        return stats;
    }

    /** The agent reported new statistics for this breakpoint. */
    public void updateStats(BreakpointStats newStats) {
        stats = new BreakpointStats(id, newStats.hitCount, newStats.shouldDelete);
    }

    /** The agent removed this breakpoint on its own, like a one-shot breakpoint after it was hit. */
    public void backendBreakpointRemoved() {
        installed = false;
    }

    public boolean isInstalled() {
        return installed;
    }

    /** Remove from the agent and stop listening. Replies still in flight will be ignored. */
    public void destroy() {
        if (destroyed) return;
        destroyed = true;
        if (installed) sendRemove();
        system.removeProcessObserver(this);
        system.removeTargetObserver(this);
        if (observingThreads) {
            system.removeThreadObserver(this);
            observingThreads = false;
        }
        processes.clear();
        weakFactory.invalidateWeakHandles();
    }

    void didChangeLocation() {
        if (destroyed) return;
        syncBackend();
    }

    // Lifecycle notifications

    @Override
    public void didCreateProcess(DebuggedProcess process, boolean autoattached) {
        if (destroyed || !settings.scope.appliesTo(process)) return;
        var added = updateProcessLocations(process);
        if (added == 0) return;
        syncBackend();
        notifyMatched(true);
    }

    @Override
    public void willDestroyProcess(DebuggedProcess process, DestroyReason reason, int exitCode) {
        if (destroyed) return;
        var hadLocations = processes.remove(process) != null;
        if (settings.scope.appliesTo(process) && isAddressOnly() && settings.enabled) {
            // Addresses mean nothing in the next process.
            LOG.info(String.format("Disabling address breakpoint %d since %s is gone", id, process));
            settings.enabled = false;
        }
        if (hadLocations) syncBackend();
    }

    @Override
    public void didLoadModuleSymbols(DebuggedProcess process, LoadedModuleSymbols module) {
        if (destroyed || !settings.scope.appliesTo(process) || module.moduleSymbols().isEmpty()) return;
        var symbols = module.moduleSymbols().get();
        var options = resolveOptions();
        var found = new ArrayList<Location>();
        for (var input : expandedInputs(process)) {
            // Addresses were resolved when the process was created.
            if (input.kind() == InputLocation.Kind.ADDRESS) continue;
            for (var location : symbols.resolveInputLocation(module.symbolContext(), input, options)) {
                if (location.isValid()) found.add(location);
            }
        }
        if (found.isEmpty()) return;

        var locations = processes.computeIfAbsent(process, p -> byAddress());
        var added = 0;
        for (var location : found) {
            if (locations.containsKey(location.address())) continue;
            locations.put(location.address(), new BreakpointLocationImpl(this, process, location));
            added++;
        }
        if (added > 0) syncBackend();
        notifyMatched(added > 0);
    }

    @Override
    public void willUnloadModuleSymbols(DebuggedProcess process, LoadedModuleSymbols module) {
        if (destroyed) return;
        var locations = processes.get(process);
        if (locations == null) return;
        var removed = locations.values().removeIf(location -> isOwnedBy(location, module));
        if (locations.isEmpty()) processes.remove(process);
        if (removed) syncBackend();
    }

    private static boolean isOwnedBy(BreakpointLocationImpl location, LoadedModuleSymbols module) {
        var owner = location.owningModule();
        return owner.isPresent() && owner.getAsLong() == module.loadAddress();
    }

    @Override
    public void willDestroyThread(DebuggedThread thread) {
        if (destroyed || settings.scope.kind() != ExecutionScope.Kind.THREAD) return;
        if (settings.scope.thread().get() != thread) return;
        // Keep the settings around for the next run instead of deleting the breakpoint.
        settings.scope = ExecutionScope.forTarget(thread.process().target());
        settings.enabled = false;
        updateThreadObserver();
        syncBackend();
    }

    @Override
    public void willDestroyTarget(Target target) {
        if (destroyed || settings.scope.target().orElse(null) != target) return;
        settings.scope = ExecutionScope.system();
        settings.enabled = false;
        updateThreadObserver();
        syncBackend();
    }

    // Resolution

    /** Resolve every location against {@code process}, keeping enabled state for addresses seen before. */
    private int updateProcessLocations(DebuggedProcess process) {
        var previous = processes.getOrDefault(process, byAddress());
        var options = resolveOptions();
        var updated = byAddress();
        for (var input : expandedInputs(process)) {
            var inputOptions = input.kind() == InputLocation.Kind.ADDRESS ? ResolveOptions.ADDRESSES_ONLY : options;
            for (var location : process.symbols().resolveInputLocation(input, inputOptions)) {
                if (!location.isValid() || updated.containsKey(location.address())) continue;
                var created = new BreakpointLocationImpl(this, process, location);
                var old = previous.get(location.address());
                if (old != null) created.copyEnabledFrom(old);
                updated.put(location.address(), created);
            }
        }
        var added = 0;
        for (var address : updated.keySet()) {
            if (!previous.containsKey(address)) added++;
        }
        if (updated.isEmpty()) {
            processes.remove(process);
        } else {
            processes.put(process, updated);
        }
        return added;
    }

    private static TreeMap<Long, BreakpointLocationImpl> byAddress() {
        return new TreeMap<>(Long::compareUnsigned);
    }

    private List<InputLocation> expandedInputs(DebuggedProcess process) {
        return ExpandPermissive.expandInputLocations(FindNameContext.forProcess(process.symbols()), settings.locations);
    }

    /** True when every configured location is an address. */
    private boolean isAddressOnly() {
        if (settings.locations.isEmpty()) return false;
        for (var input : settings.locations) {
            if (input.kind() != InputLocation.Kind.ADDRESS) return false;
        }
        return true;
    }

    private ResolveOptions resolveOptions() {
        if (isAddressOnly()) return ResolveOptions.ADDRESSES_ONLY;
        return ResolveOptions.SYMBOLIZE_SKIP_PROLOGUE;
    }

    private void updateThreadObserver() {
        var wanted = settings.scope.kind() == ExecutionScope.Kind.THREAD;
        if (wanted == observingThreads) return;
        if (wanted) {
            system.addThreadObserver(this);
        } else {
            system.removeThreadObserver(this);
        }
        observingThreads = wanted;
    }

    // Agent

    private boolean hasEnabledLocation() {
        if (!settings.enabled) return false;
        for (var locations : processes.values()) {
            for (var location : locations.values()) {
                if (location.isEnabled()) return true;
            }
        }
        return false;
    }

    private void syncBackend() {
        if (hasEnabledLocation()) {
            sendAddOrChange();
        } else if (installed) {
            sendRemove();
        }
    }

    private void sendAddOrChange() {
        var request = new AddOrChangeBreakpointRequest(agentBreakpoint());
        LOG.info(String.format("Installing breakpoint %d at %d locations", id, request.breakpoint.locations.size()));
        installed = true;
        var handle = weakFactory.getWeakHandle();
        send(() -> system.agent().addOrChangeBreakpoint(request))
                .whenCompleteAsync(
                        (reply, error) -> {
                            var self = handle.get();
                            if (self.isEmpty()) return;
                            self.get().onReply(error, reply == null ? AgentStatus.OK : reply.status);
                        },
                        system.loop());
    }

    private void sendRemove() {
        LOG.info(String.format("Removing breakpoint %d", id));
        installed = false;
        var request = new RemoveBreakpointRequest(id);
        var handle = weakFactory.getWeakHandle();
        send(() -> system.agent().removeBreakpoint(request))
                .whenCompleteAsync(
                        (reply, error) -> {
                            var self = handle.get();
                            if (self.isEmpty()) return;
                            self.get().onReply(error, reply == null ? AgentStatus.OK : reply.status);
                        },
                        system.loop());
    }

    /** A transport that throws instead of failing the future is treated the same as a failed future. */
    private static <T> CompletableFuture<T> send(Supplier<CompletableFuture<T>> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void onReply(Throwable error, int status) {
        if (error != null) {
            var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            LOG.log(Level.WARNING, String.format("Breakpoint %d: transport error", id), cause);
            notifyFailure(
                    new DebugError(
                            ErrorType.NO_CONNECTION, "Could not update breakpoint: " + cause.getMessage(), cause));
            return;
        }
        if (!AgentStatus.isOk(status)) {
            LOG.warning(String.format("Breakpoint %d: agent replied %s", id, AgentStatus.name(status)));
            notifyFailure(AgentStatus.toError(status));
        }
    }

    AgentBreakpoint agentBreakpoint() {
        var result = new AgentBreakpoint();
        result.id = id;
        result.name = settings.name;
        result.oneShot = settings.oneShot;
        result.type = agentType(settings.type);
        result.stop = agentStop(settings.stopMode);
        long threadKoid = 0;
        if (settings.scope.kind() == ExecutionScope.Kind.THREAD) {
            threadKoid = settings.scope.thread().get().koid();
        }
        var sized = BreakpointSettings.typeHasSize(settings.type);
        for (var entry : processes.entrySet()) {
            var processKoid = entry.getKey().koid();
            for (var location : entry.getValue().values()) {
                if (!location.isEnabled()) continue;
                if (sized) {
                    var range = new AddressRange(location.address(), location.address() + settings.byteSize);
                    result.locations.add(ProcessBreakpointSettings.inRange(processKoid, threadKoid, range));
                } else {
                    var address = location.address();
                    result.locations.add(ProcessBreakpointSettings.atAddress(processKoid, threadKoid, address));
                }
            }
        }
        return result;
    }

    private static AgentBreakpoint.Type agentType(BreakpointSettings.Type type) {
        switch (type) {
            case HARDWARE:
                return AgentBreakpoint.Type.HARDWARE;
            case READ_WRITE:
                return AgentBreakpoint.Type.READ_WRITE;
            case WRITE:
                return AgentBreakpoint.Type.WRITE;
            default:
                return AgentBreakpoint.Type.SOFTWARE;
        }
    }

    private static AgentBreakpoint.Stop agentStop(BreakpointSettings.StopMode mode) {
        switch (mode) {
            case NONE:
                return AgentBreakpoint.Stop.NONE;
            case THREAD:
                return AgentBreakpoint.Stop.THREAD;
            case PROCESS:
                return AgentBreakpoint.Stop.PROCESS;
            default:
                return AgentBreakpoint.Stop.ALL;
        }
    }

    private void notifyMatched(boolean newlyBound) {
        for (var observer : system.breakpointObservers()) {
            observer.onBreakpointMatched(this, newlyBound);
        }
    }

    private void notifyFailure(DebugError error) {
        for (var observer : system.breakpointObservers()) {
            observer.onBreakpointUpdateFailure(this, error);
        }
    }

    private void checkNotDestroyed() {
        if (destroyed) throw new IllegalStateException("Breakpoint " + id + " was deleted");
    }

    @Override
    public String toString() {
        return String.format("breakpoint %d (%s)", id, settings.name);
    }

    private static final Logger LOG = Logger.getLogger("main");
}
