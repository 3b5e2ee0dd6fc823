package org.symdbg;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import org.symdbg.symbols.TargetSymbols;

/**
 * Something that can be debugged, with or without a running process. Its symbols outlive any one process so
 * locations can be checked before the next run.
 */
public class Target {
    private final DebugSystem system;
    private final int id;
    private final TargetSymbols symbols;
    private Optional<DebuggedProcess> process = Optional.empty();

    Target(DebugSystem system, int id, TargetSymbols symbols) {
        this.system = system;
        this.id = id;
        this.symbols = symbols;
    }

    public DebugSystem system() {
        return system;
    }

    public int id() {
        return id;
    }

    public TargetSymbols symbols() {
        return symbols;
    }

    public Optional<DebuggedProcess> process() {
        return process;
    }

    /** A process for this target was launched or attached to. */
    public DebuggedProcess processCreated(long koid, String name, boolean autoattached) {
        if (process.isPresent()) {
            throw new IllegalStateException("Target " + id + " already has process " + process.get().koid());
        }
        var created = new DebuggedProcess(this, koid, name);
        process = Optional.of(created);
        LOG.info(String.format("Target %d has process %d (%s)", id, koid, name));
        for (var observer : system.processObservers()) {
            observer.didCreateProcess(created, autoattached);
        }
        return created;
    }

    public void processExited(int exitCode) {
        destroyProcess(DestroyReason.EXIT, exitCode);
    }

    public void detach() {
        destroyProcess(DestroyReason.DETACH, 0);
    }

    void destroyProcess(DestroyReason reason, int exitCode) {
        if (process.isEmpty()) return;
        var dying = process.get();
        for (var thread : List.copyOf(dying.threads())) {
            dying.threadExited(thread.koid());
        }
        LOG.info(String.format("Process %d %s (%d)", dying.koid(), reason, exitCode));
        for (var observer : system.processObservers()) {
            observer.willDestroyProcess(dying, reason, exitCode);
        }
        dying.symbols().releaseAll();
        process = Optional.empty();
    }

    @Override
    public String toString() {
        return "target " + id;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
