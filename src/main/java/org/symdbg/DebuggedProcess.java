package org.symdbg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.symdbg.agent.ModuleInfo;
import org.symdbg.symbols.LoadedModuleSymbols;
import org.symdbg.symbols.ProcessSymbols;

/** A running process belonging to a {@link Target}. Lifecycle changes are fed in by whoever talks to the agent. */
public class DebuggedProcess {
    private final Target target;
    private final long koid;
    private final String name;
    private final ProcessSymbols symbols;
    private final Map<Long, DebuggedThread> threads = new LinkedHashMap<>();

    DebuggedProcess(Target target, long koid, String name) {
        this.target = target;
        this.koid = koid;
        this.name = name;
        this.symbols =
                new ProcessSymbols(new ForwardNotifications(), target.system().systemSymbols(), target.symbols());
    }

    private class ForwardNotifications implements ProcessSymbols.Notifications {
        @Override
        public void didLoadModuleSymbols(LoadedModuleSymbols module) {
            for (var observer : system().processObservers()) {
                observer.didLoadModuleSymbols(DebuggedProcess.this, module);
            }
        }

        @Override
        public void willUnloadModuleSymbols(LoadedModuleSymbols module) {
            for (var observer : system().processObservers()) {
                observer.willUnloadModuleSymbols(DebuggedProcess.this, module);
            }
        }

        @Override
        public void onSymbolLoadFailure(DebugError error) {
            LOG.warning(String.format("Process %d: %s", koid, error.getMessage()));
            for (var observer : system().processObservers()) {
                observer.onSymbolLoadFailure(DebuggedProcess.this, error);
            }
        }
    }

    private DebugSystem system() {
        return target.system();
    }

    public Target target() {
        return target;
    }

    public long koid() {
        return koid;
    }

    public String name() {
        return name;
    }

    public ProcessSymbols symbols() {
        return symbols;
    }

    /** The agent reported the complete current module list. */
    public void onModules(List<ModuleInfo> modules) {
        symbols.setModules(modules);
    }

    public DebuggedThread threadCreated(long threadKoid, String threadName) {
        var thread = new DebuggedThread(this, threadKoid, threadName);
        threads.put(threadKoid, thread);
        for (var observer : system().threadObservers()) {
            observer.didCreateThread(thread);
        }
        return thread;
    }

    public void threadExited(long threadKoid) {
        var thread = threads.get(threadKoid);
        if (thread == null) {
            LOG.warning(String.format("Process %d has no thread %d", koid, threadKoid));
            return;
        }
        for (var observer : system().threadObservers()) {
            observer.willDestroyThread(thread);
        }
        threads.remove(threadKoid);
    }

    public List<DebuggedThread> threads() {
        return new ArrayList<>(threads.values());
    }

    public Optional<DebuggedThread> thread(long threadKoid) {
        return Optional.ofNullable(threads.get(threadKoid));
    }

    @Override
    public String toString() {
        return String.format("process %d (%s)", koid, name);
    }

    private static final Logger LOG = Logger.getLogger("main");
}
