package org.symdbg;

import java.util.Objects;
import java.util.Optional;

/** What a breakpoint applies to: everything, one target, or one thread. */
public class ExecutionScope {
    public enum Kind {
        SYSTEM,
        TARGET,
        THREAD
    }

    private static final ExecutionScope SYSTEM = new ExecutionScope(Kind.SYSTEM, null, null);

    private final Kind kind;
    private final Target target;
    private final DebuggedThread thread;

    private ExecutionScope(Kind kind, Target target, DebuggedThread thread) {
        this.kind = kind;
        this.target = target;
        this.thread = thread;
    }

    public static ExecutionScope system() {
        return SYSTEM;
    }

    public static ExecutionScope forTarget(Target target) {
        return new ExecutionScope(Kind.TARGET, Objects.requireNonNull(target), null);
    }

    public static ExecutionScope forThread(DebuggedThread thread) {
        return new ExecutionScope(Kind.THREAD, thread.process().target(), thread);
    }

    public Kind kind() {
        return kind;
    }

    /** Set for target and thread scopes. */
    public Optional<Target> target() {
        return Optional.ofNullable(target);
    }

    public Optional<DebuggedThread> thread() {
        return Optional.ofNullable(thread);
    }

    public boolean appliesTo(DebuggedProcess process) {
        switch (kind) {
            case SYSTEM:
                return true;
            case TARGET:
                return process.target() == target;
            case THREAD:
                return thread.process() == process;
        }
        throw new IllegalStateException("Unknown scope " + kind);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ExecutionScope)) return false;
        var that = (ExecutionScope) other;
        return this.kind == that.kind && this.target == that.target && this.thread == that.thread;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, System.identityHashCode(target), System.identityHashCode(thread));
    }

    @Override
    public String toString() {
        switch (kind) {
            case TARGET:
                return "target " + target.id();
            case THREAD:
                return thread.toString();
            default:
                return "global";
        }
    }
}
