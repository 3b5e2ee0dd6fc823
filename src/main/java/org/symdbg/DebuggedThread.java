package org.symdbg;

public class DebuggedThread {
    private final DebuggedProcess process;
    private final long koid;
    private final String name;

    DebuggedThread(DebuggedProcess process, long koid, String name) {
        this.process = process;
        this.koid = koid;
        this.name = name;
    }

    public DebuggedProcess process() {
        return process;
    }

    public long koid() {
        return koid;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return String.format("thread %d (%s)", koid, name);
    }
}
