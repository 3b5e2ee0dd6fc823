package org.symdbg;

public interface ThreadObserver {
    default void didCreateThread(DebuggedThread thread) {}

    default void willDestroyThread(DebuggedThread thread) {}
}
