package org.symdbg;

public interface TargetObserver {
    default void didCreateTarget(Target target) {}

    /** Called before the target is removed from the system. */
    default void willDestroyTarget(Target target) {}
}
