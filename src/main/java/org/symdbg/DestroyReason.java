package org.symdbg;

/** Why a process is going away. */
public enum DestroyReason {
    EXIT,
    DETACH,
    KILL
}
