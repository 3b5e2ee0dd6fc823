package org.symdbg.agent;

import org.symdbg.DebugError;
import org.symdbg.ErrorType;

/** Status codes the agent puts in replies. They follow the target kernel's numbering. */
public class AgentStatus {
    public static final int OK = 0;
    public static final int NOT_SUPPORTED = -2;
    public static final int NO_RESOURCES = -3;
    public static final int NO_MEMORY = -4;
    public static final int INVALID_ARGS = -10;
    public static final int OUT_OF_RANGE = -14;
    public static final int BAD_STATE = -20;
    public static final int NOT_FOUND = -25;
    public static final int ALREADY_EXISTS = -26;
    public static final int ACCESS_DENIED = -30;

    private AgentStatus() {}

    public static boolean isOk(int status) {
        return status == OK;
    }

    public static String name(int status) {
        switch (status) {
            case OK:
                return "OK";
            case NOT_SUPPORTED:
                return "NOT_SUPPORTED";
            case NO_RESOURCES:
                return "NO_RESOURCES";
            case NO_MEMORY:
                return "NO_MEMORY";
            case INVALID_ARGS:
                return "INVALID_ARGS";
            case OUT_OF_RANGE:
                return "OUT_OF_RANGE";
            case BAD_STATE:
                return "BAD_STATE";
            case NOT_FOUND:
                return "NOT_FOUND";
            case ALREADY_EXISTS:
                return "ALREADY_EXISTS";
            case ACCESS_DENIED:
                return "ACCESS_DENIED";
            default:
                return "status " + status;
        }
    }

    /** A message a user can act on for a non-zero breakpoint status. */
    public static DebugError toError(int status) {
        switch (status) {
            case NO_RESOURCES:
                return new DebugError(
                        ErrorType.NO_RESOURCES,
                        "Could not set breakpoint: the target is out of hardware breakpoint or watchpoint slots. "
                                + "Remove another hardware breakpoint and try again.");
            case NOT_SUPPORTED:
                return new DebugError(
                        ErrorType.NOT_SUPPORTED,
                        "Could not set breakpoint: this breakpoint type or size is not supported by the target.");
            case ACCESS_DENIED:
                return new DebugError(
                        ErrorType.ACCESS_DENIED,
                        "Could not set breakpoint: access denied. Debugging syscalls may be disabled; check the "
                                + "kernel flag \"kernel.enable-debugging-syscalls\".");
            case INVALID_ARGS:
            case OUT_OF_RANGE:
                return new DebugError(
                        ErrorType.INVALID_ARGUMENT,
                        "Could not set breakpoint: the agent rejected the address or size ("
                                + name(status)
                                + ").");
            case NOT_FOUND:
                return new DebugError(
                        ErrorType.NOT_FOUND, "Could not set breakpoint: the process or thread no longer exists.");
            case ALREADY_EXISTS:
                return new DebugError(
                        ErrorType.ALREADY_EXISTS,
                        "Could not set breakpoint: another breakpoint of this kind already covers the address.");
            default:
                return new DebugError(ErrorType.GENERAL, "Could not set breakpoint: " + name(status) + ".");
        }
    }
}
