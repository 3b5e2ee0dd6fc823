package org.symdbg;

public enum ErrorType {
    GENERAL,
    /** The request never got a reply from the agent. */
    NO_CONNECTION,
    NOT_FOUND,
    /** Out of some limited resource, like hardware breakpoint registers. */
    NO_RESOURCES,
    NOT_SUPPORTED,
    ACCESS_DENIED,
    INVALID_ARGUMENT,
    ALREADY_EXISTS
}
