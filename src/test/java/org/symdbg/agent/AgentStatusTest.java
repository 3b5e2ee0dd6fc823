package org.symdbg.agent;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;
import org.symdbg.ErrorType;

public class AgentStatusTest {
    @Test
    public void outOfHardwareSlots() {
        var error = AgentStatus.toError(AgentStatus.NO_RESOURCES);
        assertThat(error.type(), equalTo(ErrorType.NO_RESOURCES));
        assertThat(error.getMessage(), containsString("hardware breakpoint"));
    }

    @Test
    public void debuggingSyscallsDisabled() {
        var error = AgentStatus.toError(AgentStatus.ACCESS_DENIED);
        assertThat(error.type(), equalTo(ErrorType.ACCESS_DENIED));
        assertThat(error.getMessage(), containsString("kernel.enable-debugging-syscalls"));
    }

    @Test
    public void unknownStatus() {
        var error = AgentStatus.toError(-99);
        assertThat(error.type(), equalTo(ErrorType.GENERAL));
        assertThat(error.getMessage(), equalTo("Could not set breakpoint: status -99."));
    }

    @Test
    public void names() {
        assertTrue(AgentStatus.isOk(AgentStatus.OK));
        assertThat(AgentStatus.name(AgentStatus.OUT_OF_RANGE), equalTo("OUT_OF_RANGE"));
        assertThat(AgentStatus.toError(AgentStatus.OUT_OF_RANGE).type(), equalTo(ErrorType.INVALID_ARGUMENT));
    }
}
