package org.symdbg.agent;

/** One place a breakpoint applies: an address, or an address range for watchpoints, in one process. */
public class ProcessBreakpointSettings {
    public long processKoid;
    /** 0 means every thread in the process. */
    public long threadKoid;
    /** Used by software and hardware breakpoints. */
    public long address;
    /** Used by watchpoints instead of {@link #address}. */
    public AddressRange addressRange;

    public ProcessBreakpointSettings() {}

    public static ProcessBreakpointSettings atAddress(long processKoid, long threadKoid, long address) {
        var settings = new ProcessBreakpointSettings();
        settings.processKoid = processKoid;
        settings.threadKoid = threadKoid;
        settings.address = address;
        return settings;
    }

    public static ProcessBreakpointSettings inRange(long processKoid, long threadKoid, AddressRange range) {
        var settings = new ProcessBreakpointSettings();
        settings.processKoid = processKoid;
        settings.threadKoid = threadKoid;
        settings.addressRange = range;
        return settings;
    }

    @Override
    public String toString() {
        var where = addressRange != null ? addressRange.toString() : String.format("0x%x", address);
        return String.format("process %d thread %d %s", processKoid, threadKoid, where);
    }
}
