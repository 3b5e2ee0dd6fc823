package org.symdbg.agent;

/** A module mapped into a process, as reported by the agent. */
public class ModuleInfo {
    /** Name of the binary. */
    public String name;
    /** Absolute address the module is loaded at. */
    public long base;
    /** Address of the module's link map entry for the dynamic loader. */
    public long debugAddress;
    public String buildId;

    public ModuleInfo() {}

    public ModuleInfo(String name, long base, String buildId) {
        this.name = name;
        this.base = base;
        this.buildId = buildId;
    }

    @Override
    public String toString() {
        return String.format("%s@0x%x (%s)", name, base, buildId);
    }
}
