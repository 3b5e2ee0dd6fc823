package org.symdbg.breakpoint;

import java.util.ArrayList;
import java.util.List;
import org.symdbg.ExecutionScope;
import org.symdbg.symbols.InputLocation;

/** What the user asked for. Settings are values; {@link Breakpoint#getSettings()} hands out copies. */
public class BreakpointSettings {
    public enum Type {
        SOFTWARE,
        HARDWARE,
        /** Watchpoint triggered by reads or writes. */
        READ_WRITE,
        /** Watchpoint triggered by writes. */
        WRITE
    }

    public enum StopMode {
        NONE,
        THREAD,
        PROCESS,
        ALL
    }

    public String name = "";
    public boolean enabled = true;
    public ExecutionScope scope = ExecutionScope.system();
    public List<InputLocation> locations = new ArrayList<>();
    public Type type = Type.SOFTWARE;
    /** Bytes watched, for {@link Type#READ_WRITE} and {@link Type#WRITE}. */
    public int byteSize;
    public StopMode stopMode = StopMode.ALL;
    public boolean oneShot;

    public BreakpointSettings copy() {
        var copy = new BreakpointSettings();
        copy.name = name;
        copy.enabled = enabled;
        copy.scope = scope;
        copy.locations = new ArrayList<>(locations);
        copy.type = type;
        copy.byteSize = byteSize;
        copy.stopMode = stopMode;
        copy.oneShot = oneShot;
        return copy;
    }

    public static boolean typeHasSize(Type type) {
        return type == Type.READ_WRITE || type == Type.WRITE;
    }
}
