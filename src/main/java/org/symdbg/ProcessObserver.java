package org.symdbg;

import org.symdbg.symbols.LoadedModuleSymbols;

public interface ProcessObserver {
    /** {@code autoattached} is true when the process was attached to because it matched a filter, not by request. */
    default void didCreateProcess(DebuggedProcess process, boolean autoattached) {}

    /** Called while the process and its symbols are still valid. */
    default void willDestroyProcess(DebuggedProcess process, DestroyReason reason, int exitCode) {}

    default void didLoadModuleSymbols(DebuggedProcess process, LoadedModuleSymbols module) {}

    /** Called while the module is still in the process's symbols. */
    default void willUnloadModuleSymbols(DebuggedProcess process, LoadedModuleSymbols module) {}

    default void onSymbolLoadFailure(DebuggedProcess process, DebugError error) {}
}
