package org.symdbg.symbols;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;
import org.symdbg.DebugError;
import org.symdbg.ErrorType;
import org.symdbg.agent.ModuleInfo;

/**
 * The modules currently mapped into one process, keyed by load address. Owned by the process; there is at most one
 * module per load address.
 */
public class ProcessSymbols implements LocationResolver {
    public interface Notifications {
        /** Called after the module is in {@link #getLoadedModuleSymbols()}. */
        void didLoadModuleSymbols(LoadedModuleSymbols module);

        /** Called while the module is still in {@link #getLoadedModuleSymbols()}. */
        void willUnloadModuleSymbols(LoadedModuleSymbols module);

        void onSymbolLoadFailure(DebugError error);
    }

    private final Notifications notifications;
    private final SystemSymbols systemSymbols;
    private final TargetSymbols targetSymbols;
    private final TreeMap<Long, LoadedModuleSymbols> modules = new TreeMap<>(Long::compareUnsigned);

    public ProcessSymbols(Notifications notifications, SystemSymbols systemSymbols, TargetSymbols targetSymbols) {
        this.notifications = notifications;
        this.systemSymbols = systemSymbols;
        this.targetSymbols = targetSymbols;
    }

    public TargetSymbols getTargetSymbols() {
        return targetSymbols;
    }

    /**
     * Replace the module list with {@code newModules}. Only the difference is reported: removed modules get
     * "will unload" first, then added modules get "did load" once they are all in place.
     */
    public void setModules(List<ModuleInfo> newModules) {
        var incoming = new LinkedHashMap<Long, ModuleInfo>();
        for (var info : newModules) {
            var first = incoming.putIfAbsent(info.base, info);
            if (first != null) {
                LOG.warning(
                        String.format("Ignoring %s at 0x%x, already have %s there", info.name, info.base, first.name));
            }
        }

        var removed = new ArrayList<LoadedModuleSymbols>();
        for (var module : modules.values()) {
            var replacement = incoming.get(module.loadAddress());
            if (replacement == null || !Objects.equals(replacement.buildId, module.buildId())) removed.add(module);
        }
        for (var module : removed) {
            if (module.moduleSymbols().isPresent()) notifications.willUnloadModuleSymbols(module);
            modules.remove(module.loadAddress());
            module.moduleSymbols().filter(symbols -> !isMapped(symbols)).ifPresent(targetSymbols::removeModule);
            module.release();
            LOG.info("Unloaded " + module);
        }

        var added = new ArrayList<LoadedModuleSymbols>();
        for (var info : incoming.values()) {
            if (modules.containsKey(info.base)) continue;
            var module = create(info);
            modules.put(info.base, module);
            added.add(module);
        }
        for (var module : added) {
            if (module.moduleSymbols().isPresent()) notifications.didLoadModuleSymbols(module);
        }
    }

    /** True when another mapping in this process still uses {@code symbols}. */
    private boolean isMapped(ModuleSymbols symbols) {
        for (var module : modules.values()) {
            if (module.moduleSymbols().orElse(null) == symbols) return true;
        }
        return false;
    }

    private LoadedModuleSymbols create(ModuleInfo info) {
        var symbols = load(info.name, info.buildId);
        var module = new LoadedModuleSymbols(info.name, info.buildId, info.base, info.debugAddress, symbols);
        module.symbolsRef().ifPresent(targetSymbols::addModule);
        LOG.info("Loaded " + module);
        return module;
    }

    private Optional<ModuleRef> load(String name, String buildId) {
        try {
            return systemSymbols.getModule(name, buildId);
        } catch (SymbolLoadException e) {
            LOG.warning(e.getMessage());
            notifications.onSymbolLoadFailure(new DebugError(ErrorType.NOT_FOUND, e.getMessage(), e));
            return Optional.empty();
        }
    }

    /**
     * Try again to load symbols for every module with {@code buildId}, for when a symbol file has become available.
     * Modules that get symbols are reported as loaded again.
     */
    public void retryLoadBuildId(String buildId) {
        for (var module : modules.values()) {
            if (!Objects.equals(module.buildId(), buildId) || module.moduleSymbols().isPresent()) continue;
            var reloaded = load(module.name(), buildId);
            if (reloaded.isEmpty()) continue;
            module.replaceSymbols(reloaded);
            targetSymbols.addModule(reloaded.get());
            notifications.didLoadModuleSymbols(module);
        }
    }

    /** Drop every module without notifications, for when the process is gone. The target keeps its modules. */
    public void releaseAll() {
        for (var module : modules.values()) module.release();
        modules.clear();
    }

    /** Loaded modules in ascending load address order, comparing addresses as unsigned. */
    public List<LoadedModuleSymbols> getLoadedModuleSymbols() {
        return ImmutableList.copyOf(modules.values());
    }

    public List<ModuleSymbolStatus> getStatus() {
        var result = ImmutableList.<ModuleSymbolStatus>builder();
        for (var module : modules.values()) result.add(module.status());
        return result.build();
    }

    /** The module with the highest load address at or below {@code address}. */
    public Optional<LoadedModuleSymbols> moduleForAddress(long address) {
        var entry = modules.floorEntry(address);
        if (entry == null) return Optional.empty();
        return Optional.of(entry.getValue());
    }

    public Optional<LoadedModuleSymbols> moduleForBuildId(String buildId) {
        for (var module : modules.values()) {
            if (Objects.equals(module.buildId(), buildId)) return Optional.of(module);
        }
        return Optional.empty();
    }

    @Override
    public List<Location> resolveInputLocation(InputLocation input, ResolveOptions options) {
        return input.accept(
                new InputLocation.Visitor<List<Location>>() {
                    @Override
                    public List<Location> visitNone() {
                        return List.of();
                    }

                    @Override
                    public List<Location> visitAddress(long address) {
                        return List.of(resolveAddress(address, options));
                    }

                    @Override
                    public List<Location> visitLine(FileLine line) {
                        return resolveInEveryModule(input, options);
                    }

                    @Override
                    public List<Location> visitName(Identifier name) {
                        return resolveInEveryModule(input, options);
                    }
                });
    }

    private Location resolveAddress(long address, ResolveOptions options) {
        if (!options.symbolize) return Location.address(address);
        var module = moduleForAddress(address);
        if (module.isEmpty() || module.get().moduleSymbols().isEmpty()) return Location.address(address);
        var symbols = module.get().moduleSymbols().get();
        var found = symbols.resolveInputLocation(module.get().symbolContext(), InputLocation.address(address), options);
        if (found.isEmpty()) return Location.address(address);
        return found.get(0);
    }

    private List<Location> resolveInEveryModule(InputLocation input, ResolveOptions options) {
        var result = ImmutableList.<Location>builder();
        for (var module : modules.values()) {
            var symbols = module.moduleSymbols();
            if (symbols.isEmpty()) continue;
            result.addAll(symbols.get().resolveInputLocation(module.symbolContext(), input, options));
        }
        return result.build();
    }

    public LineDetails lineDetailsForAddress(long address) {
        var module = moduleForAddress(address);
        if (module.isEmpty() || module.get().moduleSymbols().isEmpty()) return LineDetails.empty();
        return module.get().moduleSymbols().get().lineDetailsForAddress(module.get().symbolContext(), address);
    }

    public List<String> findFileMatches(String name) {
        var result = new ArrayList<String>();
        for (var module : modules.values()) {
            var symbols = module.moduleSymbols();
            if (symbols.isEmpty()) continue;
            for (var file : symbols.get().findFileMatches(name)) {
                if (!result.contains(file)) result.add(file);
            }
        }
        return result;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
