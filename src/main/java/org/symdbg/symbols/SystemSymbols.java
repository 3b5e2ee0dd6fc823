package org.symdbg.symbols;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Finds and caches module symbols by build ID. Each build ID is loaded once and shared by every process that maps
 * it; the cache entry goes away when the last {@link ModuleRef} is closed.
 *
 * <p>A symbol file for build ID {@code abcdef} is looked up in each symbol path as {@code abcdef.json}, then as
 * {@code .build-id/ab/cdef.json}.
 */
public class SystemSymbols {
    private static final Gson GSON = new Gson();

    private final List<Path> symbolPaths;
    private final Set<String> symbolLessModules;
    private final Map<String, SharedModuleSymbols> modules = new HashMap<>();
    /** Handles held on behalf of injected modules, so they outlive every process that uses them. */
    private final Map<String, ModuleRef> pinned = new HashMap<>();

    public SystemSymbols(List<Path> symbolPaths, Set<String> symbolLessModules) {
        this.symbolPaths = new ArrayList<>(symbolPaths);
        this.symbolLessModules = Set.copyOf(symbolLessModules);
    }

    public List<Path> symbolPaths() {
        return List.copyOf(symbolPaths);
    }

    public void addSymbolPath(Path path) {
        symbolPaths.add(path);
    }

    /**
     * A new handle on the symbols for {@code buildId}, loading them if nobody holds them. Modules known to have no
     * symbols, like the vDSO, give empty.
     */
    public Optional<ModuleRef> getModule(String name, String buildId) throws SymbolLoadException {
        if (buildId == null || buildId.isEmpty() || symbolLessModules.contains(name)) {
            LOG.info(String.format("%s has no symbols", name));
            return Optional.empty();
        }
        var found = modules.get(buildId);
        if (found != null) return Optional.of(found.acquire());

        var symbols = load(buildId);
        var shared = new SharedModuleSymbols(symbols, this::forget);
        modules.put(buildId, shared);
        LOG.info(String.format("Loaded symbols for %s (%s)", name, buildId));
        return Optional.of(shared.acquire());
    }

    /** Make {@code symbols} available as if it had been loaded from disk. */
    public void injectModuleForTesting(ModuleSymbols symbols) {
        var shared = new SharedModuleSymbols(symbols, this::forget);
        modules.put(symbols.buildId(), shared);
        var old = pinned.put(symbols.buildId(), shared.acquire());
        if (old != null) old.close();
    }

    public boolean hasModule(String buildId) {
        return modules.containsKey(buildId);
    }

    public int moduleCount() {
        return modules.size();
    }

    private void forget(SharedModuleSymbols shared) {
        var buildId = shared.symbols.buildId();
        if (modules.remove(buildId, shared)) {
            LOG.info(String.format("Released last reference to symbols for %s", buildId));
        }
    }

    Optional<Path> findSymbolFile(String buildId) {
        for (var dir : symbolPaths) {
            var flat = dir.resolve(buildId + ".json");
            if (Files.isRegularFile(flat)) return Optional.of(flat);
            if (buildId.length() > 2) {
                var nested =
                        dir.resolve(".build-id")
                                .resolve(buildId.substring(0, 2))
                                .resolve(buildId.substring(2) + ".json");
                if (Files.isRegularFile(nested)) return Optional.of(nested);
            }
        }
        return Optional.empty();
    }

    private ModuleSymbols load(String buildId) throws SymbolLoadException {
        var file = findSymbolFile(buildId);
        if (file.isEmpty()) {
            throw new SymbolLoadException(buildId, "Symbols not found for build ID " + buildId);
        }
        SymbolTable table;
        try (var reader = Files.newBufferedReader(file.get(), StandardCharsets.UTF_8)) {
            table = GSON.fromJson(reader, SymbolTable.class);
        } catch (IOException | JsonParseException e) {
            throw new SymbolLoadException(buildId, "Couldn't read " + file.get() + ": " + e.getMessage(), e);
        }
        if (table == null) {
            throw new SymbolLoadException(buildId, file.get() + " is empty");
        }
        if (table.buildId == null) {
            table.buildId = buildId;
        } else if (!table.buildId.equals(buildId)) {
            throw new SymbolLoadException(
                    buildId, String.format("%s has build ID %s, expected %s", file.get(), table.buildId, buildId));
        }
        return new IndexedModuleSymbols(table, file.get().toString());
    }

    private static final Logger LOG = Logger.getLogger("main");
}
