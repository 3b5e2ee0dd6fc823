package org.symdbg;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * User settings, read from JSON like
 *
 * <pre>{@code {"symbolPaths": ["/out/symbols"], "symbolLessModules": ["<vDSO>"]}}</pre>
 */
public class DebugSettings {
    private static final Gson GSON = new Gson();

    /** Directories searched for symbol files, in order. */
    public List<String> symbolPaths = new ArrayList<>();
    /** Module names that never have symbols, so failing to find any is not reported. */
    public List<String> symbolLessModules = new ArrayList<>(List.of("<vDSO>"));

    public static DebugSettings defaults() {
        return new DebugSettings();
    }

    public static DebugSettings fromJson(String json) {
        try {
            var settings = GSON.fromJson(json, DebugSettings.class);
            if (settings == null) return defaults();
            return settings;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid settings: " + e.getMessage(), e);
        }
    }

    /** Settings from {@code file}, or the defaults if it doesn't exist. */
    public static DebugSettings load(Path file) {
        if (!Files.exists(file)) {
            LOG.info(file + " does not exist, using default settings");
            return defaults();
        }
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public List<Path> symbolPathList() {
        if (symbolPaths == null) return List.of();
        return symbolPaths.stream().map(Paths::get).collect(Collectors.toList());
    }

    public Set<String> symbolLessModuleSet() {
        if (symbolLessModules == null) return Set.of();
        return Set.copyOf(symbolLessModules);
    }

    private static final Logger LOG = Logger.getLogger("main");
}
