package org.symdbg.symbols;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The modules a target is expected to load, kept across runs of the target so locations can be checked before a
 * process exists. No load addresses are known here, so resolved locations have address 0 and address input is
 * not allowed.
 */
public class TargetSymbols implements LocationResolver {
    private final List<ModuleRef> modules = new ArrayList<>();

    public TargetSymbols() {}

    /** A copy for a cloned target, sharing every provider. */
    public TargetSymbols(TargetSymbols other) {
        for (var ref : other.modules) {
            modules.add(ref.share());
        }
    }

    /** Add another handle on {@code module}'s provider. Adding a provider twice is a no-op. */
    public void addModule(ModuleRef module) {
        if (contains(module.get())) return;
        modules.add(module.share());
    }

    public void removeModule(ModuleSymbols symbols) {
        for (var i = 0; i < modules.size(); i++) {
            if (modules.get(i).get() == symbols) {
                modules.remove(i).close();
                return;
            }
        }
    }

    public void removeAllModules() {
        for (var ref : modules) ref.close();
        modules.clear();
    }

    public boolean contains(ModuleSymbols symbols) {
        for (var ref : modules) {
            if (ref.get() == symbols) return true;
        }
        return false;
    }

    public List<ModuleSymbols> getModuleSymbols() {
        var result = ImmutableList.<ModuleSymbols>builder();
        for (var ref : modules) result.add(ref.get());
        return result.build();
    }

    @Override
    public List<Location> resolveInputLocation(InputLocation input, ResolveOptions options) {
        if (input.kind() == InputLocation.Kind.ADDRESS) {
            throw new IllegalArgumentException("Addresses can only be resolved against a running process: " + input);
        }
        var result = ImmutableList.<Location>builder();
        for (var ref : modules) {
            var found = ref.get().resolveInputLocation(SymbolContext.forRelativeAddresses(), input, options);
            for (var location : found) {
                if (location.state() == Location.State.UNLOCATED_VARIABLE) result.add(location);
                else result.add(location.withAddress(0));
            }
        }
        return result.build();
    }

    public List<String> findFileMatches(String name) {
        var result = new ArrayList<String>();
        for (var ref : modules) {
            for (var file : ref.get().findFileMatches(name)) {
                if (!result.contains(file)) result.add(file);
            }
        }
        return result;
    }
}
