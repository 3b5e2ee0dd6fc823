package org.symdbg.symbols;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/** {@link ModuleSymbols} over an in-memory {@link SymbolTable}. */
public class IndexedModuleSymbols implements ModuleSymbols {
    private static class IndexedFunction {
        final FunctionSymbol symbol;
        final Optional<Long> prologueEnd;
        final List<SymbolTable.Line> rows;

        IndexedFunction(FunctionSymbol symbol, Optional<Long> prologueEnd, List<SymbolTable.Line> rows) {
            this.symbol = symbol;
            this.prologueEnd = prologueEnd;
            this.rows = rows;
        }
    }

    private final String buildId, name, symbolFile;
    private final TreeMap<Long, IndexedFunction> functions = new TreeMap<>(Long::compareUnsigned);
    private final Map<String, List<Symbol>> byName = new HashMap<>();
    private final TreeSet<String> files = new TreeSet<>();

    public IndexedModuleSymbols(SymbolTable table, String symbolFile) {
        this.buildId = table.buildId;
        this.name = table.name;
        this.symbolFile = symbolFile;
        for (var f : table.functions) {
            if (f.name == null || Long.compareUnsigned(f.end, f.begin) <= 0) {
                LOG.warning(String.format("Skipping malformed function %s in %s", f.name, symbolFile));
                continue;
            }
            var rows = new ArrayList<>(f.lines);
            rows.sort((a, b) -> Long.compareUnsigned(a.address, b.address));
            var decl = rows.isEmpty() ? Optional.<FileLine>empty() : Optional.of(fileLine(rows.get(0)));
            var containing = Optional.ofNullable(f.containingClass).map(Identifier::parse);
            var symbol = new FunctionSymbol(Identifier.parse(f.name), containing, f.begin, f.end, decl);
            functions.put(f.begin, new IndexedFunction(symbol, Optional.ofNullable(f.prologueEnd), rows));
            index(symbol);
            for (var row : rows) files.add(row.file);
        }
        for (var v : table.variables) {
            if (v.name == null) continue;
            var address = v.address == null ? OptionalLong.empty() : OptionalLong.of(v.address);
            index(new VariableSymbol(Identifier.parse(v.name), address, v.threadLocal));
        }
    }

    private void index(Symbol symbol) {
        byName.computeIfAbsent(symbol.fullName().qualifiedName(), __ -> new ArrayList<>()).add(symbol);
    }

    @Override
    public String buildId() {
        return buildId;
    }

    @Override
    public ModuleSymbolStatus getStatus() {
        var status = new ModuleSymbolStatus();
        status.buildId = buildId;
        status.name = name;
        status.functionsIndexed = functions.size();
        status.filesIndexed = files.size();
        status.symbolsLoaded = true;
        status.symbolFile = symbolFile;
        return status;
    }

    @Override
    public List<Location> resolveInputLocation(SymbolContext context, InputLocation input, ResolveOptions options) {
        return input.accept(
                new InputLocation.Visitor<List<Location>>() {
                    @Override
                    public List<Location> visitNone() {
                        return List.of();
                    }

                    @Override
                    public List<Location> visitAddress(long address) {
                        return List.of(resolveAddress(context, address, options));
                    }

                    @Override
                    public List<Location> visitLine(FileLine line) {
                        return resolveLine(context, line, options);
                    }

                    @Override
                    public List<Location> visitName(Identifier name) {
                        return resolveName(context, name, options);
                    }
                });
    }

    private Location resolveAddress(SymbolContext context, long address, ResolveOptions options) {
        if (!options.symbolize) return Location.address(address);
        var relative = context.absoluteToRelative(address);
        var function = functionAt(relative);
        if (function.isEmpty()) return Location.address(address);
        return symbolize(context, function.get(), relative);
    }

    private List<Location> resolveName(SymbolContext context, Identifier name, ResolveOptions options) {
        var result = ImmutableList.<Location>builder();
        for (var symbol : findSymbols(name)) {
            if (symbol instanceof FunctionSymbol) {
                var function = functions.get(((FunctionSymbol) symbol).begin());
                result.add(locationIn(context, function, function.symbol.begin(), options));
            } else if (symbol instanceof VariableSymbol) {
                var variable = (VariableSymbol) symbol;
                var address = variable.address();
                if (address.isEmpty()) {
                    result.add(Location.unlocatedVariable(variable, context));
                    continue;
                }
                var absolute = context.relativeToAbsolute(address.getAsLong());
                if (options.symbolize) {
                    result.add(Location.symbolized(absolute, Optional.empty(), 0, context, variable));
                } else {
                    result.add(Location.address(absolute, context));
                }
            }
        }
        return result.build();
    }

    private List<Location> resolveLine(SymbolContext context, FileLine requested, ResolveOptions options) {
        var result = ImmutableList.<Location>builder();
        for (var file : findFileMatches(requested.file)) {
            var best = bestLine(file, requested.line);
            if (best.isEmpty()) continue;
            for (var function : functions.values()) {
                for (var row : function.rows) {
                    if (row.line == best.getAsInt() && row.file.equals(file)) {
                        result.add(locationIn(context, function, row.address, options));
                        break;
                    }
                }
            }
        }
        return result.build();
    }

    /**
     * The line breakpoints on {@code line} should use in {@code file}: the line itself if it has code, otherwise the
     * next line with code in a function whose lines in this file surround {@code line}.
     */
    private OptionalInt bestLine(String file, int line) {
        var best = OptionalInt.empty();
        for (var function : functions.values()) {
            var min = Integer.MAX_VALUE;
            var max = Integer.MIN_VALUE;
            var next = Integer.MAX_VALUE;
            for (var row : function.rows) {
                if (!row.file.equals(file)) continue;
                if (row.line == line) return OptionalInt.of(line);
                min = Math.min(min, row.line);
                max = Math.max(max, row.line);
                if (row.line > line) next = Math.min(next, row.line);
            }
            if (min > line || max < line) continue;
            if (best.isEmpty() || next < best.getAsInt()) best = OptionalInt.of(next);
        }
        return best;
    }

    private Location locationIn(
            SymbolContext context, IndexedFunction function, long relative, ResolveOptions options) {
        if (options.skipFunctionPrologue && relative == function.symbol.begin()) {
            relative = afterPrologue(function);
        }
        if (!options.symbolize) return Location.address(context.relativeToAbsolute(relative), context);
        return symbolize(context, function, relative);
    }

    private long afterPrologue(IndexedFunction function) {
        var begin = function.symbol.begin();
        if (function.prologueEnd.isPresent()) {
            var end = function.prologueEnd.get();
            if (end != begin && function.symbol.containsRelative(end)) return end;
        }
        for (var row : function.rows) {
            if (row.address != begin && function.symbol.containsRelative(row.address)) return row.address;
        }
        return begin;
    }

    private Location symbolize(SymbolContext context, IndexedFunction function, long relative) {
        var absolute = context.relativeToAbsolute(relative);
        var row = rowAt(function, relative);
        if (row.isEmpty()) return Location.symbolized(absolute, Optional.empty(), 0, context, function.symbol);
        var found = row.get();
        return Location.symbolized(absolute, Optional.of(fileLine(found)), found.column, context, function.symbol);
    }

    private Optional<IndexedFunction> functionAt(long relative) {
        var entry = functions.floorEntry(relative);
        if (entry == null || !entry.getValue().symbol.containsRelative(relative)) return Optional.empty();
        return Optional.of(entry.getValue());
    }

    private Optional<SymbolTable.Line> rowAt(IndexedFunction function, long relative) {
        SymbolTable.Line found = null;
        for (var row : function.rows) {
            if (Long.compareUnsigned(row.address, relative) > 0) break;
            found = row;
        }
        return Optional.ofNullable(found);
    }

    @Override
    public LineDetails lineDetailsForAddress(SymbolContext context, long absoluteAddress) {
        var relative = context.absoluteToRelative(absoluteAddress);
        var function = functionAt(relative);
        if (function.isEmpty()) return LineDetails.empty();
        var rows = function.get().rows;
        for (var i = 0; i < rows.size(); i++) {
            var row = rows.get(i);
            var end = i + 1 < rows.size() ? rows.get(i + 1).address : function.get().symbol.end();
            if (Long.compareUnsigned(relative, row.address) >= 0 && Long.compareUnsigned(relative, end) < 0) {
                return new LineDetails(
                        Optional.of(fileLine(row)),
                        row.column,
                        context.relativeToAbsolute(row.address),
                        context.relativeToAbsolute(end));
            }
        }
        return LineDetails.empty();
    }

    @Override
    public List<String> findFileMatches(String name) {
        var result = ImmutableList.<String>builder();
        for (var file : files) {
            if (FileNames.matches(file, name)) result.add(file);
        }
        return result.build();
    }

    @Override
    public List<Symbol> findSymbols(Identifier name) {
        return List.copyOf(byName.getOrDefault(name.qualifiedName(), List.of()));
    }

    private static FileLine fileLine(SymbolTable.Line row) {
        return new FileLine(row.file, row.line);
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", name, buildId);
    }

    private static final Logger LOG = Logger.getLogger("main");
}
