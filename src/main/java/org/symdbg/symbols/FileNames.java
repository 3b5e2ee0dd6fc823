package org.symdbg.symbols;

class FileNames {
    /**
     * True when {@code name} is a right-aligned part of {@code path} that starts at a path component boundary, so
     * {@code bar/baz.cc} matches {@code /foo/bar/baz.cc} but {@code r/baz.cc} does not.
     */
    static boolean matches(String path, String name) {
        if (name.isEmpty() || !path.endsWith(name)) return false;
        if (path.length() == name.length()) return true;
        if (name.startsWith("/")) return true;
        return path.charAt(path.length() - name.length() - 1) == '/';
    }
}
