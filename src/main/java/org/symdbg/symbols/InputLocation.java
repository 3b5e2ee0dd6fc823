package org.symdbg.symbols;

import java.util.Objects;

/**
 * A location the user asked for, before it has been resolved against any symbols. Exactly one of
 * {@link None}, {@link Address}, {@link Line} or {@link Name}; the constructor is private so no other variant
 * can exist, and every consumer goes through {@link Visitor} so a new variant breaks the build everywhere it
 * has to be handled.
 */
public abstract class InputLocation {
    public enum Kind {
        NONE,
        ADDRESS,
        LINE,
        NAME
    }

    public interface Visitor<R> {
        R visitNone();

        R visitAddress(long address);

        R visitLine(FileLine line);

        R visitName(Identifier name);
    }

    private InputLocation() {}

    public abstract Kind kind();

    public abstract <R> R accept(Visitor<R> visitor);

    public static InputLocation none() {
        return None.INSTANCE;
    }

    public static InputLocation address(long address) {
        return new Address(address);
    }

    public static InputLocation line(String file, int line) {
        return new Line(new FileLine(file, line));
    }

    public static InputLocation line(FileLine line) {
        return new Line(line);
    }

    public static InputLocation name(String name) {
        return new Name(Identifier.parse(name));
    }

    public static InputLocation name(Identifier name) {
        return new Name(name);
    }

    public static final class None extends InputLocation {
        private static final None INSTANCE = new None();

        private None() {}

        @Override
        public Kind kind() {
            return Kind.NONE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof None;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "<none>";
        }
    }

    public static final class Address extends InputLocation {
        public final long address;

        private Address(long address) {
            this.address = address;
        }

        @Override
        public Kind kind() {
            return Kind.ADDRESS;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAddress(address);
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Address)) return false;
            return ((Address) other).address == address;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(address);
        }

        @Override
        public String toString() {
            return String.format("0x%x", address);
        }
    }

    public static final class Line extends InputLocation {
        public final FileLine line;

        private Line(FileLine line) {
            this.line = Objects.requireNonNull(line);
        }

        @Override
        public Kind kind() {
            return Kind.LINE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLine(line);
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Line)) return false;
            return ((Line) other).line.equals(line);
        }

        @Override
        public int hashCode() {
            return line.hashCode();
        }

        @Override
        public String toString() {
            return line.toString();
        }
    }

    public static final class Name extends InputLocation {
        public final Identifier name;

        private Name(Identifier name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public Kind kind() {
            return Kind.NAME;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(name);
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Name)) return false;
            return ((Name) other).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name.toString();
        }
    }
}
