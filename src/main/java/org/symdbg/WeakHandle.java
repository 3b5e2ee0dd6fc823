package org.symdbg;

import java.lang.ref.WeakReference;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reference to an object that may be destroyed before the reference is used, like a breakpoint referred to by a
 * pending agent reply. {@link #get()} is empty once the owner invalidates its handles or is garbage collected.
 */
public final class WeakHandle<T> {
    private final WeakReference<T> target;
    private final AtomicBoolean valid;

    private WeakHandle(WeakReference<T> target, AtomicBoolean valid) {
        this.target = target;
        this.valid = valid;
    }

    public Optional<T> get() {
        if (!valid.get()) return Optional.empty();
        return Optional.ofNullable(target.get());
    }

    /** Held by the owner, which hands out handles and invalidates them when it's destroyed. */
    public static final class Factory<T> {
        private final WeakReference<T> target;
        private AtomicBoolean valid = new AtomicBoolean(true);

        public Factory(T owner) {
            this.target = new WeakReference<>(owner);
        }

        public WeakHandle<T> getWeakHandle() {
            return new WeakHandle<>(target, valid);
        }

        /** Every handle given out so far becomes empty. Handles given out later are valid. */
        public void invalidateWeakHandles() {
            valid.set(false);
            valid = new AtomicBoolean(true);
        }
    }
}
