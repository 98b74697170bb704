package io.quantum.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A variable store that outlives one request: the process-wide application scope or one user's
 * session scope. Owned by the host and shared by every concurrent execution that sees it.
 *
 * <p>Plain reads never block. Every write takes the store's lock, and {@link #locked(Supplier)}
 * holds it across a whole read-modify-write so concurrent increments are never lost. The lock is
 * reentrant.
 */
public final class ScopeStore {

    private static final Object NULL = new Object();

    private final String name;
    private final ConcurrentHashMap<String, Object> values = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public ScopeStore(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /** A fresh application store. */
    public static ScopeStore application() {
        return new ScopeStore("application");
    }

    /** A fresh store for the given session. */
    public static ScopeStore session(String sessionId) {
        return new ScopeStore("session:" + sessionId);
    }

    public String name() {
        return name;
    }

    /** The bound value, or {@code null} when absent or bound to {@code null}. */
    public Object get(String key) {
        return unwrap(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public void put(String key, Object value) {
        lock.lock();
        try {
            values.put(key, value == null ? NULL : value);
        } finally {
            lock.unlock();
        }
    }

    public Object remove(String key) {
        lock.lock();
        try {
            return unwrap(values.remove(key));
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            values.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return values.size();
    }

    /** Runs {@code action} while holding this store's lock. */
    public <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the current bindings in unspecified order. */
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k, unwrap(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object unwrap(Object stored) {
        return stored == NULL ? null : stored;
    }

    @Override
    public String toString() {
        return "ScopeStore[" + name + ", keys=" + values.keySet() + "]";
    }
}
