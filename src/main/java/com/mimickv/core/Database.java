package com.mimickv.core;

import com.mimickv.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One logical database: typed key storage guarded by a single lock.
 * <p>
 * Every command runs inside {@link #execute(Supplier)}, so the structures
 * below need no locking of their own. Mutations call {@link #touch(String)},
 * which bumps the key's version and wakes readers blocked on this database.
 */
public class Database {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final int index;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, KeyType> keyTypes = new HashMap<>();
    private final Map<String, Stream> streams = new HashMap<>();
    private final Map<String, String> strings = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();

    public Database(int index) {
        this.index = index;
    }

    /**
     * Run an operation atomically with respect to every other command on this database.
     *
     * @param operation the operation
     * @return the operation's result
     */
    public <T> T execute(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Wait for a change with the lock released. Caller holds the lock.
     */
    void awaitChange() throws InterruptedException {
        changed.await();
    }

    /**
     * Wait for a change for at most {@code nanos}. Caller holds the lock.
     */
    void awaitChange(long nanos) throws InterruptedException {
        changed.await(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Wake every blocked reader so it re-checks its condition.
     */
    public void signalAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Database " + index + " accessed without holding its lock");
        }
    }

    private static void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }

    /**
     * Record a mutation of {@code key} and wake blocked readers.
     */
    public void touch(String key) {
        checkLocked();
        versions.merge(key, 1L, Long::sum);
        changed.signalAll();
    }

    /**
     * Mutation counter of a key. Starts at 0 and only grows, even across deletes.
     */
    public long keyVersion(String key) {
        checkLocked();
        return versions.getOrDefault(key, 0L);
    }

    public Optional<KeyType> type(String key) {
        checkLocked();
        return Optional.ofNullable(keyTypes.get(key));
    }

    public boolean exists(String key) {
        checkLocked();
        return keyTypes.containsKey(key);
    }

    /**
     * The stream stored at {@code key}.
     *
     * @return the stream, or empty if the key does not exist
     * @throws CommandException if the key holds another type
     */
    public Optional<Stream> getStream(String key) {
        checkLocked();
        KeyType type = keyTypes.get(key);
        if (type == null) {
            return Optional.empty();
        }
        if (type != KeyType.STREAM) {
            throw ErrorMessages.wrongType();
        }
        return Optional.of(streams.get(key));
    }

    /**
     * The stream at {@code key}, created empty if the key does not exist.
     *
     * @throws CommandException if the key holds another type
     */
    public Stream getOrCreateStream(String key) {
        Optional<Stream> existing = getStream(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        Stream stream = new Stream();
        addStream(key, stream);
        return stream;
    }

    /**
     * Store a stream under a key that does not exist yet.
     *
     * @throws IllegalStateException if the key exists
     */
    public void addStream(String key, Stream stream) {
        checkLocked();
        validateKey(key);
        if (keyTypes.containsKey(key)) {
            throw new IllegalStateException("Key already exists: " + key);
        }
        keyTypes.put(key, KeyType.STREAM);
        streams.put(key, stream);
        logger.trace("Created stream {} in db {}", key, index);
        touch(key);
    }

    /**
     * Store a plain value. Replaces whatever the key held.
     */
    public void setString(String key, String value) {
        checkLocked();
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        removeValue(key);
        keyTypes.put(key, KeyType.STRING);
        strings.put(key, value);
        touch(key);
    }

    /**
     * @throws CommandException if the key holds another type
     */
    public Optional<String> getString(String key) {
        checkLocked();
        KeyType type = keyTypes.get(key);
        if (type == null) {
            return Optional.empty();
        }
        if (type != KeyType.STRING) {
            throw ErrorMessages.wrongType();
        }
        return Optional.of(strings.get(key));
    }

    /**
     * Delete a key of any type. A deleted stream takes its groups and pending rows with it.
     *
     * @return true if the key existed
     */
    public boolean delete(String key) {
        checkLocked();
        if (!removeValue(key)) {
            return false;
        }
        touch(key);
        return true;
    }

    private boolean removeValue(String key) {
        KeyType type = keyTypes.remove(key);
        if (type == null) {
            return false;
        }
        streams.remove(key);
        strings.remove(key);
        return true;
    }

    /**
     * Remove every key.
     */
    public void flush() {
        checkLocked();
        for (String key : new TreeSet<>(keyTypes.keySet())) {
            delete(key);
        }
    }

    public Set<String> keys() {
        checkLocked();
        return Collections.unmodifiableSet(new TreeSet<>(keyTypes.keySet()));
    }

    public int size() {
        checkLocked();
        return keyTypes.size();
    }

    public int getIndex() {
        return index;
    }
}
