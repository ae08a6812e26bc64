package com.mimickv.command;

import com.mimickv.core.Cancellation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-connection state: the selected database and the connection's lifetime,
 * which blocked reads watch for cancellation.
 */
public class ClientContext implements Cancellation {

    private final String name;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private volatile int databaseIndex;

    public ClientContext(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public int getDatabaseIndex() {
        return databaseIndex;
    }

    public void selectDatabase(int index) {
        this.databaseIndex = index;
    }

    /**
     * Mark the connection closed and wake anything it is blocked on.
     * Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : closeListeners) {
            listener.run();
        }
        closeListeners.clear();
    }

    @Override
    public boolean isCancelled() {
        return closed.get();
    }

    @Override
    public Registration onCancel(Runnable listener) {
        closeListeners.add(listener);
        if (closed.get()) {
            closeListeners.remove(listener);
            listener.run();
        }
        return () -> closeListeners.remove(listener);
    }

    @Override
    public String toString() {
        return "ClientContext{" + name + ", db=" + databaseIndex + ", closed=" + closed.get() + '}';
    }
}
