package com.mimickv.core;

/**
 * Cancellation signal tied to the lifetime of a client connection.
 */
public interface Cancellation {

    boolean isCancelled();

    /**
     * Register a callback run once when cancellation happens.
     * Runs immediately if already cancelled.
     *
     * @param listener the callback
     * @return handle that removes the callback when closed
     */
    Registration onCancel(Runnable listener);

    /**
     * Handle for a registered cancellation callback.
     */
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * A signal that is never cancelled. Used by embedded callers with no connection.
     */
    Cancellation NONE = new Cancellation() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public Registration onCancel(Runnable listener) {
            return () -> { };
        }
    };
}
