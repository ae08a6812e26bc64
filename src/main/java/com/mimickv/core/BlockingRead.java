package com.mimickv.core;

import java.util.Optional;

/**
 * One attempt of a blocking read, run with the database lock held.
 *
 * @param <T> the read's result
 */
@FunctionalInterface
public interface BlockingRead<T> {

    /**
     * @return the result if the read is done, empty to keep waiting
     */
    Optional<T> tryRead();
}
