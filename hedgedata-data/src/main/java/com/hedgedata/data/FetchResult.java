package com.hedgedata.data;

/**
 * Outcome of one provider attempt.
 *
 * @param <T> value type of a successful attempt
 */
public sealed interface FetchResult<T> permits FetchResult.Success, FetchResult.Failure {

    record Success<T>(T value) implements FetchResult<T> {
    }

    record Failure<T>(Exception error) implements FetchResult<T> {
    }

    /**
     * A provider call that may fail with any exception.
     */
    @FunctionalInterface
    interface Attempt<T> {
        T call() throws Exception;
    }

    /**
     * Run an attempt, capturing its outcome instead of throwing.
     */
    static <T> FetchResult<T> of(Attempt<T> attempt) {
        try {
            return new Success<>(attempt.call());
        } catch (Exception e) {
            return new Failure<>(e);
        }
    }
}
