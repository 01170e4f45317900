package com.hockeyquant.adapter.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an upstream fetch. Either holds a value (which may itself be empty,
 * meaning "no data") or a {@link FetchError} describing why the fetch failed.
 */
public final class FetchResult<T> {

    private final T value;
    private final FetchError error;

    private FetchResult(T value, FetchError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FetchResult<T> success(T value) {
        return new FetchResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> FetchResult<T> failure(FetchError error) {
        return new FetchResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Fetch failed: " + error);
        }
        return value;
    }

    public FetchError getError() {
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public <R> FetchResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult[ok]" : "FetchResult[" + error + "]";
    }
}
