package com.cookapi.jobclient.model;

import com.cookapi.jobclient.client.JobClientException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a single client operation, or of one job inside a batched operation.
 *
 * Either {@link Ok} carrying the payload or {@link Err} carrying a reason. Failures
 * are values rather than exceptions so that one bad job in a batch does not hide the
 * results of the others.
 *
 * @param <T> payload type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    enum Status { OK, ERROR }

    static <T> Result<T> ok(T data) {
        return new Ok<>(data);
    }

    static <T> Result<T> err(ErrorKind kind, String reason) {
        return new Err<>(kind, reason);
    }

    Status status();

    default boolean isOk() {
        return status() == Status.OK;
    }

    /** The payload, or empty for an {@link Err}. */
    Optional<T> value();

    /** The failure reason, or empty for an {@link Ok}. */
    Optional<String> error();

    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Returns the payload or throws a {@link JobClientException} carrying the reason.
     */
    T orElseThrow();

    record Ok<T>(T data) implements Result<T> {

        public Ok {
            Objects.requireNonNull(data, "data");
        }

        @Override public Status status()            { return Status.OK; }
        @Override public Optional<T> value()        { return Optional.of(data); }
        @Override public Optional<String> error()   { return Optional.empty(); }
        @Override public T orElseThrow()            { return data; }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Ok<>(mapper.apply(data));
        }
    }

    record Err<T>(ErrorKind kind, String reason) implements Result<T> {

        public Err {
            Objects.requireNonNull(kind, "kind");
            if (reason == null || reason.isBlank()) reason = kind.name();
        }

        @Override public Status status()             { return Status.ERROR; }
        @Override public Optional<T> value()         { return Optional.empty(); }
        @Override public Optional<String> error()    { return Optional.of(reason); }

        @Override
        public T orElseThrow() {
            throw new JobClientException(kind, reason);
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Err<>(kind, reason);
        }
    }
}
