package org.itinera.routing.collaborator;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one call to an external collaborator.
 *
 * <p>Either carries a value, or a failure reason with an optional cause. Callers decide
 * whether a failure is fatal; collaborators themselves never throw for expected misses.</p>
 *
 * @param <T> value type.
 */
public final class CollaboratorResult<T> {
    private final T value;
    private final String failureReason;
    private final Throwable cause;

    private CollaboratorResult(T value, String failureReason, Throwable cause) {
        this.value = value;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static <T> CollaboratorResult<T> success(T value) {
        return new CollaboratorResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> CollaboratorResult<T> failure(String reason) {
        return failure(reason, null);
    }

    public static <T> CollaboratorResult<T> failure(String reason, Throwable cause) {
        Objects.requireNonNull(reason, "reason");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("failure reason must be non-blank");
        }
        return new CollaboratorResult<>(null, reason, cause);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    /**
     * Returns the value.
     *
     * @throws NoSuchElementException on a failed result.
     */
    public T value() {
        if (!isSuccess()) {
            throw new NoSuchElementException("collaborator failed: " + failureReason);
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public String failureReason() {
        return failureReason;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    public <R> CollaboratorResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return new CollaboratorResult<>(null, failureReason, cause);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + failureReason + "]";
    }
}
