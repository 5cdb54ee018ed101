package org.kaleido.compiler.api;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of a compiler operation: either a value or a {@link CompilerError}, never both.
 * <p>
 * Parser and IR emitter return results instead of throwing, so a failure is statically
 * distinguishable from a legitimately absent optional part of the tree.
 *
 * @param <T> The type of the success value.
 */
public final class Result<T> {

    private final T value;
    private final CompilerError error;

    private Result(T value, CompilerError error) {
        this.value = value;
        this.error = error;
    }

    /**
     * Creates a successful result.
     * @param value The non-null value.
     * @param <T> The value type.
     * @return A result holding the value.
     */
    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Creates a failed result.
     * @param error The error.
     * @param <T> The value type the caller expected.
     * @return A result holding the error.
     */
    public static <T> Result<T> error(CompilerError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Shorthand for {@code error(new CompilerError(code, message, source))}.
     * @param code The error code.
     * @param message The message.
     * @param source The source position.
     * @param <T> The value type the caller expected.
     * @return A result holding the error.
     */
    public static <T> Result<T> error(CompilerErrorCode code, String message, SourceInfo source) {
        return error(new CompilerError(code, message, source));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * @return The success value.
     * @throws NoSuchElementException if this result is an error.
     */
    public T value() {
        if (error != null) {
            throw new NoSuchElementException("No value present, result is an error: " + error);
        }
        return value;
    }

    /**
     * @return The error.
     * @throws NoSuchElementException if this result is a success.
     */
    public CompilerError error() {
        if (error == null) {
            throw new NoSuchElementException("No error present, result is a success");
        }
        return error;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return propagate();
        }
        return ok(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (error != null) {
            return propagate();
        }
        return mapper.apply(value);
    }

    /**
     * Re-types a failed result so the error can be passed up a call chain expecting another value type.
     * @param <U> The new value type.
     * @return A result holding the same error.
     * @throws IllegalStateException if this result is a success.
     */
    public <U> Result<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new Result<>(null, error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Error[" + error + "]";
    }
}
