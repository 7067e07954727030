package games.hanabi.card;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of parsing or validating card input.
 * <p>
 * A result is either a success holding a value, or a failure holding a {@link CardError}
 * that explains which input was rejected and why. Steps are chained with
 * {@link #flatMap(Function)} so that the first failure short-circuits the rest.
 *
 * @param <T> the type of the parsed value
 */
public final class ParseResult<T> {
    /** Parsed value; {@code null} for failures. */
    private final T value;
    /** Failure details; {@code null} for successes. */
    private final CardError error;

    private ParseResult(T value, CardError error) {
        this.value = value;
        this.error = error;
    }

    /**
     * Creates a successful result.
     *
     * @param value the parsed value; must not be null
     * @return a successful result wrapping {@code value}
     */
    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param error the reason for the failure; must not be null
     * @return a failed result
     */
    public static <T> ParseResult<T> failure(CardError error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    static <T> ParseResult<T> failure(CardError.Kind kind, String input, String message) {
        return failure(new CardError(kind, input, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the parsed value.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error);
        }
        return value;
    }

    /**
     * Returns the failure details.
     *
     * @throws IllegalStateException if this result is a success
     */
    public CardError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present: " + value);
        }
        return error;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return Objects.requireNonNull(mapper.apply(value), "mapper result");
    }

    /**
     * Returns the value, or throws a {@link CardFormatException} carrying the error.
     *
     * @throws CardFormatException if this result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw new CardFormatException(error);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParseResult<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
