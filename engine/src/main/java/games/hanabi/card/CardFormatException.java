package games.hanabi.card;

import java.util.Objects;

/**
 * Unchecked form of a {@link CardError}, thrown by {@link ParseResult#orElseThrow()} for callers
 * that prefer exceptions over inspecting a result.
 */
public class CardFormatException extends IllegalArgumentException {

    private final CardError error;

    public CardFormatException(CardError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    /**
     * Returns the error this exception was raised for.
     */
    public CardError getError() {
        return error;
    }

    public CardError.Kind getKind() {
        return error.kind();
    }
}
