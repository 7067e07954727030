package games.hanabi.card;

import java.util.Objects;

/**
 * Describes why a piece of card text (or a colour/rank pair) was rejected.
 *
 * @param kind    the category of failure
 * @param input   the offending input rendered as text; may be {@code null} when nothing was given
 * @param message human-readable description naming the input and the violated constraint
 */
public record CardError(Kind kind, String input, String message) {

    public enum Kind {
        ABBREVIATION_EXPECTED,
        ABBREVIATION_TOO_SHORT,
        ABBREVIATION_TOO_LONG,
        COLOR_EXPECTED,
        UNKNOWN_COLOR_LETTER,
        COLOR_NAME_EXPECTED,
        UNKNOWN_COLOR_NAME,
        RANK_EXPECTED,
        RANK_NOT_INTEGER,
        RANK_OUT_OF_RANGE
    }

    public CardError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
