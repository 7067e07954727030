package games.hanabi.card;

/**
 * Raised when a colour set cannot be indexed by first letter, e.g. two colours share a letter.
 * <p>
 * This is a configuration error in the colour enumeration itself, not bad user input, and is
 * not meant to be handled by callers.
 */
public class InvalidColorSetException extends IllegalStateException {

    public InvalidColorSetException(String message) {
        super(message);
    }

    public InvalidColorSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
