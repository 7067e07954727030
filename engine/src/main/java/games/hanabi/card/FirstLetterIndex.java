package games.hanabi.card;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup from an upper-case first letter to the enum constant whose name starts with it.
 * <p>
 * The index is built in one pass over the enum constants. Names are normalised to upper case
 * before they are keyed, so "Red" and "rose" collide. Lookups are exact: they only match the
 * upper-case letter.
 *
 * @param <E> the enum type being indexed
 */
public final class FirstLetterIndex<E extends Enum<E>> {
    private static final Logger log = LoggerFactory.getLogger(FirstLetterIndex.class);

    private final Map<Character, E> byLetter;

    private FirstLetterIndex(Map<Character, E> byLetter) {
        this.byLetter = Collections.unmodifiableMap(byLetter);
    }

    /**
     * Builds an index over every constant of {@code type}.
     *
     * @param type   the enum class
     * @param nameOf extracts the name whose first letter keys each constant
     * @return the built index
     * @throws InvalidColorSetException if a name is empty or two constants share a first letter
     */
    public static <E extends Enum<E>> FirstLetterIndex<E> build(Class<E> type, Function<? super E, String> nameOf) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(nameOf, "nameOf");
        Map<Character, E> byLetter = new LinkedHashMap<>();
        for (E constant : type.getEnumConstants()) {
            String name = nameOf.apply(constant);
            if (name == null || name.isEmpty()) {
                throw new InvalidColorSetException(type.getSimpleName() + "." + constant.name() + " has no name to index");
            }
            char letter = Character.toUpperCase(name.charAt(0));
            E previous = byLetter.putIfAbsent(letter, constant);
            if (previous != null) {
                String message = "Two colors cannot start with the same letter: "
                        + nameOf.apply(previous) + " and " + name + " both start with '" + letter + "'";
                log.error("Cannot index {}: {}", type.getSimpleName(), message);
                throw new InvalidColorSetException(message);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Indexed {} by first letter: {}", type.getSimpleName(), byLetter);
        }
        return new FirstLetterIndex<>(byLetter);
    }

    /**
     * Finds the constant keyed by {@code letter}.
     *
     * @return the constant, or empty if no name starts with that (upper-case) letter
     */
    public Optional<E> find(char letter) {
        return Optional.ofNullable(byLetter.get(letter));
    }

    /**
     * Returns the number of indexed constants.
     */
    public int size() {
        return byLetter.size();
    }

    /**
     * Returns an unmodifiable view of the letter table, in declaration order.
     */
    public Map<Character, E> asMap() {
        return byLetter;
    }
}
