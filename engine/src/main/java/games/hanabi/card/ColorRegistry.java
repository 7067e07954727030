package games.hanabi.card;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide, read-only lookup of {@link Color} values by abbreviation letter and by name.
 * <p>
 * The registry is built lazily on the first call to {@link #get()} and never rebuilt. If the
 * colour enumeration is malformed (two colours share a first letter) the build fails with an
 * {@link InvalidColorSetException}; the failure is remembered and every later call to
 * {@link #get()} throws a new exception caused by it.
 * <p>
 * Both lookups are case-sensitive: letters match the upper-case letter returned by
 * {@link Color#getLetter()}, names match {@link Color#getDisplayName()} exactly.
 */
public final class ColorRegistry {
    private static final Logger log = LoggerFactory.getLogger(ColorRegistry.class);

    private static final Holder SHARED = new Holder(() -> FirstLetterIndex.build(Color.class, Color::getDisplayName));

    private final FirstLetterIndex<Color> byLetter;
    private final Map<String, Color> byName;

    private ColorRegistry(FirstLetterIndex<Color> byLetter) {
        this.byLetter = byLetter;
        Map<String, Color> names = new LinkedHashMap<>();
        for (Color color : Color.values()) {
            names.put(color.getDisplayName(), color);
        }
        this.byName = Collections.unmodifiableMap(names);
    }

    /**
     * Returns the shared registry, building it on first use.
     *
     * @return the registry
     * @throws InvalidColorSetException if the colour enumeration cannot be indexed by first letter
     */
    public static ColorRegistry get() {
        return SHARED.get();
    }

    /**
     * Lazily builds one registry from an index builder and keeps either the registry or the
     * build failure for good.
     */
    static final class Holder {
        private final Supplier<FirstLetterIndex<Color>> indexBuilder;
        private volatile ColorRegistry instance;
        private volatile InvalidColorSetException buildFailure;

        Holder(Supplier<FirstLetterIndex<Color>> indexBuilder) {
            this.indexBuilder = Objects.requireNonNull(indexBuilder, "indexBuilder");
        }

        /**
         * Returns the registry, building it on the first call.
         *
         * @throws InvalidColorSetException on every call once the build has failed
         */
        ColorRegistry get() {
            ColorRegistry registry = instance;
            if (registry != null) {
                return registry;
            }
            synchronized (this) {
                if (instance == null) {
                    if (buildFailure != null) {
                        throw new InvalidColorSetException(buildFailure.getMessage(), buildFailure);
                    }
                    try {
                        instance = new ColorRegistry(indexBuilder.get());
                    } catch (InvalidColorSetException e) {
                        buildFailure = new InvalidColorSetException("Color registry failed to initialise", e);
                        throw buildFailure;
                    }
                    if (log.isDebugEnabled()) {
                        log.debug("Color registry built with {} colors, rank limit {}", instance.size(), Card.RANK_LIMIT);
                    }
                }
                return instance;
            }
        }
    }

    /**
     * Looks up a colour by its abbreviation letter.
     *
     * @param letter the upper-case first letter of a colour name, e.g. 'R'
     * @return the colour, or an {@code UNKNOWN_COLOR_LETTER} failure
     */
    public ParseResult<Color> byLetter(char letter) {
        return byLetter.find(letter)
                .map(ParseResult::success)
                .orElseGet(() -> ParseResult.failure(CardError.Kind.UNKNOWN_COLOR_LETTER, String.valueOf(letter),
                        "Unknown card color abbreviation: " + letter));
    }

    /**
     * Looks up a colour by its full canonical name.
     *
     * @param name the colour name, e.g. "Red"
     * @return the colour, or a {@code COLOR_NAME_EXPECTED}/{@code UNKNOWN_COLOR_NAME} failure
     */
    public ParseResult<Color> byName(String name) {
        if (name == null || name.isEmpty()) {
            return ParseResult.failure(CardError.Kind.COLOR_NAME_EXPECTED, name, "Color name expected");
        }
        Color color = byName.get(name);
        if (color == null) {
            return ParseResult.failure(CardError.Kind.UNKNOWN_COLOR_NAME, name, "Unknown color name: " + name);
        }
        return ParseResult.success(color);
    }

    /**
     * Returns whether {@code color} is one of the registered colours.
     */
    public boolean contains(Color color) {
        return color != null && byLetter.find(color.getLetter()).filter(color::equals).isPresent();
    }

    /** Number of distinct colours. */
    public int size() {
        return byLetter.size();
    }

    /** Highest valid rank. */
    public int rankLimit() {
        return Card.RANK_LIMIT;
    }

    /**
     * Returns the letter table, e.g. {@code {R=Red, G=Green, ...}}.
     */
    public Map<Character, Color> letters() {
        return byLetter.asMap();
    }
}
