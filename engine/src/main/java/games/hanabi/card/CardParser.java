package games.hanabi.card;

/**
 * Static parsing routines that turn text into validated card components.
 * <p>
 * None of these methods throw for bad input; every rejection is reported as a failed
 * {@link ParseResult} with a specific {@link CardError.Kind}. Parsing is case-sensitive:
 * colour letters must be upper case and colour names must match the canonical spelling.
 */
public final class CardParser {

    private CardParser() {
    }

    /**
     * Parses the abbreviation letter of a colour.
     *
     * @param letter first letter of a colour, e.g. 'R', 'Y', 'W'
     * @return the colour, or an {@code UNKNOWN_COLOR_LETTER} failure
     */
    public static ParseResult<Color> parseColor(char letter) {
        return ColorRegistry.get().byLetter(letter);
    }

    /**
     * Parses the full name of a colour.
     *
     * @param name colour name, e.g. "Red", "Yellow"
     * @return the colour, or a {@code COLOR_NAME_EXPECTED}/{@code UNKNOWN_COLOR_NAME} failure
     */
    public static ParseResult<Color> parseColor(String name) {
        return ColorRegistry.get().byName(name);
    }

    /**
     * Parses a rank string.
     * <p>
     * Only ASCII decimal digits are accepted, optionally preceded by '-' (which always yields an
     * out-of-range value). Whitespace, a leading '+', decimals and values that overflow an
     * {@code int} are rejected as non-integers.
     *
     * @param text string that contains only the rank, e.g. "3"
     * @return the rank, or a {@code RANK_EXPECTED}/{@code RANK_NOT_INTEGER}/{@code RANK_OUT_OF_RANGE} failure
     */
    public static ParseResult<Integer> parseRank(String text) {
        if (text == null || text.isEmpty()) {
            return ParseResult.failure(CardError.Kind.RANK_EXPECTED, text, "Rank string expected");
        }
        if (!isDecimalInteger(text)) {
            return notAnInteger(text);
        }
        int rank;
        try {
            rank = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            // Digits only, so the value overflowed.
            return notAnInteger(text);
        }
        return checkRank(rank, text);
    }

    /**
     * Parses a card abbreviation: one colour letter followed by the rank, e.g. "G1", "B5".
     * <p>
     * The checks run in order: presence, minimum length, maximum length, colour letter, rank.
     * The rank is not looked at when the colour letter is unknown.
     *
     * @param abbreviation the abbreviation text
     * @return the card, or the first failure encountered
     */
    public static ParseResult<Card> parseAbbreviation(String abbreviation) {
        if (abbreviation == null || abbreviation.isEmpty()) {
            return ParseResult.failure(CardError.Kind.ABBREVIATION_EXPECTED, abbreviation, "Card abbreviation expected");
        }
        if (abbreviation.length() < 2) {
            return ParseResult.failure(CardError.Kind.ABBREVIATION_TOO_SHORT, abbreviation,
                    "Card abbreviation must be at least 2 symbols long: " + abbreviation);
        }
        if (abbreviation.length() > Card.MAX_ABBREVIATION_LENGTH) {
            return ParseResult.failure(CardError.Kind.ABBREVIATION_TOO_LONG, abbreviation,
                    "Card abbreviation can't be more than " + Card.MAX_ABBREVIATION_LENGTH
                            + " symbols long, got " + abbreviation.length() + ": " + abbreviation);
        }
        return parseColor(abbreviation.charAt(0))
                .flatMap(color -> parseRank(abbreviation.substring(1))
                        .flatMap(rank -> Card.create(color, rank)));
    }

    static ParseResult<Integer> checkRank(int rank, String input) {
        if (rank < 1 || rank > Card.RANK_LIMIT) {
            return ParseResult.failure(CardError.Kind.RANK_OUT_OF_RANGE, input,
                    "Card rank out of range: " + rank + " (expected 1 to " + Card.RANK_LIMIT + ")");
        }
        return ParseResult.success(rank);
    }

    private static boolean isDecimalInteger(String text) {
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static <T> ParseResult<T> notAnInteger(String text) {
        return ParseResult.failure(CardError.Kind.RANK_NOT_INTEGER, text, "Card rank must be an integer: " + text);
    }
}
