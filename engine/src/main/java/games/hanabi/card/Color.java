package games.hanabi.card;

/**
 * Enumeration of the card colours used by the game.
 * <p>
 * Colours are identified in abbreviations by the first letter of their display name, so every
 * colour added here must start with a letter no other colour starts with. The check runs once,
 * when {@link ColorRegistry} is first built.
 * <p>
 * The declaration order is the ordering used by {@link Card#compareTo(Card)}.
 */
public enum Color {
    /** Red – abbreviated as {@code R}. */
    RED("Red"),
    /** Green – abbreviated as {@code G}. */
    GREEN("Green"),
    /** Blue – abbreviated as {@code B}. */
    BLUE("Blue"),
    /** White – abbreviated as {@code W}. */
    WHITE("White"),
    /** Yellow – abbreviated as {@code Y}. */
    YELLOW("Yellow");

    /** Canonical name, used for display and for parsing full colour names. */
    private final String displayName;

    Color(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the canonical name of this colour.
     *
     * @return the display name (e.g., "Red", "Yellow")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the letter this colour is abbreviated with: the first character of the
     * display name in upper case.
     *
     * @return the abbreviation letter (e.g., 'R', 'Y')
     */
    public char getLetter() {
        return Character.toUpperCase(displayName.charAt(0));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
