package games.hanabi.card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single card with a {@link Color} and a numeric rank.
 * <p>
 * Cards are immutable and compared by value. They are built either from a colour and rank
 * ({@link #create(Color, int)}) or from an abbreviation such as {@code "G1"}
 * ({@link #fromAbbreviation(String)}); both paths validate their input and report problems as a
 * failed {@link ParseResult} rather than throwing. The {@link #of(Color, int)} and
 * {@link #parse(String)} variants throw a {@link CardFormatException} instead.
 * <p>
 * Natural ordering is colour declaration order, then rank ascending.
 */
public final class Card implements Comparable<Card> {
    /** Highest valid rank; ranks run from 1 to this value inclusive. */
    public static final int RANK_LIMIT = 5;
    /** Longest abbreviation: one colour letter plus the digits of {@link #RANK_LIMIT}. */
    public static final int MAX_ABBREVIATION_LENGTH = Integer.toString(RANK_LIMIT).length() + 1;

    private static final Comparator<Card> ORDER = Comparator.comparing(Card::getColor).thenComparingInt(Card::getRank);

    /** The colour of this card. */
    private final Color color;
    /** The rank of this card, in {@code [1, RANK_LIMIT]}. */
    private final int rank;

    private Card(Color color, int rank) {
        this.color = color;
        this.rank = rank;
    }

    /**
     * Creates a card with the given colour and rank.
     *
     * @param color the card colour
     * @param rank  the card rank
     * @return the card, or a {@code COLOR_EXPECTED}/{@code RANK_OUT_OF_RANGE} failure
     */
    public static ParseResult<Card> create(Color color, int rank) {
        if (color == null || !ColorRegistry.get().contains(color)) {
            return ParseResult.failure(CardError.Kind.COLOR_EXPECTED, color == null ? null : color.name(),
                    "Card color must be one of " + ColorRegistry.get().letters().values() + ": " + color);
        }
        return CardParser.checkRank(rank, Integer.toString(rank)).map(r -> new Card(color, r));
    }

    /**
     * Creates a card with the given colour and rank.
     *
     * @throws CardFormatException if the colour is missing or the rank is out of range
     */
    public static Card of(Color color, int rank) {
        return create(color, rank).orElseThrow();
    }

    /**
     * Creates a card from its abbreviation.
     *
     * @param abbreviation string of the form "CR" where C is the first letter of the card colour
     *                     and R is the card rank, e.g. "G1", "B5", "W2"
     * @return the card, or the first validation failure
     * @see CardParser#parseAbbreviation(String)
     */
    public static ParseResult<Card> fromAbbreviation(String abbreviation) {
        return CardParser.parseAbbreviation(abbreviation);
    }

    /**
     * Creates a card from its abbreviation.
     *
     * @throws CardFormatException if the abbreviation is rejected
     */
    public static Card parse(String abbreviation) {
        return fromAbbreviation(abbreviation).orElseThrow();
    }

    /**
     * Returns the number of distinct colours.
     */
    public static int numberOfColors() {
        return ColorRegistry.get().size();
    }

    /**
     * Returns every distinct card, one per colour and rank, in natural order.
     *
     * @return an unmodifiable list of {@code numberOfColors() * RANK_LIMIT} cards
     */
    public static List<Card> allCards() {
        List<Card> cards = new ArrayList<>();
        for (Color color : ColorRegistry.get().letters().values()) {
            for (int rank = 1; rank <= RANK_LIMIT; rank++) {
                cards.add(new Card(color, rank));
            }
        }
        cards.sort(ORDER);
        return Collections.unmodifiableList(cards);
    }

    public Color getColor() {
        return color;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Returns the abbreviation of this card: the colour letter followed by the rank.
     *
     * @return e.g. "R1", "Y5"
     */
    public String getAbbreviation() {
        return String.valueOf(color.getLetter()) + rank;
    }

    /**
     * Returns the full name of this card: colour name and rank separated by a space.
     *
     * @return e.g. "Green 1", "Blue 5"
     */
    public String getDisplayName() {
        return color.getDisplayName() + " " + rank;
    }

    /**
     * Checks whether {@code text}, once trimmed, is exactly this card's abbreviation.
     */
    public boolean matchesAbbreviation(String text) {
        if (text == null) {
            return false;
        }
        return getAbbreviation().equals(text.trim());
    }

    @Override
    public int compareTo(Card other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && color == card.color;
    }

    @Override
    public int hashCode() {
        return Objects.hash(color, rank);
    }

    /**
     * Returns the full name of this card, see {@link #getDisplayName()}.
     */
    @Override
    public String toString() {
        return getDisplayName();
    }
}
