package games.hanabi.card;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("CardParser")
class CardParserTest {

    private static CardError.Kind kindOf(ParseResult<?> result) {
        assertTrue(result.isFailure(), "expected failure but got " + result);
        return result.getError().kind();
    }

    @Nested
    @DisplayName("Color letters")
    class ColorLetterTests {

        @Test
        void everyColorParsesFromItsLetter() {
            for (Color color : Color.values()) {
                assertEquals(color, CardParser.parseColor(color.getLetter()).getValue());
            }
        }

        @Test
        void knownLetters() {
            assertEquals(Color.RED, CardParser.parseColor('R').getValue());
            assertEquals(Color.GREEN, CardParser.parseColor('G').getValue());
            assertEquals(Color.BLUE, CardParser.parseColor('B').getValue());
            assertEquals(Color.WHITE, CardParser.parseColor('W').getValue());
            assertEquals(Color.YELLOW, CardParser.parseColor('Y').getValue());
        }

        @Test
        void unmappedLetterIsUnknown() {
            ParseResult<Color> result = CardParser.parseColor('Z');
            assertEquals(CardError.Kind.UNKNOWN_COLOR_LETTER, kindOf(result));
            assertEquals("Z", result.getError().input());
        }

        @Test
        void lowerCaseLetterIsUnknown() {
            assertEquals(CardError.Kind.UNKNOWN_COLOR_LETTER, kindOf(CardParser.parseColor('r')));
        }
    }

    @Nested
    @DisplayName("Color names")
    class ColorNameTests {

        @Test
        void canonicalNamesParse() {
            assertEquals(Color.RED, CardParser.parseColor("Red").getValue());
            assertEquals(Color.YELLOW, CardParser.parseColor("Yellow").getValue());
        }

        @ParameterizedTest
        @ValueSource(strings = {"red", "RED", " Red", "Purple", "R"})
        void otherSpellingsAreUnknown(String name) {
            ParseResult<Color> result = CardParser.parseColor(name);
            assertEquals(CardError.Kind.UNKNOWN_COLOR_NAME, kindOf(result));
            assertTrue(result.getError().message().contains(name));
        }

        @Test
        void missingNameIsExpected() {
            assertEquals(CardError.Kind.COLOR_NAME_EXPECTED, kindOf(CardParser.parseColor("")));
            assertEquals(CardError.Kind.COLOR_NAME_EXPECTED, kindOf(CardParser.parseColor((String) null)));
        }
    }

    @Nested
    @DisplayName("Ranks")
    class RankTests {

        @Test
        void validRanks() {
            for (int rank = 1; rank <= Card.RANK_LIMIT; rank++) {
                assertEquals(rank, CardParser.parseRank(String.valueOf(rank)).getValue());
            }
        }

        @Test
        void emptyOrMissingRankIsExpected() {
            assertEquals(CardError.Kind.RANK_EXPECTED, kindOf(CardParser.parseRank("")));
            assertEquals(CardError.Kind.RANK_EXPECTED, kindOf(CardParser.parseRank(null)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"R", "1.5", "+1", " 1", "1 ", "-", "0x1", "99999999999", "٣"})
        void nonIntegerText(String text) {
            ParseResult<Integer> result = CardParser.parseRank(text);
            assertEquals(CardError.Kind.RANK_NOT_INTEGER, kindOf(result));
            assertEquals(text, result.getError().input());
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-1", "6", "9", "10", "2147483647"})
        void outOfRangeIntegers(String text) {
            assertEquals(CardError.Kind.RANK_OUT_OF_RANGE, kindOf(CardParser.parseRank(text)));
        }

        @Test
        void leadingZerosAreStillDecimal() {
            assertEquals(3, CardParser.parseRank("03").getValue());
        }
    }

    @Nested
    @DisplayName("Abbreviations")
    class AbbreviationTests {

        @Test
        void missingAbbreviation() {
            assertEquals(CardError.Kind.ABBREVIATION_EXPECTED, kindOf(CardParser.parseAbbreviation(null)));
            assertEquals(CardError.Kind.ABBREVIATION_EXPECTED, kindOf(CardParser.parseAbbreviation("")));
        }

        @Test
        void singleCharacterIsTooShort() {
            assertEquals(CardError.Kind.ABBREVIATION_TOO_SHORT, kindOf(CardParser.parseAbbreviation("R")));
            assertEquals(CardError.Kind.ABBREVIATION_TOO_SHORT, kindOf(CardParser.parseAbbreviation("5")));
        }

        @Test
        void longerThanMaximumIsTooLong() {
            ParseResult<Card> result = CardParser.parseAbbreviation("R10");
            assertEquals(CardError.Kind.ABBREVIATION_TOO_LONG, kindOf(result));
            assertTrue(result.getError().message().contains(String.valueOf(Card.MAX_ABBREVIATION_LENGTH)));
            assertTrue(result.getError().message().contains("3"));
            // Length is checked before the letter.
            assertEquals(CardError.Kind.ABBREVIATION_TOO_LONG, kindOf(CardParser.parseAbbreviation("Z99")));
        }

        @Test
        void exactlyMaximumLengthParses() {
            Card card = CardParser.parseAbbreviation("R5").getValue();
            assertEquals(Card.MAX_ABBREVIATION_LENGTH, "R5".length());
            assertEquals(Color.RED, card.getColor());
            assertEquals(5, card.getRank());
        }

        @Test
        void rankErrorsSurfaceThroughAbbreviation() {
            assertEquals(CardError.Kind.RANK_NOT_INTEGER, kindOf(CardParser.parseAbbreviation("RR")));
            assertEquals(CardError.Kind.RANK_OUT_OF_RANGE, kindOf(CardParser.parseAbbreviation("R0")));
            assertEquals(CardError.Kind.RANK_OUT_OF_RANGE, kindOf(CardParser.parseAbbreviation("W6")));
        }

        @Test
        void lowerCaseColorLetterIsRejected() {
            assertEquals(CardError.Kind.UNKNOWN_COLOR_LETTER, kindOf(CardParser.parseAbbreviation("g1")));
        }
    }
}
