package games.hanabi.console;

import static org.junit.jupiter.api.Assertions.*;

import games.hanabi.config.ConsoleProperties;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Scanner;
import org.junit.jupiter.api.Test;

class CardConsoleTest {

    private static String[] run(ConsoleProperties properties, String input, int expectedErrors) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        int errors = new CardConsole(properties).session(new Scanner(input), out);
        assertEquals(expectedErrors, errors);
        return buffer.toString(StandardCharsets.UTF_8).split("\\R");
    }

    private static ConsoleProperties quiet() {
        ConsoleProperties properties = new ConsoleProperties();
        properties.setPrompt(false);
        return properties;
    }

    @Test
    void parsesCardsAndKeepsGoingAfterErrors() {
        String[] lines = run(quiet(), "G1\nZ9\nR9\ncard B5\nquit\nY1\n", 2);
        assertEquals(4, lines.length);
        assertEquals("G1 = Green 1", lines[0]);
        assertEquals("error [UNKNOWN_COLOR_LETTER]: Unknown card color abbreviation: Z", lines[1]);
        assertTrue(lines[2].startsWith("error [RANK_OUT_OF_RANGE]: Card rank out of range: 9"));
        assertEquals("B5 = Blue 5", lines[3]);
    }

    @Test
    void colorAndRankCommands() {
        String[] lines = run(quiet(), "color Red\ncolor W\ncolor red\nrank 4\nrank -1\nrank\n", 3);
        assertEquals("R = Red", lines[0]);
        assertEquals("W = White", lines[1]);
        assertTrue(lines[2].startsWith("error [UNKNOWN_COLOR_NAME]"));
        assertEquals("4", lines[3]);
        assertTrue(lines[4].startsWith("error [RANK_OUT_OF_RANGE]"));
        assertTrue(lines[5].startsWith("error [RANK_EXPECTED]"));
    }

    @Test
    void listWithoutAbbreviations() {
        ConsoleProperties properties = quiet();
        properties.setShowAbbreviation(false);
        String[] lines = run(properties, "list\n", 0);
        assertEquals(25, lines.length);
        assertEquals("Red 1", lines[0]);
        assertEquals("Yellow 5", lines[24]);
    }

    @Test
    void promptIsPrintedWhenEnabled() {
        String[] lines = run(new ConsoleProperties(), "quit\n", 0);
        assertTrue(lines[0].startsWith("Enter card"));
    }
}
