package games.hanabi.console;

import java.util.Locale;
import java.util.Objects;

/**
 * A single line typed into the card console.
 *
 * <p><b>Supported command shapes:</b>
 * <ul>
 *   <li>{@code quit}</li>
 *   <li>{@code list}</li>
 *   <li>{@code card <abbreviation>} or a bare abbreviation (e.g. {@code G1})</li>
 *   <li>{@code color <name|letter>} (e.g. {@code color Red}, {@code color R})</li>
 *   <li>{@code rank <text>}</li>
 * </ul>
 *
 * <p>Keywords are case-insensitive; the argument is passed on untouched so the card parsers
 * apply their own case rules.
 */
public record ConsoleCommand(Type type, String argument) {

    public enum Type {
        CARD,
        COLOR,
        RANK,
        LIST,
        QUIT
    }

    public ConsoleCommand {
        Objects.requireNonNull(type, "type");
    }

    /**
     * Parses one console line.
     *
     * @param line the raw input line
     * @return the command, or {@code null} for a blank line
     */
    public static ConsoleCommand parse(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        String[] parts = trimmed.split("\\s+", 2);
        String keyword = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1] : "";
        return switch (keyword) {
            case "quit", "exit" -> new ConsoleCommand(Type.QUIT, null);
            case "list" -> new ConsoleCommand(Type.LIST, null);
            case "card" -> new ConsoleCommand(Type.CARD, argument);
            case "color", "colour" -> new ConsoleCommand(Type.COLOR, argument);
            case "rank" -> new ConsoleCommand(Type.RANK, argument);
            // Anything else is treated as an abbreviation, including the error cases.
            default -> new ConsoleCommand(Type.CARD, trimmed);
        };
    }
}
