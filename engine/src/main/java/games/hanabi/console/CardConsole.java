package games.hanabi.console;

import games.hanabi.card.Card;
import games.hanabi.card.CardError;
import games.hanabi.card.CardParser;
import games.hanabi.card.Color;
import games.hanabi.card.ParseResult;
import games.hanabi.config.ConsoleProperties;
import java.io.PrintStream;
import java.util.Scanner;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line front end that feeds typed text into the card parsers.
 *
 * <p>Every line is answered either with the parsed value or with
 * {@code error [KIND]: message}; a rejected line never ends the session.
 */
@SpringBootApplication(scanBasePackages = "games.hanabi")
public class CardConsole implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(CardConsole.class);
    private static final String PROMPT = "Enter card (e.g. G1) | color NAME | rank N | list | quit: ";

    private final ConsoleProperties properties;

    public CardConsole(ConsoleProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CardConsole.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        session(new Scanner(System.in), System.out);
    }

    /**
     * Reads commands until {@code quit} or end of input.
     *
     * @return the number of lines that were rejected
     */
    public int session(Scanner in, PrintStream out) {
        int errors = 0;
        while (true) {
            if (properties.isPrompt()) {
                out.print(PROMPT);
            }
            if (!in.hasNextLine()) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed after {} rejected lines", errors);
                }
                break;
            }
            ConsoleCommand command = ConsoleCommand.parse(in.nextLine());
            if (command == null) {
                continue;
            }
            if (command.type() == ConsoleCommand.Type.QUIT) {
                break;
            }
            ParseResult<String> reply = handle(command);
            if (reply.isSuccess()) {
                out.println(reply.getValue());
            } else {
                errors++;
                out.println(formatError(reply.getError()));
            }
        }
        return errors;
    }

    /**
     * Runs a single command and renders its answer.
     */
    ParseResult<String> handle(ConsoleCommand command) {
        if (log.isDebugEnabled()) {
            log.debug("Console command: {} {}", command.type(), command.argument());
        }
        return switch (command.type()) {
            case CARD -> Card.fromAbbreviation(command.argument()).map(this::formatCard);
            case COLOR -> parseColor(command.argument()).map(c -> c.getLetter() + " = " + c.getDisplayName());
            case RANK -> CardParser.parseRank(command.argument()).map(String::valueOf);
            case LIST -> ParseResult.success(Card.allCards().stream()
                    .map(this::formatCard)
                    .collect(Collectors.joining(System.lineSeparator())));
            case QUIT -> ParseResult.success("");
        };
    }

    private ParseResult<Color> parseColor(String text) {
        // A single character is a colour letter, anything longer a colour name.
        if (text != null && text.length() == 1) {
            return CardParser.parseColor(text.charAt(0));
        }
        return CardParser.parseColor(text);
    }

    private String formatCard(Card card) {
        if (properties.isShowAbbreviation()) {
            return card.getAbbreviation() + " = " + card.getDisplayName();
        }
        return card.getDisplayName();
    }

    static String formatError(CardError error) {
        return "error [" + error.kind() + "]: " + error.message();
    }
}
