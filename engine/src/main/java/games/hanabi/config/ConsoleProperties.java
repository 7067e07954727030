package games.hanabi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the card console.
 *
 * Usage:
 * {@code java -jar engine/target/hanabi-card-engine-1.0.0.jar --console.prompt=false --console.show-abbreviation=false}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "console")
public class ConsoleProperties {
  private boolean prompt = true;
  private boolean showAbbreviation = true;

  /**
   * Returns whether a prompt is printed before each input line.
   * @return true if the prompt is shown
   */
  public boolean isPrompt() {
    return prompt;
  }

  /**
   * Sets whether a prompt is printed before each input line.
   * @param prompt true to show the prompt, false for piped input
   */
  public void setPrompt(boolean prompt) {
    this.prompt = prompt;
  }

  /**
   * Returns whether parsed cards are echoed with their abbreviation as well as their name.
   * @return true to print "G1 = Green 1", false to print "Green 1"
   */
  public boolean isShowAbbreviation() {
    return showAbbreviation;
  }

  /**
   * Sets whether parsed cards are echoed with their abbreviation.
   * @param showAbbreviation true to include the abbreviation, false for the name only
   */
  public void setShowAbbreviation(boolean showAbbreviation) {
    this.showAbbreviation = showAbbreviation;
  }
}
