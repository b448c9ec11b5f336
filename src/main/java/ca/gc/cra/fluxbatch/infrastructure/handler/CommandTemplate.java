package ca.gc.cra.fluxbatch.infrastructure.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command line with {@code {name}} placeholders, split into arguments once at configuration time.
 *
 * <p>Arguments are separated by whitespace; single or double quotes group an argument containing spaces. Unknown
 * placeholders are left untouched.</p>
 *
 * @since 0.1.0
 */
public final class CommandTemplate {
  private final String source;
  private final List<String> arguments;

  private CommandTemplate(String source, List<String> arguments) {
    this.source = source;
    this.arguments = List.copyOf(arguments);
  }

  /**
   * Parses a command line.
   *
   * @param commandLine e.g. {@code python pfp_l1.py --control {manifest}}
   * @return parsed template
   * @throws IllegalArgumentException if the line is blank or a quote is left open
   */
  public static CommandTemplate parse(String commandLine) {
    Objects.requireNonNull(commandLine, "commandLine");
    List<String> args = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;
    for (int i = 0; i < commandLine.length(); i++) {
      char c = commandLine.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          args.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (quote != 0) {
      throw new IllegalArgumentException("Unterminated quote in command: " + commandLine);
    }
    if (inToken) {
      args.add(current.toString());
    }
    if (args.isEmpty()) {
      throw new IllegalArgumentException("command must not be blank");
    }
    return new CommandTemplate(commandLine.trim(), args);
  }

  /**
   * Substitutes placeholders in every argument.
   *
   * @param values placeholder name (without braces) to replacement
   * @return concrete argument list
   */
  public List<String> render(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    List<String> rendered = new ArrayList<>(arguments.size());
    for (String argument : arguments) {
      String value = argument;
      for (Map.Entry<String, String> entry : values.entrySet()) {
        value = value.replace('{' + entry.getKey() + '}', entry.getValue());
      }
      rendered.add(value);
    }
    return rendered;
  }

  public List<String> arguments() {
    return arguments;
  }

  @Override
  public String toString() {
    return source;
  }
}
