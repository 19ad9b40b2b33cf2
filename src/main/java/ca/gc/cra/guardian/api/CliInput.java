package ca.gc.cra.guardian.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arguments of one GUARDIAN command: the recognised switches plus the {@code key=value} tokens left for
 * {@link CliArgsParser}.
 *
 * <p>Unrecognised switches are logged and dropped so a typo never turns into a {@code key=value} error.</p>
 */
public final class CliInput {
  private static final Logger log = LoggerFactory.getLogger(CliInput.class);

  /** Switches understood by every command. */
  enum Switch {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    /** Pick redirects and follow-up questions at random instead of deterministically. */
    RANDOM("--random");

    private final Set<String> spellings;

    Switch(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Switch lookup(String arg) {
      String lower = arg.toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(lower)) {
          return candidate;
        }
      }
      return null;
    }
  }

  private final List<String> keyValueArgs;
  private final Set<Switch> switches;

  private CliInput(List<String> keyValueArgs, Set<Switch> switches) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.switches = switches;
  }

  /**
   * Parses raw arguments.
   *
   * <p>A token is a switch when it starts with {@code -} and holds no {@code =}; the bare word {@code help}
   * is accepted too. Everything else is passed through untouched, so {@code text=hi there} stays one token
   * when the shell passes it as one.</p>
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        Switch match = Switch.lookup(arg);
        if (match != null) {
          switches.add(match);
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          log.warn("Ignoring unknown option {}", arg);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, switches);
  }

  /**
   * Returns the {@code key=value} tokens in their original order.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return switches.contains(Switch.HELP);
  }

  /** @return {@code true} when {@code --verbose} (or an alias) was present */
  public boolean verbose() {
    return switches.contains(Switch.VERBOSE);
  }

  /** @return {@code true} when {@code --random} asked for non-deterministic phrase selection */
  public boolean randomPhrases() {
    return switches.contains(Switch.RANDOM);
  }
}
