package dev.podflow.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments of one podflow command, split into recognised flags and {@code key=value} settings.
 * Unrecognised dash-prefixed words are kept aside so the command can report them.
 */
public final class CliInput {
  /** Flags understood by every podflow command. */
  public enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run", "-n");

    private final Set<String> spellings;

    Flag(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Flag lookup(String lowerCased) {
      for (Flag flag : values()) {
        if (flag.spellings.contains(lowerCased)) {
          return flag;
        }
      }
      return null;
    }
  }

  private final List<String> settings;
  private final Set<Flag> flags;
  private final List<String> unknownFlags;

  private CliInput(List<String> settings, Set<Flag> flags, List<String> unknownFlags) {
    this.settings = settings;
    this.flags = flags;
    this.unknownFlags = unknownFlags;
  }

  /**
   * Classifies raw arguments. Bare words that are not flags stay with the settings so the key/value parser
   * can reject them.
   *
   * @param args raw CLI arguments (may be {@code null}); {@code null} and blank entries are skipped
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    List<String> unknown = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        Flag flag = Flag.lookup(arg.toLowerCase(Locale.ROOT));
        if (flag != null) {
          flags.add(flag);
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(arg);
        } else {
          settings.add(arg);
        }
      }
    }
    return new CliInput(
        Collections.unmodifiableList(settings), Collections.unmodifiableSet(flags), List.copyOf(unknown));
  }

  /**
   * Returns the {@code key=value} arguments in command-line order.
   *
   * @return unmodifiable list of setting arguments
   */
  public List<String> settings() {
    return settings;
  }

  /**
   * Indicates whether usage text was requested with {@code --help}, {@code -h} or {@code help}.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return flags.contains(Flag.HELP);
  }

  /**
   * Indicates whether DEBUG logging for {@code dev.podflow} was requested.
   *
   * @return {@code true} when {@code --verbose}, {@code -v} or {@code --debug} was present
   */
  public boolean verbose() {
    return flags.contains(Flag.VERBOSE);
  }

  /**
   * Indicates whether the command should print its plan instead of running.
   *
   * @return {@code true} when {@code --dry-run} or {@code -n} was present
   */
  public boolean dryRun() {
    return flags.contains(Flag.DRY_RUN);
  }

  /**
   * Returns dash-prefixed words that are not podflow flags, as typed.
   *
   * @return unknown flags in command-line order
   */
  public List<String> unknownFlags() {
    return unknownFlags;
  }
}
