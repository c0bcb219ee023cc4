package easy;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Ascii;

/** Which builtins a compilation accepts. */
public enum Profile {
  /** Every registered builtin. */
  FULL,

  /**
   * The reduced builtin set: no file access, no introspection, no keyword-framed
   * text/list/dictionary operations and no logical-operator builtins.
   */
  CORE;

  public String flagName() {
    return Ascii.toLowerCase(name());
  }

  public static Optional<Profile> parse(String name) {
    return Arrays.stream(values())
        .filter(p -> p.flagName().equals(Ascii.toLowerCase(name)))
        .findFirst();
  }
}
