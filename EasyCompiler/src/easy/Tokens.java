package easy;

import java.util.List;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Token-level helpers shared by the statement and builtin compilers. */
public final class Tokens {
  private static final Splitter WHITESPACE =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Joiner SPACE = Joiner.on(' ');

  public static final String TRUE = "True";
  public static final String FALSE = "False";

  public static ImmutableList<String> split(String text) {
    return ImmutableList.copyOf(WHITESPACE.split(text));
  }

  public static String join(List<String> tokens) {
    return SPACE.join(tokens);
  }

  public static boolean isBooleanLiteral(String token) {
    return Ascii.equalsIgnoreCase(token, "true") || Ascii.equalsIgnoreCase(token, "false");
  }

  // true/false in any case become the host language's boolean literals.
  public static String normalizeBoolean(String token) {
    if (Ascii.equalsIgnoreCase(token, "true")) return TRUE;
    if (Ascii.equalsIgnoreCase(token, "false")) return FALSE;
    return token;
  }

  public static ImmutableList<String> normalizeBooleans(List<String> tokens) {
    return tokens.stream().map(Tokens::normalizeBoolean).collect(ImmutableList.toImmutableList());
  }

  /** Normalizes boolean words in free text, leaving quoted regions untouched. */
  public static String normalizeBooleansInText(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char ch = text.charAt(i);
      int end;
      if (ch == '"' || ch == '\'') {
        int close = text.indexOf(ch, i + 1);
        end = close < 0 ? text.length() : close + 1;
        out.append(text, i, end);
      } else if (isWordChar(ch)) {
        end = i;
        while (end < text.length() && isWordChar(text.charAt(end))) end++;
        out.append(normalizeBoolean(text.substring(i, end)));
      } else {
        end = i + 1;
        out.append(ch);
      }
      i = end;
    }
    return out.toString();
  }

  private static boolean isWordChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_';
  }

  public static boolean isQuoted(String text) {
    return text.length() >= 2
        && ((text.startsWith("\"") && text.endsWith("\""))
            || (text.startsWith("'") && text.endsWith("'")));
  }

  public static boolean isIdentifier(String name) {
    if (name.isEmpty()) return false;
    for (int i = 0; i < name.length(); i++) {
      char ch = name.charAt(i);
      if (Character.isLetter(ch) || ch == '_' || (i > 0 && Character.isDigit(ch))) continue;
      return false;
    }
    return true;
  }

  private Tokens() {}
}
