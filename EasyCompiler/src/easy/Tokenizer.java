package easy;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits source text into {@link SourceLine}s. Comments run from the first unquoted,
 * unescaped {@code #} to the end of the line; lines left blank are dropped.
 */
public class Tokenizer {
  public static final char COMMENT = '#';
  private static final char ESCAPE = '\\';

  private final ImmutableList<String> lines;

  public Tokenizer(String content) {
    this.lines = ImmutableList.copyOf(Splitter.on('\n').split(content));
  }

  public ImmutableList<SourceLine> tokenize() {
    ImmutableList.Builder<SourceLine> builder = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      String raw = lines.get(i);
      if (raw.endsWith("\r")) raw = raw.substring(0, raw.length() - 1);

      String normalized = stripComment(raw).trim();
      if (normalized.isEmpty()) continue;

      builder.add(SourceLine.create(i + 1, raw, normalized));
    }
    return builder.build();
  }

  static String stripComment(String line) {
    StringBuilder out = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char ch = line.charAt(i);
      if (quote != 0) {
        out.append(ch);
        if (ch == ESCAPE && i + 1 < line.length()) {
          out.append(line.charAt(++i));
        } else if (ch == quote) {
          quote = 0;
        }
        continue;
      }

      if (ch == ESCAPE && i + 1 < line.length() && line.charAt(i + 1) == COMMENT) {
        out.append(COMMENT);
        i++;
      } else if (ch == COMMENT) {
        break;
      } else {
        if ((ch == '"' || ch == '\'') && opensToken(line, i)) quote = ch;
        out.append(ch);
      }
    }
    return out.toString();
  }

  // A quote only starts a string at the beginning of a token, so "don't" stays plain text.
  private static boolean opensToken(String line, int index) {
    if (index == 0) return true;
    char prev = line.charAt(index - 1);
    return Character.isWhitespace(prev) || "([{,=".indexOf(prev) >= 0;
  }
}
