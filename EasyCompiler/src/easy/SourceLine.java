package easy;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** One non-blank statement line with its comment removed. */
@AutoValue
public abstract class SourceLine {
  /** 1-based physical line number. */
  public abstract int lineNumber();

  /** The line exactly as written, used for diagnostics. */
  public abstract String rawText();

  /** Comment-stripped, trimmed text. Never empty. */
  public abstract String normalizedText();

  public abstract ImmutableList<String> tokens();

  public String firstToken() {
    return tokens().get(0);
  }

  public static SourceLine create(int lineNumber, String rawText, String normalizedText) {
    return new AutoValue_SourceLine(
        lineNumber, rawText, normalizedText, Tokens.split(normalizedText));
  }
}
