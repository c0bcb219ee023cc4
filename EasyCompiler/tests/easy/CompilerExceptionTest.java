package easy;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class CompilerExceptionTest {

  private static final SourceLine LINE =
      SourceLine.create(7, "print x  # debug", "print x");

  @Test
  public void internalKeepsPositionAndCause() {
    IllegalStateException cause = new IllegalStateException("boom");

    CompilerException ex = CompilerException.internal(LINE, cause);

    assertThat(ex.kind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
    assertThat(ex.kind().category()).isEqualTo(ErrorKind.Category.INTERNAL);
    assertThat(ex.lineNumber()).isEqualTo(7);
    assertThat(ex.sourceText()).isEqualTo("print x  # debug");
    assertThat(ex).hasCauseThat().isSameInstanceAs(cause);
    assertThat(ex.format()).isEqualTo("ERROR: line 7: 'print x  # debug' -> boom");
  }

  @Test
  public void atCopiesKindAndMessage() {
    SyntaxException syntax =
        new SyntaxException(ErrorKind.MISSING_VALUE, "Missing value for '%s'", "x");

    CompilerException ex = CompilerException.at(LINE, syntax);

    assertThat(ex.kind()).isEqualTo(ErrorKind.MISSING_VALUE);
    assertThat(ex.errorMsg()).isEqualTo("Missing value for 'x'");
    assertThat(ex.lineNumber()).isEqualTo(7);
  }
}
