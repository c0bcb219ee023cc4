package easy;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class RandomCompilerTest {

  private final CompilationContext context = new CompilationContext(CompilerOptions.defaults());
  private final RandomCompiler random = new RandomCompiler(context);

  private String compile(String expression) throws SyntaxException {
    return PythonPrinter.print(random.compile(Tokens.split(expression)));
  }

  private ErrorKind failure(String expression) {
    return assertThrows(SyntaxException.class, () -> compile(expression)).kind();
  }

  @Test
  public void number() throws SyntaxException {
    assertThat(compile("random number 1 to 10")).isEqualTo("random.randint(1, 10)");
    assertThat(context.randomUsed()).isTrue();
  }

  @Test
  public void text() throws SyntaxException {
    assertThat(compile("random text red, green, light blue"))
        .isEqualTo("random.choice([\"red\", \"green\", \"light blue\"])");
  }

  @Test
  public void booleanChoice() throws SyntaxException {
    assertThat(compile("random boolean")).isEqualTo("random.choice([True, False])");
    assertThat(compile("random boolean")).isEqualTo(compile("random boolean"));
  }

  @Test
  public void unknownType() {
    assertThat(failure("random")).isEqualTo(ErrorKind.UNKNOWN_RANDOM_TYPE);
    assertThat(failure("random color")).isEqualTo(ErrorKind.UNKNOWN_RANDOM_TYPE);
    assertThat(context.randomUsed()).isFalse();
  }

  @Test
  public void malformed() {
    assertThat(failure("random number 1 10")).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
    assertThat(failure("random number 1 to")).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
    assertThat(failure("random text")).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
    assertThat(failure("random text a,,b")).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
    assertThat(failure("random boolean please")).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
    assertThat(context.randomUsed()).isFalse();
  }
}
