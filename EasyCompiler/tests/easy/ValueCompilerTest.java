package easy;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ValueCompilerTest {

  private final CompilationContext context = new CompilationContext(CompilerOptions.defaults());
  private final ValueCompiler values =
      new ValueCompiler(new BuiltinCompiler(Profile.FULL), new RandomCompiler(context));

  private String declared(StorageType type, String value) throws SyntaxException {
    return PythonPrinter.print(values.compileDeclared(type, Tokens.split(value)));
  }

  private String untyped(String value) throws SyntaxException {
    return PythonPrinter.print(values.compileUntyped(Tokens.split(value)));
  }

  @Test
  public void numericCoercion() throws SyntaxException {
    assertThat(declared(StorageType.NUMBER, "5")).isEqualTo("int(5)");
    assertThat(declared(StorageType.INTEGER, "x - 1")).isEqualTo("int(x - 1)");
    assertThat(declared(StorageType.FLOAT, "x + 1")).isEqualTo("float(x + 1)");
  }

  @Test
  public void text() throws SyntaxException {
    assertThat(declared(StorageType.TEXT, "hello world")).isEqualTo("\"hello world\"");
    assertThat(declared(StorageType.TEXT, "'quoted'")).isEqualTo("'quoted'");
    assertThat(declared(StorageType.TEXT, "text hi there")).isEqualTo("\"hi there\"");
    assertThat(declared(StorageType.TEXT, "text")).isEqualTo("\"\"");
  }

  @Test
  public void booleans() throws SyntaxException {
    assertThat(declared(StorageType.BOOLEAN, "TRUE")).isEqualTo("True");
    assertThat(declared(StorageType.BOOLEAN, "false")).isEqualTo("False");

    SyntaxException ex =
        assertThrows(SyntaxException.class, () -> declared(StorageType.BOOLEAN, "maybe"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.INVALID_BOOLEAN_LITERAL);
    assertThat(ex).hasMessageThat().contains("'maybe'");
  }

  @Test
  public void builtinValues() throws SyntaxException {
    assertThat(declared(StorageType.ARRAY, "createarray 1 2 true")).isEqualTo("[1, 2, True]");
    assertThat(declared(StorageType.NUMBER, "lengthof items")).isEqualTo("int(len(items))");
    assertThat(untyped("currentdate"))
        .isEqualTo("datetime.datetime.now().strftime(\"%Y-%m-%d\")");
  }

  @Test
  public void loneBuiltinNameNeedsArguments() {
    SyntaxException ex =
        assertThrows(SyntaxException.class, () -> declared(StorageType.NUMBER, "sqrt"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.ARITY_ERROR);

    ex = assertThrows(SyntaxException.class, () -> untyped("lengthof"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.ARITY_ERROR);
  }

  @Test
  public void textStorageNormalizesBooleans() throws SyntaxException {
    assertThat(declared(StorageType.TEXT, "true")).isEqualTo("\"True\"");
    assertThat(declared(StorageType.TEXT, "it is false")).isEqualTo("\"it is False\"");
  }

  @Test
  public void randomValuesMarkContext() throws SyntaxException {
    assertThat(context.randomUsed()).isFalse();
    assertThat(declared(StorageType.NUMBER, "random number 1 to 6"))
        .isEqualTo("int(random.randint(1, 6))");
    assertThat(context.randomUsed()).isTrue();
  }

  @Test
  public void untypedPassesThrough() throws SyntaxException {
    assertThat(untyped("flag == true")).isEqualTo("flag == True");
    assertThat(untyped("text hi")).isEqualTo("\"hi\"");
  }

  @Test
  public void statementBuiltinIsNotAValue() {
    SyntaxException ex =
        assertThrows(
            SyntaxException.class, () -> untyped("removekeyfromdictionary dictionary d key k"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.MALFORMED_BUILTIN_CALL);
  }
}
