package easy;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

public class CompilerTest {

  private static String source(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  private static CompiledProgram compile(String... lines) throws CompilerException {
    return new Compiler().compile(source(lines));
  }

  private static ImmutableList<String> body(String... lines) throws CompilerException {
    return compile(lines).bodyLines();
  }

  private static CompilerException failure(String... lines) {
    return assertThrows(CompilerException.class, () -> compile(lines));
  }

  private static final String[] SAMPLE = {
    "# Guessing game",
    "storage number secret = random number 1 to 10",
    "storage text name = text player one",
    "storage boolean won = false",
    "storage array guesses = createarray 3 5 7",
    "for 1 to 3 do",
    "  if guesses[i - 1] == secret is true",
    "    won = true",
    "    print concat text winner name",
    "  end",
    "  guesses append value i",
    "end",
    "while won is false do",
    "  won = true",
    "end",
    "print storage won",
  };

  @Test
  public void emptyProgram() throws CompilerException {
    CompiledProgram program = compile("", "# nothing here", "   ");

    assertThat(program.bodyLines()).isEmpty();
    assertThat(program.text())
        .isEqualTo("import math\nimport sys\nimport datetime\nimport os");
  }

  @Test
  public void declarationAndPrint() throws CompilerException {
    assertThat(body("storage number x = 5", "print storage x"))
        .containsExactly("x = int(5)", "print(x)")
        .inOrder();
  }

  @Test
  public void deterministic() throws CompilerException {
    assertThat(compile(SAMPLE).text()).isEqualTo(compile(SAMPLE).text());
  }

  @Test
  public void sampleProgram() throws CompilerException {
    CompiledProgram program = compile(SAMPLE);

    assertThat(program.usesRandom()).isTrue();
    assertThat(program.headerLines())
        .containsExactly(
            "import math", "import sys", "import datetime", "import os", "import random")
        .inOrder();
    assertThat(program.bodyLines())
        .containsExactly(
            "secret = int(random.randint(1, 10))",
            "name = \"player one\"",
            "won = False",
            "guesses = [3, 5, 7]",
            "for i in range(1, 3 + 1):",
            "    if guesses[i - 1] == secret:",
            "        won = True",
            "        print(\"\".join([str(\"winner\"), str(name)]))",
            "    guesses.append(i)",
            "while won is False:",
            "    won = True",
            "print(won)")
        .inOrder();
  }

  @Test
  public void ifBlocks() throws CompilerException {
    assertThat(body("if x is true", "print text yes", "end"))
        .containsExactly("if x:", "    print(\"yes\")")
        .inOrder();
    assertThat(body("if x > 1 is false", "end")).containsExactly("if not (x > 1):");
    assertThat(body("if done == true:", "end")).containsExactly("if done == True:");
    assertThat(body("if name == text bob", "end")).containsExactly("if name == \"bob\":");
  }

  @Test
  public void loops() throws CompilerException {
    assertThat(body("for 1 to 3 do", "print storage i", "end"))
        .containsExactly("for i in range(1, 3 + 1):", "    print(i)")
        .inOrder();
    assertThat(body("while n < 10 do", "n = n + 1", "end"))
        .containsExactly("while n < 10:", "    n = n + 1")
        .inOrder();
  }

  @Test
  public void nestedIndentation() throws CompilerException {
    assertThat(body("while running", "if x", "for 1 to n do", "print i", "end", "end", "end"))
        .containsExactly(
            "while running:",
            "    if x:",
            "        for i in range(1, n + 1):",
            "            print(i)")
        .inOrder();
  }

  @Test
  public void indentWidthOption() throws CompilerException {
    Compiler compiler = new Compiler(CompilerOptions.builder().setIndentWidth(2).build());

    assertThat(compiler.compile(source("if x", "print x", "end")).bodyLines())
        .containsExactly("if x:", "  print(x)")
        .inOrder();
  }

  @Test
  public void unmatchedEnd() {
    CompilerException ex = failure("print text hi", "end");

    assertThat(ex.kind()).isEqualTo(ErrorKind.UNMATCHED_BLOCK_END);
    assertThat(ex.lineNumber()).isEqualTo(2);
    assertThat(ex.kind().category()).isEqualTo(ErrorKind.Category.STRUCTURAL);
  }

  @Test
  public void unclosedBlock() {
    CompilerException ex = failure("print text a", "if x", "print x", "", "# trailing comment");

    assertThat(ex.kind()).isEqualTo(ErrorKind.UNCLOSED_BLOCK);
    assertThat(ex.lineNumber()).isEqualTo(3);
    assertThat(ex.sourceText()).isEqualTo("print x");
  }

  @Test
  public void unknownCommand() {
    CompilerException ex = failure("print text ok", "frobnicate now  # later");

    assertThat(ex.kind()).isEqualTo(ErrorKind.UNKNOWN_COMMAND);
    assertThat(ex.lineNumber()).isEqualTo(2);
    assertThat(ex.sourceText()).isEqualTo("frobnicate now  # later");
    assertThat(ex.format())
        .isEqualTo(
            "ERROR: line 2: 'frobnicate now  # later' -> Unknown command: 'frobnicate now'");
  }

  @Test
  public void shorthands() throws CompilerException {
    assertThat(body("clear screen", "exit program", "end program"))
        .containsExactly(
            "os.system(\"cls\" if (os.name == \"nt\") else \"clear\")",
            "sys.exit()",
            "sys.exit()")
        .inOrder();
    assertThat(body("items append value 3", "items reverse"))
        .containsExactly("items.append(3)", "items[::-1]")
        .inOrder();

    CompilerException ex = failure("clear everything");
    assertThat(ex.kind()).isEqualTo(ErrorKind.UNKNOWN_COMMAND);
    assertThat(ex.errorMsg()).endsWith("Did you mean 'clear screen'?");
    assertThat(failure("exit now").errorMsg()).endsWith("Did you mean 'exit program'?");
  }

  @Test
  public void endProgramIsCaseInsensitive() throws CompilerException {
    assertThat(body("if x", "END PROGRAM", "End")).containsExactly("if x:", "    sys.exit()");
  }

  @Test
  public void assignments() throws CompilerException {
    assertThat(
            body(
                "x = x + 1",
                "done = true",
                "items[0] = text hi there",
                "scores[name] = 10",
                "m[d[0]] = 1",
                "grid[row][col] = 0",
                "player.score = lengthof items"))
        .containsExactly(
            "x = x + 1",
            "done = True",
            "items[0] = \"hi there\"",
            "scores[name] = 10",
            "m[d[0]] = 1",
            "grid[row][col] = 0",
            "player.score = len(items)")
        .inOrder();

    assertThat(failure("x == 1").kind()).isEqualTo(ErrorKind.UNKNOWN_COMMAND);
    assertThat(failure("x =").kind()).isEqualTo(ErrorKind.MISSING_VALUE);
    assertThat(failure("storage number n = sqrt").kind()).isEqualTo(ErrorKind.ARITY_ERROR);
  }

  @Test
  public void assignmentTargets() {
    assertThat(StatementCompiler.isAssignmentTarget("m[d[0]]")).isTrue();
    assertThat(StatementCompiler.isAssignmentTarget("player.scores[i + 1]")).isTrue();
    assertThat(StatementCompiler.isAssignmentTarget("m[]")).isFalse();
    assertThat(StatementCompiler.isAssignmentTarget("m[d[0]")).isFalse();
    assertThat(StatementCompiler.isAssignmentTarget("m[0] x")).isFalse();
    assertThat(StatementCompiler.isAssignmentTarget("concat a")).isFalse();
  }

  @Test
  public void printForms() throws CompilerException {
    assertThat(
            body(
                "print text hello world",
                "print text \"quoted\"",
                "print currentdate",
                "print lengthof",
                "print x + 1",
                "print flag == true",
                "print uppercase name",
                "print random boolean"))
        .containsExactly(
            "print(\"hello world\")",
            "print(\"quoted\")",
            "print(datetime.datetime.now().strftime(\"%Y-%m-%d\"))",
            "print(lengthof)",
            "print(x + 1)",
            "print(flag == True)",
            "print(name.upper())",
            "print(random.choice([True, False]))")
        .inOrder();
  }

  @Test
  public void printKeepsQuotedTextVerbatim() throws CompilerException {
    assertThat(body("print \"a  true\" + label"))
        .containsExactly("print(\"a  true\" + label)");
  }

  @Test
  public void grammarErrors() {
    assertThat(failure("print").kind()).isEqualTo(ErrorKind.EMPTY_PRINT_EXPRESSION);
    assertThat(failure("if").kind()).isEqualTo(ErrorKind.EMPTY_CONDITION);
    assertThat(failure("if is true").kind()).isEqualTo(ErrorKind.EMPTY_CONDITION);
    assertThat(failure("while do").kind()).isEqualTo(ErrorKind.EMPTY_CONDITION);
    assertThat(failure("if name == text").kind()).isEqualTo(ErrorKind.MALFORMED_CONDITION);
    assertThat(failure("for 1 to 3").kind()).isEqualTo(ErrorKind.MALFORMED_FOR_LOOP);
    assertThat(failure("for 1 until 3 do").errorMsg())
        .isEqualTo("Invalid for loop syntax. Expected: for <start> to <end> do");
  }

  @Test
  public void declarationErrors() {
    assertThat(failure("storage number x").kind()).isEqualTo(ErrorKind.INCOMPLETE_DECLARATION);
    assertThat(failure("storage number 1x = 5").kind()).isEqualTo(ErrorKind.INVALID_IDENTIFIER);
    assertThat(failure("storage number x 5 6").kind()).isEqualTo(ErrorKind.MISSING_ASSIGNMENT);
    assertThat(failure("storage number x =").kind()).isEqualTo(ErrorKind.MISSING_VALUE);
    assertThat(failure("storage boolean b = maybe").kind())
        .isEqualTo(ErrorKind.INVALID_BOOLEAN_LITERAL);

    CompilerException unknownType = failure("storage money x = 5");
    assertThat(unknownType.kind()).isEqualTo(ErrorKind.UNKNOWN_TYPE);
    assertThat(unknownType.errorMsg())
        .contains("number, integer, float, text, boolean, array, dictionary");
  }

  @Test
  public void storageTypeIsCaseInsensitive() throws CompilerException {
    assertThat(body("storage FLOAT ratio = 1")).containsExactly("ratio = float(1)");
  }

  @Test
  public void dictionaryOrder() throws CompilerException {
    assertThat(body("storage dictionary d = createdictionary key a value 1 key b value 2"))
        .containsExactly("d = {\"a\": \"1\", \"b\": \"2\"}");
    assertThat(
            body(
                "setvalueindictionary dictionary d key k value 5",
                "removekeyfromdictionary d key k"))
        .containsExactly("d[k] = 5", "del d[k]")
        .inOrder();
  }

  @Test
  public void randomHeaderOnlyWhenUsed() throws CompilerException {
    assertThat(compile("print text hi").usesRandom()).isFalse();
    assertThat(compile("print text hi").headerLines()).doesNotContain("import random");
    assertThat(compile("storage number roll = random number 1 to 6").usesRandom()).isTrue();
  }

  @Test
  public void failedCompilationReturnsNothingPartial() {
    CompilerException ex = failure("print text fine", "storage number x = 1", "bogus");

    assertThat(ex.lineNumber()).isEqualTo(3);
    assertThat(ex.kind().category()).isEqualTo(ErrorKind.Category.UNKNOWN);
  }

  @Test
  public void coreProfileRejectsExtendedBuiltins() throws CompilerException {
    Compiler core = new Compiler(CompilerOptions.builder().setProfile(Profile.CORE).build());

    assertThat(core.compile("print sqrt 9").bodyLines()).containsExactly("print(math.sqrt(9))");

    CompilerException ex =
        assertThrows(CompilerException.class, () -> core.compile("readfile file data.txt"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.UNKNOWN_FUNCTION);

    ex = assertThrows(CompilerException.class, () -> core.compile("print logicaland a b"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.UNKNOWN_FUNCTION);

    ex = assertThrows(CompilerException.class, () -> core.compile("items append value 1"));
    assertThat(ex.kind()).isEqualTo(ErrorKind.UNKNOWN_FUNCTION);
  }

  @Test
  public void concurrentCompilations() throws Exception {
    Compiler compiler = new Compiler();
    String expected = compiler.compile(source(SAMPLE)).text();

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        results.add(executor.submit(() -> compiler.compile(source(SAMPLE)).text()));
      }
      for (Future<String> result : results) {
        assertThat(result.get()).isEqualTo(expected);
      }
    } finally {
      executor.shutdown();
      executor.awaitTermination(10, TimeUnit.SECONDS);
    }
  }
}
