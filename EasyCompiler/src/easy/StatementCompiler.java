package easy;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;

/**
 * Classifies one source line and emits its translation into the {@link CompilationContext}.
 * Block statements adjust the context's depth; everything else emits a single line.
 */
class StatementCompiler {
  private static final String END = "end";
  private static final String PROGRAM = "program";
  private static final String STORAGE = "storage";

  // Identifier or dotted path; any subscripts after it are checked by isAssignmentTarget.
  private static final Pattern TARGET_NAME =
      Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}_][\\p{L}\\p{N}_]*)*");

  private final CompilationContext context;
  private final BuiltinCompiler builtins;
  private final RandomCompiler random;
  private final ValueCompiler values;

  StatementCompiler(CompilationContext context) {
    this.context = context;
    this.builtins = new BuiltinCompiler(context.profile());
    this.random = new RandomCompiler(context);
    this.values = new ValueCompiler(builtins, random);
  }

  void compile(SourceLine line) throws SyntaxException {
    ImmutableList<String> tokens = line.tokens();
    if (tokens.size() == 2
        && Ascii.equalsIgnoreCase(tokens.get(0), END)
        && Ascii.equalsIgnoreCase(tokens.get(1), PROGRAM)) {
      context.emit(PyStmt.expression(BuiltinEmitters.exit()));
      return;
    }
    if (tokens.size() == 1 && Ascii.equalsIgnoreCase(tokens.get(0), END)) {
      context.closeBlock();
      return;
    }

    switch (line.firstToken()) {
      case "if":
        compileIf(tokens);
        return;
      case "while":
        compileWhile(tokens);
        return;
      case "for":
        compileFor(tokens);
        return;
      case "print":
        compilePrint(line);
        return;
      case STORAGE:
        compileDeclaration(tokens);
        return;
      default:
        break;
    }

    if (!compileAssignment(line.normalizedText())) {
      compileCall(line);
    }
  }

  private void compileIf(List<String> tokens) throws SyntaxException {
    List<String> condition = stripTrailingColon(tokens.subList(1, tokens.size()));
    if (condition.isEmpty()) {
      throw new SyntaxException(ErrorKind.EMPTY_CONDITION, "Missing condition in if statement.");
    }

    boolean negate = false;
    int size = condition.size();
    if (size >= 2 && condition.get(size - 2).equals("is")) {
      String truth = condition.get(size - 1);
      if (truth.equals("true") || truth.equals("false")) {
        condition = condition.subList(0, size - 2);
        negate = truth.equals("false");
        if (condition.isEmpty()) {
          throw new SyntaxException(
              ErrorKind.EMPTY_CONDITION, "Empty condition before 'is %s'.", truth);
        }
      }
    }

    PyExpr expr = conditionExpr(condition);
    context.emit(PyStmt.ifStmt(negate ? PyExpr.not(expr) : expr));
  }

  private static List<String> stripTrailingColon(List<String> tokens) {
    if (tokens.isEmpty()) return tokens;

    String last = tokens.get(tokens.size() - 1);
    if (!last.endsWith(":")) return tokens;

    ImmutableList.Builder<String> stripped = ImmutableList.builder();
    stripped.addAll(tokens.subList(0, tokens.size() - 1));
    if (last.length() > 1) stripped.add(last.substring(0, last.length() - 1));
    return stripped.build();
  }

  private void compileWhile(List<String> tokens) throws SyntaxException {
    List<String> condition = tokens.subList(1, tokens.size());
    if (!condition.isEmpty() && condition.get(condition.size() - 1).equals("do")) {
      condition = condition.subList(0, condition.size() - 1);
    }
    if (condition.isEmpty()) {
      throw new SyntaxException(ErrorKind.EMPTY_CONDITION, "Missing condition in while loop.");
    }
    context.emit(PyStmt.whileStmt(conditionExpr(condition)));
  }

  // Booleans become host literals and 'text <word>' a quoted string.
  private static PyExpr conditionExpr(List<String> tokens) throws SyntaxException {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (token.equals(BuiltinCall.TEXT)) {
        if (i + 1 == tokens.size()) {
          throw new SyntaxException(
              ErrorKind.MALFORMED_CONDITION, "Expected literal after 'text' in condition");
        }
        parts.add(PythonPrinter.quote(tokens.get(++i)));
      } else {
        parts.add(Tokens.normalizeBoolean(token));
      }
    }
    return PyExpr.raw(Tokens.join(parts.build()));
  }

  private void compileFor(List<String> tokens) throws SyntaxException {
    if (tokens.size() != 5 || !tokens.get(2).equals("to") || !tokens.get(4).equals("do")) {
      throw new SyntaxException(
          ErrorKind.MALFORMED_FOR_LOOP,
          "Invalid for loop syntax. Expected: for <start> to <end> do");
    }
    context.emit(
        PyStmt.forRange(
            "i", BuiltinCall.operand(tokens.get(1)), BuiltinCall.operand(tokens.get(3))));
  }

  private void compilePrint(SourceLine line) throws SyntaxException {
    List<String> rest = line.tokens().subList(1, line.tokens().size());
    if (rest.isEmpty()) {
      throw new SyntaxException(
          ErrorKind.EMPTY_PRINT_EXPRESSION, "Missing expression in print command.");
    }
    context.emit(PyStmt.print(printedValue(line, rest)));
  }

  private PyExpr printedValue(SourceLine line, List<String> rest) throws SyntaxException {
    String first = rest.get(0);
    Optional<Builtin> builtin = Builtin.forName(first);
    if (rest.size() == 1) {
      // A single token is a variable, unless it names a builtin that needs no arguments.
      if (builtin.isPresent() && builtin.get().takesNoArguments()) {
        return builtins.compileExpression(rest);
      }
      return PyExpr.raw(Tokens.normalizeBoolean(first));
    }

    if (first.equals(RandomCompiler.KEYWORD)) {
      return random.compile(rest);
    } else if (builtin.isPresent()) {
      return builtins.compileExpression(rest);
    } else if (first.equals(BuiltinCall.TEXT)) {
      return BuiltinCall.textLiteral(rest.subList(1, rest.size()));
    } else if (first.equals(STORAGE)) {
      return PyExpr.raw(Tokens.join(rest.subList(1, rest.size())));
    }

    String remainder = line.normalizedText().substring(line.firstToken().length()).trim();
    return PyExpr.raw(Tokens.normalizeBooleansInText(remainder));
  }

  private void compileDeclaration(List<String> tokens) throws SyntaxException {
    List<String> parts = tokens.subList(1, tokens.size());
    if (parts.size() < 3) {
      throw new SyntaxException(
          ErrorKind.INCOMPLETE_DECLARATION,
          "Incomplete 'storage' command. Expected: 'storage <type> <variable> = <value>'");
    }

    Optional<StorageType> type = StorageType.parse(parts.get(0));
    if (!type.isPresent()) {
      throw new SyntaxException(
          ErrorKind.UNKNOWN_TYPE,
          "Invalid storage type '%s'. Allowed types are: %s.",
          parts.get(0),
          StorageType.allowedTypes());
    }

    String name = parts.get(1);
    if (!Tokens.isIdentifier(name)) {
      throw new SyntaxException(
          ErrorKind.INVALID_IDENTIFIER,
          "Invalid variable name '%s'. Variable names must start with a letter or underscore,"
              + " followed by letters, numbers, or underscores.",
          name);
    }
    if (!parts.get(2).equals("=")) {
      throw new SyntaxException(
          ErrorKind.MISSING_ASSIGNMENT,
          "Syntax error in 'storage' command: Missing '='. The correct format is"
              + " 'storage <type> <variable> = <value>'.");
    }

    List<String> valueTokens = parts.subList(3, parts.size());
    if (valueTokens.isEmpty()) {
      throw new SyntaxException(
          ErrorKind.MISSING_VALUE,
          "Missing value expression after '=' in 'storage' command. For example:"
              + " 'storage number myVar = 10'.");
    }
    context.emit(
        PyStmt.assign(PyExpr.name(name), values.compileDeclared(type.get(), valueTokens)));
  }

  /** Returns false if the line is not an assignment. */
  private boolean compileAssignment(String text) throws SyntaxException {
    int index = assignmentOperator(text);
    if (index < 0) return false;

    String target = text.substring(0, index).trim();
    if (!isAssignmentTarget(target)) return false;

    ImmutableList<String> valueTokens = Tokens.split(text.substring(index + 1));
    if (valueTokens.isEmpty()) {
      throw new SyntaxException(
          ErrorKind.MISSING_VALUE, "Missing value expression after '=' in assignment.");
    }
    context.emit(PyStmt.assign(PyExpr.raw(target), values.compileUntyped(valueTokens)));
    return true;
  }

  /** A name, optionally followed by non-empty subscripts whose brackets may nest. */
  static boolean isAssignmentTarget(String target) {
    Matcher name = TARGET_NAME.matcher(target);
    if (!name.lookingAt()) return false;

    int depth = 0;
    for (int i = name.end(); i < target.length(); i++) {
      char ch = target.charAt(i);
      if (ch == '[') {
        if (depth == 0 && i + 1 < target.length() && target.charAt(i + 1) == ']') return false;
        depth++;
      } else if (ch == ']') {
        if (depth == 0) return false;
        depth--;
      } else if (depth == 0) {
        return false;
      }
    }
    return depth == 0;
  }

  // Index of the first '=' outside quotes that is not part of ==, <=, >= or !=.
  private static int assignmentOperator(String text) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
      } else if (ch == '"' || ch == '\'') {
        quote = ch;
      } else if (ch == '=') {
        char prev = i > 0 ? text.charAt(i - 1) : ' ';
        char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
        if (next == '=') {
          i++;
        } else if ("<>!=".indexOf(prev) < 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private void compileCall(SourceLine line) throws SyntaxException {
    ImmutableList<String> tokens = line.tokens();
    String first = tokens.get(0);
    String second = tokens.size() > 1 ? tokens.get(1) : "";

    Optional<Builtin> listOperation = Builtin.forName(second).filter(Builtin::isListOperation);
    if (listOperation.isPresent()) {
      ImmutableList<String> rewritten =
          ImmutableList.<String>builder()
              .add(second, "array", first)
              .addAll(tokens.subList(2, tokens.size()))
              .build();
      context.emit(builtins.compileStatement(rewritten));
    } else if (builtins.isBuiltin(first)) {
      context.emit(builtins.compileStatement(tokens));
    } else if (first.equals(RandomCompiler.KEYWORD)) {
      context.emit(PyStmt.expression(random.compile(tokens)));
    } else if (first.equals("clear")) {
      shorthand(line, "screen", Builtin.CLEARSCREEN);
    } else if (first.equals("exit")) {
      shorthand(line, PROGRAM, Builtin.EXITPROGRAM);
    } else {
      throw new SyntaxException(
          ErrorKind.UNKNOWN_COMMAND, "Unknown command: '%s'", line.normalizedText());
    }
  }

  private void shorthand(SourceLine line, String word, Builtin builtin) throws SyntaxException {
    ImmutableList<String> tokens = line.tokens();
    if (tokens.size() != 2 || !tokens.get(1).equals(word)) {
      throw new SyntaxException(
          ErrorKind.UNKNOWN_COMMAND,
          "Unknown command: '%s'. Did you mean '%s %s'?",
          line.normalizedText(),
          tokens.get(0),
          word);
    }
    context.emit(builtins.compileStatement(ImmutableList.of(builtin.sourceName())));
  }
}
