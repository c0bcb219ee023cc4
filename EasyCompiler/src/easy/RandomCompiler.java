package easy;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Compiles {@code random number <min> to <max>}, {@code random text <a>, <b>, ...} and
 * {@code random boolean}. Every successful compilation records that the program needs the
 * random module.
 */
class RandomCompiler {
  public static final String KEYWORD = "random";

  private static final Splitter OPTIONS = Splitter.on(',').trimResults();

  private final CompilationContext context;

  RandomCompiler(CompilationContext context) {
    this.context = context;
  }

  PyExpr compile(List<String> tokens) throws SyntaxException {
    PyExpr expr = compileImpl(tokens);
    context.markRandomUsed();
    return expr;
  }

  private static PyExpr compileImpl(List<String> tokens) throws SyntaxException {
    if (tokens.size() < 2) {
      throw new SyntaxException(
          ErrorKind.UNKNOWN_RANDOM_TYPE,
          "Missing random type. Expected 'number', 'text', or 'boolean'.");
    }

    switch (tokens.get(1)) {
      case "number":
        if (tokens.size() != 5 || !tokens.get(3).equals("to")) {
          throw new SyntaxException(
              ErrorKind.MALFORMED_BUILTIN_CALL,
              "random number syntax: random number <min> to <max>");
        }
        return PyExpr.call(
            "random.randint",
            BuiltinCall.operand(tokens.get(2)),
            BuiltinCall.operand(tokens.get(4)));
      case "text":
        {
          List<String> options =
              OPTIONS.splitToList(Tokens.join(tokens.subList(2, tokens.size())));
          if (tokens.size() == 2 || options.stream().anyMatch(String::isEmpty)) {
            throw new SyntaxException(
                ErrorKind.MALFORMED_BUILTIN_CALL,
                "random text syntax: random text <option>, <option>, ...");
          }
          ImmutableList<PyExpr> choices =
              options.stream().map(PyExpr::string).collect(ImmutableList.toImmutableList());
          return PyExpr.call("random.choice", PyExpr.list(choices));
        }
      case "boolean":
        if (tokens.size() != 2) {
          throw new SyntaxException(
              ErrorKind.MALFORMED_BUILTIN_CALL, "random boolean syntax: random boolean");
        }
        return PyExpr.call(
            "random.choice", PyExpr.list(PyExpr.bool(true), PyExpr.bool(false)));
      default:
        throw new SyntaxException(
            ErrorKind.UNKNOWN_RANDOM_TYPE,
            "Unknown random type: %s. Expected 'number', 'text', or 'boolean'.",
            tokens.get(1));
    }
  }
}
