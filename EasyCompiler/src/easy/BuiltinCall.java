package easy;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The tokens of one builtin invocation, with the shape checks shared by the emitters. Argument
 * indices exclude the builtin name.
 */
public final class BuiltinCall {
  public static final String TEXT = "text";

  private final String name;
  private final ImmutableList<String> args;
  private final BuiltinCompiler compiler;

  BuiltinCall(String name, List<String> args, BuiltinCompiler compiler) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
    this.compiler = compiler;
  }

  public String name() {
    return name;
  }

  public ImmutableList<String> args() {
    return args;
  }

  public int numArgs() {
    return args.size();
  }

  public String arg(int index) {
    return args.get(index);
  }

  public boolean argIs(int index, String keyword) {
    return index < args.size() && args.get(index).equals(keyword);
  }

  public String joinedArgs() {
    return Tokens.join(args);
  }

  /** The compiler this call is part of, for builtins whose arguments nest other builtins. */
  public BuiltinCompiler compiler() {
    return compiler;
  }

  public void requireNoArgs() throws SyntaxException {
    if (!args.isEmpty()) {
      throw new SyntaxException(
          ErrorKind.ARITY_ERROR, "%s function does not require any arguments", name);
    }
  }

  public void requireArgs(int count) throws SyntaxException {
    if (args.size() != count) {
      throw new SyntaxException(
          ErrorKind.ARITY_ERROR,
          "%s function requires %d argument%s, but received %d",
          name,
          count,
          count == 1 ? "" : "s",
          args.size());
    }
  }

  public void requireAtLeast(int count) throws SyntaxException {
    if (args.size() < count) {
      throw new SyntaxException(
          ErrorKind.ARITY_ERROR,
          "%s function requires at least %d argument%s",
          name,
          count,
          count == 1 ? "" : "s");
    }
  }

  /** Index of the first argument after an optional marker word such as {@code list}. */
  public int skipMarker(String... markers) {
    for (String marker : markers) {
      if (argIs(0, marker) && args.size() > 1) return 1;
    }
    return 0;
  }

  /**
   * Matches {@code kw1 <x1> kw2 <x2> ...} exactly, starting at {@code start}, and returns the
   * {@code <x>} tokens.
   */
  public ImmutableList<String> frame(int start, String usage, String... keywords)
      throws SyntaxException {
    if (args.size() - start != keywords.length * 2) throw malformed(usage);

    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (int i = 0; i < keywords.length; i++) {
      int index = start + 2 * i;
      if (!args.get(index).equals(keywords[i])) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL,
            "%s syntax must include '%s': %s",
            name,
            keywords[i],
            usage);
      }
      values.add(args.get(index + 1));
    }
    return values.build();
  }

  /** Matches {@code keyword <tokens...>} at {@code start} and returns the trailing tokens. */
  public ImmutableList<String> tail(int start, String usage, String keyword)
      throws SyntaxException {
    if (args.size() - start < 2) throw malformed(usage);
    if (!args.get(start).equals(keyword)) {
      throw new SyntaxException(
          ErrorKind.MALFORMED_BUILTIN_CALL,
          "%s syntax must include '%s': %s",
          name,
          keyword,
          usage);
    }
    return args.subList(start + 1, args.size());
  }

  public SyntaxException malformed(String usage) {
    return new SyntaxException(
        ErrorKind.MALFORMED_BUILTIN_CALL, "%s requires: %s", name, usage);
  }

  /** A single token used as a host expression, with boolean literals normalized. */
  public static PyExpr operand(String token) {
    return PyExpr.raw(Tokens.normalizeBoolean(token));
  }

  /** A token used as text: kept as written when already quoted, quoted otherwise. */
  public static PyExpr literal(String token) {
    return Tokens.isQuoted(token) ? PyExpr.raw(token) : PyExpr.string(token);
  }

  /**
   * Argument list where {@code text <word>} is a string and every other token is an
   * expression.
   */
  public static ImmutableList<PyExpr> operands(List<String> tokens) throws SyntaxException {
    ImmutableList.Builder<PyExpr> builder = ImmutableList.builder();
    for (int i = 0; i < tokens.size(); i++) {
      if (tokens.get(i).equals(TEXT)) {
        if (i + 1 == tokens.size()) {
          throw new SyntaxException(
              ErrorKind.MALFORMED_BUILTIN_CALL, "Expected literal after 'text'");
        }
        builder.add(PyExpr.string(tokens.get(++i)));
      } else {
        builder.add(operand(tokens.get(i)));
      }
    }
    return builder.build();
  }

  /** A trailing value: {@code text <words...>} is one string, anything else an expression. */
  public static PyExpr value(List<String> tokens) throws SyntaxException {
    if (tokens.get(0).equals(TEXT)) {
      if (tokens.size() == 1) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL, "Expected literal after 'text'");
      }
      return textLiteral(tokens.subList(1, tokens.size()));
    }
    return PyExpr.raw(Tokens.join(Tokens.normalizeBooleans(tokens)));
  }

  /** The words following a {@code text} keyword, as one string. */
  public static PyExpr textLiteral(List<String> words) {
    String literal = Tokens.join(words);
    return Tokens.isQuoted(literal) ? PyExpr.raw(literal) : PyExpr.string(literal);
  }
}
