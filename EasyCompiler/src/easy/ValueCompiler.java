package easy;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

/**
 * Compiles the right-hand side of a declaration or assignment. Declarations pass their
 * {@link StorageType}, which selects literal handling and numeric coercion.
 */
class ValueCompiler {
  private static final ImmutableSet<String> ARITHMETIC = ImmutableSet.of("+", "-", "*", "/", "%");

  private final BuiltinCompiler builtins;
  private final RandomCompiler random;

  ValueCompiler(BuiltinCompiler builtins, RandomCompiler random) {
    this.builtins = builtins;
    this.random = random;
  }

  PyExpr compileDeclared(StorageType type, List<String> tokens) throws SyntaxException {
    return type.coerce(compile(Optional.of(type), tokens));
  }

  PyExpr compileUntyped(List<String> tokens) throws SyntaxException {
    return compile(Optional.empty(), tokens);
  }

  private PyExpr compile(Optional<StorageType> type, List<String> tokens)
      throws SyntaxException {
    if (tokens.stream().anyMatch(ARITHMETIC::contains)) {
      return PyExpr.raw(Tokens.join(Tokens.normalizeBooleans(tokens)));
    }

    String first = tokens.get(0);
    if (first.equals(RandomCompiler.KEYWORD)) {
      return random.compile(tokens);
    }
    if (first.equals(BuiltinCall.TEXT)) {
      return BuiltinCall.textLiteral(tokens.subList(1, tokens.size()));
    }

    if (builtins.isBuiltin(first)) {
      return builtins.compileExpression(tokens);
    }
    return literal(type, tokens);
  }

  private static PyExpr literal(Optional<StorageType> type, List<String> tokens)
      throws SyntaxException {
    String value = Tokens.join(Tokens.normalizeBooleans(tokens));
    if (type.isPresent() && type.get() == StorageType.TEXT) {
      // Only a leading quote marks the value as already quoted.
      return value.startsWith("\"") || value.startsWith("'")
          ? PyExpr.raw(value)
          : PyExpr.string(value);
    }

    if (type.isPresent() && type.get() == StorageType.BOOLEAN) {
      if (tokens.size() != 1 || !Tokens.isBooleanLiteral(tokens.get(0))) {
        throw new SyntaxException(
            ErrorKind.INVALID_BOOLEAN_LITERAL,
            "Invalid boolean value: '%s'. For boolean storage, use 'true' or 'false'.",
            value);
      }
      return PyExpr.name(value);
    }
    return PyExpr.raw(value);
  }
}
