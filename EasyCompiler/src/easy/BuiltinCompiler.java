package easy;

import java.util.List;
import java.util.Optional;

/** Compiles a token sequence naming a {@link Builtin} into host code. */
public class BuiltinCompiler {
  private final Profile profile;

  public BuiltinCompiler(Profile profile) {
    this.profile = profile;
  }

  public Profile profile() {
    return profile;
  }

  /** The builtin named by {@code name} if the active profile includes it. */
  public Optional<Builtin> lookup(String name) {
    return Builtin.forName(name).filter(b -> b.isAvailableIn(profile));
  }

  /**
   * True if {@code name} is registered in any profile. Such names are always routed here, so
   * that a builtin outside the active profile is reported instead of read as a variable.
   */
  public boolean isBuiltin(String name) {
    return Builtin.forName(name).isPresent();
  }

  /** Compiles a builtin whose result is used as a value. */
  public PyExpr compileExpression(List<String> tokens) throws SyntaxException {
    PyStmt stmt = compileStatement(tokens);
    if (stmt.type() != PyStmt.Type.EXPRESSION) {
      throw new SyntaxException(
          ErrorKind.MALFORMED_BUILTIN_CALL,
          "%s is a statement and cannot be used as a value",
          tokens.get(0));
    }
    return stmt.<PyStmt.ExpressionStmt>cast().expr();
  }

  /** Compiles a builtin invoked on its own line. */
  public PyStmt compileStatement(List<String> tokens) throws SyntaxException {
    String name = tokens.get(0);
    Optional<Builtin> builtin = lookup(name);
    if (!builtin.isPresent()) {
      if (isBuiltin(name)) {
        throw new SyntaxException(
            ErrorKind.UNKNOWN_FUNCTION,
            "Function '%s' is not available in the '%s' profile",
            name,
            profile.flagName());
      }
      throw new SyntaxException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: '%s'", name);
    }
    return builtin.get().emit(new BuiltinCall(name, tokens.subList(1, tokens.size()), this));
  }
}
