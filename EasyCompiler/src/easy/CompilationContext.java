package easy;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

/**
 * Mutable state of a single compilation: nesting depth, the emitted body lines, and whether
 * any random expression was compiled. One instance per {@link Compiler#compile} call.
 */
final class CompilationContext {
  private final CompilerOptions options;
  private final ImmutableList.Builder<String> body = ImmutableList.builder();
  private int depth = 0;
  private boolean randomUsed = false;

  CompilationContext(CompilerOptions options) {
    this.options = options;
  }

  CompilerOptions options() {
    return options;
  }

  Profile profile() {
    return options.profile();
  }

  int depth() {
    return depth;
  }

  boolean randomUsed() {
    return randomUsed;
  }

  void markRandomUsed() {
    randomUsed = true;
  }

  // Printed at the depth in effect before the statement; openBlock() follows for openers.
  void emit(PyStmt stmt) {
    Verify.verify(depth >= 0, "negative block depth %s", depth);
    body.add(PythonPrinter.print(stmt, depth, options.indentWidth()));
    if (stmt.type().opensBlock()) openBlock();
  }

  void openBlock() {
    depth++;
  }

  void closeBlock() throws SyntaxException {
    if (depth == 0) {
      throw new SyntaxException(ErrorKind.UNMATCHED_BLOCK_END, "Unmatched 'end' statement");
    }
    depth--;
  }

  ImmutableList<String> body() {
    return body.build();
  }
}
