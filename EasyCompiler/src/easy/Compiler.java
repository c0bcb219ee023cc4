package easy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/**
 * Translates a source program into Python. Instances hold only immutable options and may be
 * shared across threads; every {@link #compile} call works on its own state.
 */
public class Compiler {
  private final CompilerOptions options;

  public Compiler() {
    this(CompilerOptions.defaults());
  }

  public Compiler(CompilerOptions options) {
    this.options = options;
  }

  public CompilerOptions options() {
    return options;
  }

  public CompiledProgram compile(String source) throws CompilerException {
    ImmutableList<SourceLine> lines = new Tokenizer(source).tokenize();
    CompilationContext context = new CompilationContext(options);
    StatementCompiler statements = new StatementCompiler(context);

    for (SourceLine line : lines) {
      try {
        statements.compile(line);
      } catch (SyntaxException ex) {
        throw CompilerException.at(line, ex);
      } catch (RuntimeException ex) {
        throw CompilerException.internal(line, ex);
      }
    }

    if (context.depth() != 0) {
      throw new CompilerException(
          ErrorKind.UNCLOSED_BLOCK,
          Iterables.getLast(lines),
          "Unclosed block statements detected. Some blocks are not properly terminated with"
              + " 'end'.");
    }
    return CompiledProgram.create(context.randomUsed(), context.body());
  }
}
