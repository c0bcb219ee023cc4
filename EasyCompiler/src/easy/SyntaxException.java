package easy;

/**
 * A failure raised while compiling part of a single statement. It carries no position; the
 * statement boundary in {@link Compiler} attaches the line before reporting it.
 */
public class SyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public SyntaxException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public SyntaxException(ErrorKind kind, String format, Object... args) {
    this(kind, String.format(format, args));
  }

  public ErrorKind kind() {
    return kind;
  }
}
