package easy;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final int lineNumber;
  private final String sourceText;
  private final String errorMsg;

  public CompilerException(ErrorKind kind, int lineNumber, String sourceText, String errorMsg) {
    super(errorMsg);
    this.kind = kind;
    this.lineNumber = lineNumber;
    this.sourceText = sourceText;
    this.errorMsg = errorMsg;
  }

  public CompilerException(ErrorKind kind, SourceLine line, String errorMsg) {
    this(kind, line.lineNumber(), line.rawText(), errorMsg);
  }

  private CompilerException(SourceLine line, Throwable cause) {
    super(String.valueOf(cause.getMessage()), cause);
    this.kind = ErrorKind.INTERNAL_ERROR;
    this.lineNumber = line.lineNumber();
    this.sourceText = line.rawText();
    this.errorMsg = String.valueOf(cause.getMessage());
  }

  public static CompilerException at(SourceLine line, SyntaxException ex) {
    return new CompilerException(ex.kind(), line, ex.getMessage());
  }

  public static CompilerException internal(SourceLine line, RuntimeException ex) {
    return new CompilerException(line, ex);
  }

  public ErrorKind kind() {
    return kind;
  }

  public int lineNumber() {
    return lineNumber;
  }

  public String sourceText() {
    return sourceText;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public String format() {
    return String.format("ERROR: line %d: '%s' -> %s", lineNumber, sourceText, errorMsg);
  }

  public void print() {
    System.out.println(format());
  }
}
