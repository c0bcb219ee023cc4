package easy;

/** One line of the generated program. Block openers print with a trailing colon. */
public abstract class PyStmt {

  public enum Type {
    EXPRESSION,
    ASSIGN,
    DELETE,
    IF,
    WHILE,
    FOR_RANGE;

    public boolean opensBlock() {
      return this == IF || this == WHILE || this == FOR_RANGE;
    }
  }

  private final Type type;

  protected PyStmt(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends PyStmt> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return PythonPrinter.print(this);
  }

  public static ExpressionStmt expression(PyExpr expr) {
    return new ExpressionStmt(expr);
  }

  public static ExpressionStmt print(PyExpr expr) {
    return new ExpressionStmt(PyExpr.call("print", expr));
  }

  public static Assign assign(PyExpr target, PyExpr value) {
    return new Assign(target, value);
  }

  public static Delete delete(PyExpr target) {
    return new Delete(target);
  }

  public static If ifStmt(PyExpr condition) {
    return new If(condition);
  }

  public static While whileStmt(PyExpr condition) {
    return new While(condition);
  }

  public static ForRange forRange(String variable, PyExpr start, PyExpr end) {
    return new ForRange(variable, start, end);
  }

  public static final class ExpressionStmt extends PyStmt {
    private final PyExpr expr;

    private ExpressionStmt(PyExpr expr) {
      super(Type.EXPRESSION);
      this.expr = expr;
    }

    public PyExpr expr() {
      return expr;
    }
  }

  public static final class Assign extends PyStmt {
    private final PyExpr target;
    private final PyExpr value;

    private Assign(PyExpr target, PyExpr value) {
      super(Type.ASSIGN);
      this.target = target;
      this.value = value;
    }

    public PyExpr target() {
      return target;
    }

    public PyExpr value() {
      return value;
    }
  }

  public static final class Delete extends PyStmt {
    private final PyExpr target;

    private Delete(PyExpr target) {
      super(Type.DELETE);
      this.target = target;
    }

    public PyExpr target() {
      return target;
    }
  }

  public static final class If extends PyStmt {
    private final PyExpr condition;

    private If(PyExpr condition) {
      super(Type.IF);
      this.condition = condition;
    }

    public PyExpr condition() {
      return condition;
    }
  }

  public static final class While extends PyStmt {
    private final PyExpr condition;

    private While(PyExpr condition) {
      super(Type.WHILE);
      this.condition = condition;
    }

    public PyExpr condition() {
      return condition;
    }
  }

  // for <variable> in range(<start>, <end> + 1):
  public static final class ForRange extends PyStmt {
    private final String variable;
    private final PyExpr start;
    private final PyExpr end;

    private ForRange(String variable, PyExpr start, PyExpr end) {
      super(Type.FOR_RANGE);
      this.variable = variable;
      this.start = start;
      this.end = end;
    }

    public String variable() {
      return variable;
    }

    public PyExpr start() {
      return start;
    }

    public PyExpr end() {
      return end;
    }
  }
}
