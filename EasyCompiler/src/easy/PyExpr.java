package easy;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Expression tree for the generated Python program. Nodes carry no formatting; quoting and
 * parenthesization happen once, in {@link PythonPrinter}.
 */
public abstract class PyExpr {

  public enum Type {
    // Host text copied through unchanged, e.g. a user's arithmetic.
    RAW,
    NAME,
    STRING,
    CALL,
    METHOD_CALL,
    ATTRIBUTE,
    SUBSCRIPT,
    SLICE,
    LIST,
    DICT,

    // Compounds
    NOT,
    BINARY,
    CONDITIONAL;

    public boolean isCompound() {
      return this == NOT || this == BINARY || this == CONDITIONAL;
    }
  }

  private final Type type;

  protected PyExpr(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends PyExpr> T cast() {
    return (T) this;
  }

  /** True if the printed form can be used as an operand without parentheses. */
  public boolean isAtomic() {
    return !type.isCompound();
  }

  @Override
  public String toString() {
    return PythonPrinter.print(this);
  }

  public static Raw raw(String text) {
    return new Raw(text);
  }

  public static Name name(String name) {
    return new Name(name);
  }

  public static Name bool(boolean value) {
    return new Name(value ? Tokens.TRUE : Tokens.FALSE);
  }

  public static StringLiteral string(String value) {
    return new StringLiteral(value);
  }

  public static Call call(String function, PyExpr... args) {
    return new Call(function, ImmutableList.copyOf(args));
  }

  public static Call call(String function, Iterable<? extends PyExpr> args) {
    return new Call(function, ImmutableList.copyOf(args));
  }

  public static MethodCall method(PyExpr receiver, String method, PyExpr... args) {
    return new MethodCall(receiver, method, ImmutableList.copyOf(args));
  }

  public static Attribute attribute(PyExpr receiver, String attribute) {
    return new Attribute(receiver, attribute);
  }

  public static Subscript subscript(PyExpr target, PyExpr index) {
    return new Subscript(target, index);
  }

  public static Slice slice(
      PyExpr target, Optional<PyExpr> start, Optional<PyExpr> end, Optional<PyExpr> step) {
    return new Slice(target, start, end, step);
  }

  public static ListLiteral list(Iterable<? extends PyExpr> elements) {
    return new ListLiteral(ImmutableList.copyOf(elements));
  }

  public static ListLiteral list(PyExpr... elements) {
    return list(Arrays.asList(elements));
  }

  public static DictLiteral dict(Iterable<Map.Entry<PyExpr, PyExpr>> entries) {
    return new DictLiteral(ImmutableList.copyOf(entries));
  }

  public static Not not(PyExpr operand) {
    return new Not(operand);
  }

  public static Binary binary(PyExpr lhs, String operator, PyExpr rhs) {
    return new Binary(lhs, operator, rhs);
  }

  public static Conditional conditional(PyExpr ifTrue, PyExpr condition, PyExpr ifFalse) {
    return new Conditional(ifTrue, condition, ifFalse);
  }

  public static final class Raw extends PyExpr {
    // Identifiers, attribute chains, numbers and quoted strings need no parentheses.
    private static final Pattern ATOMIC =
        Pattern.compile(
            "[\\p{L}_][\\p{L}\\p{N}_.]*|[0-9]+(\\.[0-9]+)?|\"[^\"]*\"|'[^']*'");

    private final String text;

    private Raw(String text) {
      super(Type.RAW);
      Preconditions.checkArgument(!text.isEmpty(), "empty raw expression");
      this.text = text;
    }

    public String text() {
      return text;
    }

    @Override
    public boolean isAtomic() {
      return ATOMIC.matcher(text).matches();
    }
  }

  public static final class Name extends PyExpr {
    private final String name;

    private Name(String name) {
      super(Type.NAME);
      this.name = name;
    }

    public String name() {
      return name;
    }
  }

  public static final class StringLiteral extends PyExpr {
    private final String value;

    private StringLiteral(String value) {
      super(Type.STRING);
      this.value = value;
    }

    public String value() {
      return value;
    }
  }

  public static final class Call extends PyExpr {
    private final String function;
    private final ImmutableList<PyExpr> args;

    private Call(String function, ImmutableList<PyExpr> args) {
      super(Type.CALL);
      this.function = function;
      this.args = args;
    }

    public String function() {
      return function;
    }

    public ImmutableList<PyExpr> args() {
      return args;
    }
  }

  public static final class MethodCall extends PyExpr {
    private final PyExpr receiver;
    private final String method;
    private final ImmutableList<PyExpr> args;

    private MethodCall(PyExpr receiver, String method, ImmutableList<PyExpr> args) {
      super(Type.METHOD_CALL);
      this.receiver = receiver;
      this.method = method;
      this.args = args;
    }

    public PyExpr receiver() {
      return receiver;
    }

    public String method() {
      return method;
    }

    public ImmutableList<PyExpr> args() {
      return args;
    }
  }

  public static final class Attribute extends PyExpr {
    private final PyExpr receiver;
    private final String attribute;

    private Attribute(PyExpr receiver, String attribute) {
      super(Type.ATTRIBUTE);
      this.receiver = receiver;
      this.attribute = attribute;
    }

    public PyExpr receiver() {
      return receiver;
    }

    public String attribute() {
      return attribute;
    }
  }

  public static final class Subscript extends PyExpr {
    private final PyExpr target;
    private final PyExpr index;

    private Subscript(PyExpr target, PyExpr index) {
      super(Type.SUBSCRIPT);
      this.target = target;
      this.index = index;
    }

    public PyExpr target() {
      return target;
    }

    public PyExpr index() {
      return index;
    }
  }

  public static final class Slice extends PyExpr {
    private final PyExpr target;
    private final Optional<PyExpr> start;
    private final Optional<PyExpr> end;
    private final Optional<PyExpr> step;

    private Slice(
        PyExpr target, Optional<PyExpr> start, Optional<PyExpr> end, Optional<PyExpr> step) {
      super(Type.SLICE);
      this.target = target;
      this.start = start;
      this.end = end;
      this.step = step;
    }

    public PyExpr target() {
      return target;
    }

    public Optional<PyExpr> start() {
      return start;
    }

    public Optional<PyExpr> end() {
      return end;
    }

    public Optional<PyExpr> step() {
      return step;
    }
  }

  public static final class ListLiteral extends PyExpr {
    private final ImmutableList<PyExpr> elements;

    private ListLiteral(ImmutableList<PyExpr> elements) {
      super(Type.LIST);
      this.elements = elements;
    }

    public ImmutableList<PyExpr> elements() {
      return elements;
    }
  }

  // Entry order is preserved.
  public static final class DictLiteral extends PyExpr {
    private final ImmutableList<Map.Entry<PyExpr, PyExpr>> entries;

    private DictLiteral(ImmutableList<Map.Entry<PyExpr, PyExpr>> entries) {
      super(Type.DICT);
      this.entries = entries;
    }

    public ImmutableList<Map.Entry<PyExpr, PyExpr>> entries() {
      return entries;
    }
  }

  public static final class Not extends PyExpr {
    private final PyExpr operand;

    private Not(PyExpr operand) {
      super(Type.NOT);
      this.operand = operand;
    }

    public PyExpr operand() {
      return operand;
    }
  }

  public static final class Binary extends PyExpr {
    private final PyExpr lhs;
    private final String operator;
    private final PyExpr rhs;

    private Binary(PyExpr lhs, String operator, PyExpr rhs) {
      super(Type.BINARY);
      this.lhs = lhs;
      this.operator = operator;
      this.rhs = rhs;
    }

    public PyExpr lhs() {
      return lhs;
    }

    public String operator() {
      return operator;
    }

    public PyExpr rhs() {
      return rhs;
    }
  }

  public static final class Conditional extends PyExpr {
    private final PyExpr ifTrue;
    private final PyExpr condition;
    private final PyExpr ifFalse;

    private Conditional(PyExpr ifTrue, PyExpr condition, PyExpr ifFalse) {
      super(Type.CONDITIONAL);
      this.ifTrue = ifTrue;
      this.condition = condition;
      this.ifFalse = ifFalse;
    }

    public PyExpr ifTrue() {
      return ifTrue;
    }

    public PyExpr condition() {
      return condition;
    }

    public PyExpr ifFalse() {
      return ifFalse;
    }
  }
}
