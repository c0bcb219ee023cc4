package easy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Renders {@link PyExpr} and {@link PyStmt} trees as Python source. All string quoting and
 * operand parenthesization for the generated program happens here.
 */
public final class PythonPrinter {
  private static final char QUOTE = '"';

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape(QUOTE, "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  public static String quote(String value) {
    return QUOTE + STRING_ESCAPER.escape(value) + QUOTE;
  }

  public static String print(PyStmt stmt, int depth, int indentWidth) {
    return Strings.repeat(" ", depth * indentWidth) + print(stmt);
  }

  public static String print(PyStmt stmt) {
    switch (stmt.type()) {
      case EXPRESSION:
        return print(stmt.<PyStmt.ExpressionStmt>cast().expr());
      case ASSIGN:
        {
          PyStmt.Assign assign = stmt.cast();
          return print(assign.target()) + " = " + print(assign.value());
        }
      case DELETE:
        return "del " + print(stmt.<PyStmt.Delete>cast().target());
      case IF:
        return "if " + print(stmt.<PyStmt.If>cast().condition()) + ":";
      case WHILE:
        return "while " + print(stmt.<PyStmt.While>cast().condition()) + ":";
      case FOR_RANGE:
        {
          PyStmt.ForRange loop = stmt.cast();
          PyExpr end = PyExpr.binary(loop.end(), "+", PyExpr.raw("1"));
          return String.format(
              "for %s in range(%s, %s):", loop.variable(), print(loop.start()), print(end));
        }
    }
    throw new AssertionError(stmt.type());
  }

  public static String print(PyExpr expr) {
    switch (expr.type()) {
      case RAW:
        return expr.<PyExpr.Raw>cast().text();
      case NAME:
        return expr.<PyExpr.Name>cast().name();
      case STRING:
        return quote(expr.<PyExpr.StringLiteral>cast().value());
      case CALL:
        {
          PyExpr.Call call = expr.cast();
          return call.function() + "(" + printAll(call.args()) + ")";
        }
      case METHOD_CALL:
        {
          PyExpr.MethodCall call = expr.cast();
          return operand(call.receiver()) + "." + call.method() + "(" + printAll(call.args()) + ")";
        }
      case ATTRIBUTE:
        {
          PyExpr.Attribute attribute = expr.cast();
          return operand(attribute.receiver()) + "." + attribute.attribute();
        }
      case SUBSCRIPT:
        {
          PyExpr.Subscript subscript = expr.cast();
          return operand(subscript.target()) + "[" + print(subscript.index()) + "]";
        }
      case SLICE:
        {
          PyExpr.Slice slice = expr.cast();
          StringBuilder sb = new StringBuilder(operand(slice.target()));
          sb.append('[').append(printOptional(slice.start())).append(':');
          sb.append(printOptional(slice.end()));
          if (slice.step().isPresent()) {
            sb.append(':').append(print(slice.step().get()));
          }
          return sb.append(']').toString();
        }
      case LIST:
        return "[" + printAll(expr.<PyExpr.ListLiteral>cast().elements()) + "]";
      case DICT:
        return expr.<PyExpr.DictLiteral>cast()
            .entries()
            .stream()
            .map(PythonPrinter::printEntry)
            .collect(Collectors.joining(", ", "{", "}"));
      case NOT:
        return "not " + operand(expr.<PyExpr.Not>cast().operand());
      case BINARY:
        {
          PyExpr.Binary binary = expr.cast();
          return operand(binary.lhs()) + " " + binary.operator() + " " + operand(binary.rhs());
        }
      case CONDITIONAL:
        {
          PyExpr.Conditional conditional = expr.cast();
          return String.format(
              "%s if %s else %s",
              operand(conditional.ifTrue()),
              operand(conditional.condition()),
              operand(conditional.ifFalse()));
        }
    }
    throw new AssertionError(expr.type());
  }

  private static String operand(PyExpr expr) {
    return expr.isAtomic() ? print(expr) : "(" + print(expr) + ")";
  }

  private static String printAll(List<PyExpr> exprs) {
    return exprs.stream().map(PythonPrinter::print).collect(Collectors.joining(", "));
  }

  private static String printOptional(Optional<PyExpr> expr) {
    return expr.map(PythonPrinter::print).orElse("");
  }

  private static String printEntry(Map.Entry<PyExpr, PyExpr> entry) {
    return print(entry.getKey()) + ": " + print(entry.getValue());
  }

  private PythonPrinter() {}
}
