package easy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/** Grammar checks and emission templates for each {@link Builtin}. */
final class BuiltinEmitters {
  private static final Splitter COMMA = Splitter.on(',').trimResults();
  private static final Splitter RANGE_BOUNDS =
      Splitter.on(CharMatcher.is(',').or(CharMatcher.whitespace())).omitEmptyStrings();

  private static final String KEY = "key";
  private static final String VALUE = "value";

  private static final PyExpr EMPTY_STRING = PyExpr.string("");

  // Single argument transforms.

  static PyExpr unaryCall(BuiltinCall call, String function) throws SyntaxException {
    call.requireArgs(1);
    return PyExpr.call(function, BuiltinCall.operand(call.arg(0)));
  }

  static PyExpr unaryMethod(BuiltinCall call, String method) throws SyntaxException {
    call.requireArgs(1);
    return PyExpr.method(BuiltinCall.operand(call.arg(0)), method);
  }

  static PyExpr listOf(BuiltinCall call, String function) throws SyntaxException {
    return PyExpr.call("list", unaryCall(call, function));
  }

  static PyExpr typeName(BuiltinCall call) throws SyntaxException {
    return PyExpr.attribute(unaryCall(call, "type"), "__name__");
  }

  static PyExpr logicalNot(BuiltinCall call) throws SyntaxException {
    call.requireArgs(1);
    return PyExpr.not(BuiltinCall.operand(call.arg(0)));
  }

  // Positional operations.

  static PyExpr binaryOperator(BuiltinCall call, String operator) throws SyntaxException {
    call.requireArgs(2);
    return PyExpr.binary(
        BuiltinCall.operand(call.arg(0)), operator, BuiltinCall.operand(call.arg(1)));
  }

  static PyExpr logicalXor(BuiltinCall call) throws SyntaxException {
    call.requireArgs(2);
    PyExpr a = BuiltinCall.operand(call.arg(0));
    PyExpr b = BuiltinCall.operand(call.arg(1));
    return PyExpr.binary(
        PyExpr.binary(a, "and", PyExpr.not(b)), "or", PyExpr.binary(PyExpr.not(a), "and", b));
  }

  static PyExpr modulo(BuiltinCall call) throws SyntaxException {
    List<PyExpr> parts =
        commaPair(call, "mod function requires two arguments separated by a comma");
    return PyExpr.binary(parts.get(0), "%", parts.get(1));
  }

  static PyExpr logarithm(BuiltinCall call) throws SyntaxException {
    List<PyExpr> parts =
        commaPair(call, "log function requires two arguments (number, base) separated by a comma");
    return PyExpr.call("math.log", parts);
  }

  private static List<PyExpr> commaPair(BuiltinCall call, String message)
      throws SyntaxException {
    List<String> parts = COMMA.splitToList(call.joinedArgs());
    if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
      throw new SyntaxException(ErrorKind.ARITY_ERROR, message);
    }
    return ImmutableList.of(
        PyExpr.raw(Tokens.join(Tokens.normalizeBooleans(Tokens.split(parts.get(0))))),
        PyExpr.raw(Tokens.join(Tokens.normalizeBooleans(Tokens.split(parts.get(1))))));
  }

  static PyExpr range(BuiltinCall call) throws SyntaxException {
    List<String> bounds = RANGE_BOUNDS.splitToList(call.joinedArgs());
    if (bounds.isEmpty() || bounds.size() > 2) {
      throw new SyntaxException(
          ErrorKind.ARITY_ERROR,
          "range function requires one or two arguments (end) or (start, end)");
    }
    if (bounds.size() == 1) {
      return PyExpr.call("list", PyExpr.call("range", BuiltinCall.operand(bounds.get(0))));
    }
    PyExpr end = PyExpr.binary(BuiltinCall.operand(bounds.get(1)), "+", PyExpr.raw("1"));
    return PyExpr.call(
        "list", PyExpr.call("range", BuiltinCall.operand(bounds.get(0)), end));
  }

  // Variadic operations.

  static PyExpr variadicCall(BuiltinCall call, String function) throws SyntaxException {
    call.requireAtLeast(1);
    return PyExpr.call(function, BuiltinCall.operands(call.args()));
  }

  static PyExpr concat(BuiltinCall call) throws SyntaxException {
    call.requireAtLeast(2);
    ImmutableList<PyExpr> parts =
        BuiltinCall.operands(call.args()).stream()
            .map(e -> PyExpr.call("str", e))
            .collect(ImmutableList.toImmutableList());
    return PyExpr.method(EMPTY_STRING, "join", PyExpr.list(parts));
  }

  static PyExpr createText(BuiltinCall call) throws SyntaxException {
    call.requireAtLeast(1);
    return PyExpr.string(call.joinedArgs());
  }

  static PyExpr createArray(BuiltinCall call) throws SyntaxException {
    call.requireAtLeast(1);
    return PyExpr.list(BuiltinCall.operands(call.args()));
  }

  static PyExpr createDictionary(BuiltinCall call) throws SyntaxException {
    if (call.numArgs() == 0) {
      throw new SyntaxException(
          ErrorKind.ARITY_ERROR,
          "createdictionary requires at least one pair: key <key> value <value> ...");
    }

    ImmutableList.Builder<Map.Entry<PyExpr, PyExpr>> entries = ImmutableList.builder();
    List<String> args = call.args();
    int i = 0;
    while (i < args.size()) {
      if (!args.get(i).equals(KEY)) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL,
            "Syntax error in 'createdictionary': Expected keyword 'key' at position %d, but"
                + " found '%s'. Dictionary key-value pairs must start with 'key'.",
            i + 1,
            args.get(i));
      }
      if (i + 1 == args.size()) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL,
            "Syntax error in 'createdictionary': Missing key after 'key' at position %d.",
            i + 1);
      }
      String key = args.get(i + 1);
      if (i + 2 == args.size() || !args.get(i + 2).equals(VALUE)) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL,
            "Syntax error in 'createdictionary': Expected keyword 'value' after key '%s' at"
                + " position %d.",
            key,
            i + 3);
      }

      int start = i + 3;
      int end = start;
      while (end < args.size() && !args.get(end).equals(KEY) && !args.get(end).equals(VALUE)) {
        end++;
      }
      if (end == start) {
        throw new SyntaxException(
            ErrorKind.MALFORMED_BUILTIN_CALL,
            "Syntax error in 'createdictionary': Missing value after 'value' keyword for key"
                + " '%s'.",
            key);
      }

      List<String> segment = args.subList(start, end);
      PyExpr value =
          call.compiler().isBuiltin(segment.get(0))
              ? call.compiler().compileExpression(segment)
              : PyExpr.string(Tokens.join(segment));
      entries.add(Maps.immutableEntry(BuiltinCall.literal(key), value));
      i = end;
    }
    return PyExpr.dict(entries.build());
  }

  // Keyword-framed text operations.

  /** Subject of a text operation: {@code text <literal>} or a variable. */
  private static PyExpr textSubject(BuiltinCall call) {
    return call.argIs(0, BuiltinCall.TEXT)
        ? PyExpr.string(call.arg(1))
        : BuiltinCall.operand(call.arg(0));
  }

  private static int afterSubject(BuiltinCall call) {
    return call.argIs(0, BuiltinCall.TEXT) ? 2 : 1;
  }

  private static void requireSubject(BuiltinCall call, String usage) throws SyntaxException {
    if (call.numArgs() < afterSubject(call)) throw call.malformed(usage);
  }

  private static String usage(BuiltinCall call, String literalUsage, String variableUsage) {
    return call.argIs(0, BuiltinCall.TEXT) ? literalUsage : variableUsage;
  }

  static PyExpr substring(BuiltinCall call) throws SyntaxException {
    String usage =
        usage(
            call,
            "substring text <literal> start <start> length <length>",
            "substring <variable> start <start> length <length>");
    requireSubject(call, usage);
    List<String> values = call.frame(afterSubject(call), usage, "start", "length");
    PyExpr start = BuiltinCall.operand(values.get(0));
    PyExpr end = PyExpr.binary(start, "+", BuiltinCall.operand(values.get(1)));
    return PyExpr.slice(textSubject(call), Optional.of(start), Optional.of(end), Optional.empty());
  }

  static PyExpr replace(BuiltinCall call) throws SyntaxException {
    String usage =
        usage(
            call,
            "replace text <literal> old <old> new <new>",
            "replace <variable> old <old> new <new>");
    requireSubject(call, usage);
    List<String> values = call.frame(afterSubject(call), usage, "old", "new");
    return PyExpr.method(
        textSubject(call),
        "replace",
        BuiltinCall.literal(values.get(0)),
        BuiltinCall.literal(values.get(1)));
  }

  static PyExpr split(BuiltinCall call) throws SyntaxException {
    String usage =
        usage(call, "split text <literal> by <separator>", "split <variable> by <separator>");
    requireSubject(call, usage);
    List<String> values = call.frame(afterSubject(call), usage, "by");
    return PyExpr.method(textSubject(call), "split", BuiltinCall.literal(values.get(0)));
  }

  static PyExpr join(BuiltinCall call) throws SyntaxException {
    int start = call.skipMarker("list", "array");
    String usage =
        start == 1 ? "join list <list> by <separator>" : "join <list> by <separator>";
    if (call.numArgs() <= start) throw call.malformed(usage);
    List<String> values = call.frame(start + 1, usage, "by");
    PyExpr items = PyExpr.call("map", PyExpr.name("str"), BuiltinCall.operand(call.arg(start)));
    return PyExpr.method(BuiltinCall.literal(values.get(0)), "join", items);
  }

  static PyExpr reverse(BuiltinCall call) throws SyntaxException {
    if (call.argIs(0, BuiltinCall.TEXT) || call.argIs(0, "list") || call.argIs(0, "array")) {
      if (call.numArgs() != 2) {
        throw call.malformed(
            call.argIs(0, BuiltinCall.TEXT)
                ? "reverse text <literal>"
                : "reverse list <list> or reverse array <array>");
      }
      if (!call.argIs(0, BuiltinCall.TEXT)) {
        return PyExpr.slice(
            BuiltinCall.operand(call.arg(1)),
            Optional.empty(),
            Optional.empty(),
            Optional.of(PyExpr.raw("-1")));
      }
      return PyExpr.method(EMPTY_STRING, "join", PyExpr.call("reversed", textSubject(call)));
    }
    if (call.numArgs() != 1) {
      throw call.malformed("reverse <variable>, reverse text <literal> or reverse list <list>");
    }
    return PyExpr.method(
        EMPTY_STRING, "join", PyExpr.call("reversed", BuiltinCall.operand(call.arg(0))));
  }

  // List operations: <op> [list|array] <list> <keyword> <value...>

  static PyExpr listMethod(BuiltinCall call, String keyword, String method)
      throws SyntaxException {
    int start = call.skipMarker("list", "array");
    String usage = String.format("%s [list|array] <list> %s <%s>", call.name(), keyword, keyword);
    if (call.numArgs() <= start) throw call.malformed(usage);
    List<String> value = call.tail(start + 1, usage, keyword);
    return PyExpr.method(BuiltinCall.operand(call.arg(start)), method, BuiltinCall.value(value));
  }

  static PyExpr sortList(BuiltinCall call) throws SyntaxException {
    return PyExpr.method(singleList(call), "sort");
  }

  static PyExpr uniqueList(BuiltinCall call) throws SyntaxException {
    return PyExpr.call("list", PyExpr.call("dict.fromkeys", singleList(call)));
  }

  private static PyExpr singleList(BuiltinCall call) throws SyntaxException {
    int start = call.skipMarker("list", "array");
    if (call.numArgs() != start + 1) {
      throw call.malformed(String.format("%s [list|array] <list>", call.name()));
    }
    return BuiltinCall.operand(call.arg(start));
  }

  // Dictionary operations: <op> [dictionary] <dictionary> ...

  private static int dictionaryStart(BuiltinCall call) {
    return call.skipMarker("dictionary");
  }

  static PyExpr dictionaryView(BuiltinCall call, String method) throws SyntaxException {
    int start = dictionaryStart(call);
    if (call.numArgs() != start + 1) {
      throw call.malformed(String.format("%s dictionary <dictionary>", call.name()));
    }
    return PyExpr.call("list", PyExpr.method(BuiltinCall.operand(call.arg(start)), method));
  }

  static PyExpr getValueFromDictionary(BuiltinCall call) throws SyntaxException {
    int start = dictionaryStart(call);
    String usage = "getvaluefromdictionary dictionary <dictionary> key <key>";
    if (call.numArgs() <= start) throw call.malformed(usage);
    List<String> values = call.frame(start + 1, usage, KEY);
    return PyExpr.method(
        BuiltinCall.operand(call.arg(start)), "get", BuiltinCall.operand(values.get(0)));
  }

  static PyStmt setValueInDictionary(BuiltinCall call) throws SyntaxException {
    int start = dictionaryStart(call);
    String usage = "setvalueindictionary dictionary <dictionary> key <key> value <value>";
    if (call.numArgs() < start + 5 || !call.argIs(start + 1, KEY)) throw call.malformed(usage);
    List<String> value = call.tail(start + 3, usage, VALUE);
    PyExpr target =
        PyExpr.subscript(
            BuiltinCall.operand(call.arg(start)), BuiltinCall.operand(call.arg(start + 2)));
    return PyStmt.assign(target, BuiltinCall.value(value));
  }

  static PyStmt removeKeyFromDictionary(BuiltinCall call) throws SyntaxException {
    int start = dictionaryStart(call);
    String usage = "removekeyfromdictionary dictionary <dictionary> key <key>";
    if (call.numArgs() <= start) throw call.malformed(usage);
    List<String> values = call.frame(start + 1, usage, KEY);
    return PyStmt.delete(
        PyExpr.subscript(
            BuiltinCall.operand(call.arg(start)), BuiltinCall.operand(values.get(0))));
  }

  // Files.

  static PyExpr readFile(BuiltinCall call) throws SyntaxException {
    int start = call.skipMarker("file");
    if (call.numArgs() != start + 1) throw call.malformed("readfile file <path>");
    return PyExpr.method(PyExpr.call("open", BuiltinCall.literal(call.arg(start))), "read");
  }

  static PyExpr writeFile(BuiltinCall call, String mode) throws SyntaxException {
    int start = call.skipMarker("file");
    String usage = String.format("%s file <path> text <content>", call.name());
    if (call.numArgs() <= start) throw call.malformed(usage);
    List<String> content = call.tail(start + 1, usage, BuiltinCall.TEXT);
    PyExpr file =
        PyExpr.call("open", BuiltinCall.literal(call.arg(start)), PyExpr.string(mode));
    return PyExpr.method(file, "write", PyExpr.string(Tokens.join(content)));
  }

  // Zero argument utilities.

  static PyExpr clearScreen(BuiltinCall call) throws SyntaxException {
    call.requireNoArgs();
    PyExpr isWindows = PyExpr.binary(PyExpr.name("os.name"), "==", PyExpr.string("nt"));
    return PyExpr.call(
        "os.system",
        PyExpr.conditional(PyExpr.string("cls"), isWindows, PyExpr.string("clear")));
  }

  static PyExpr exitProgram(BuiltinCall call) throws SyntaxException {
    call.requireNoArgs();
    return exit();
  }

  static PyExpr exit() {
    return PyExpr.call("sys.exit");
  }

  static PyExpr formattedNow(BuiltinCall call, String format) throws SyntaxException {
    call.requireNoArgs();
    return PyExpr.method(now(), "strftime", PyExpr.string(format));
  }

  static PyExpr timestamp(BuiltinCall call) throws SyntaxException {
    call.requireNoArgs();
    return PyExpr.call("str", PyExpr.method(now(), "timestamp"));
  }

  private static PyExpr now() {
    return PyExpr.call("datetime.datetime.now");
  }

  private BuiltinEmitters() {}
}
