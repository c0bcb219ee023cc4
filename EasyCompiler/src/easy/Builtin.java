package easy;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Registry of builtin operations. Each constant pairs the operation's source name with the
 * emitter that validates its arguments and builds the host code.
 */
public enum Builtin {
  // Math
  SQRT("sqrt", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.sqrt"))),
  CEIL("ceil", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.ceil"))),
  FLOOR("floor", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.floor"))),
  SIN("sin", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.sin"))),
  COS("cos", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.cos"))),
  TAN("tan", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "math.tan"))),
  MOD("mod", Scope.CORE, expression(BuiltinEmitters::modulo)),
  LOG("log", Scope.CORE, expression(BuiltinEmitters::logarithm)),
  ABS("abs", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "abs"))),
  ROUND("round", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "round"))),
  EXPONENT("exponent", Scope.CORE, expression(c -> BuiltinEmitters.binaryOperator(c, "**"))),

  // Conversions and inspection
  INTEGER("integer", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "int"))),
  FLOAT("float", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "float"))),
  STRING("string", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "str"))),
  LIST("list", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "list"))),
  TUPLE("tuple", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "tuple"))),
  DICTIONARY("dictionary", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "dict"))),
  SET("set", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "set"))),
  LENGTHOF("lengthof", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "len"))),
  TYPEOF("typeof", Scope.CORE, expression(BuiltinEmitters::typeName)),
  HELPFUNCTION("helpfunction", Scope.FULL, expression(c -> BuiltinEmitters.unaryCall(c, "help"))),
  DIRECTORYOF("directoryof", Scope.FULL, expression(c -> BuiltinEmitters.unaryCall(c, "dir"))),

  // Aggregates
  MAXOF("maxof", Scope.CORE, expression(c -> BuiltinEmitters.variadicCall(c, "max"))),
  MINOF("minof", Scope.CORE, expression(c -> BuiltinEmitters.variadicCall(c, "min"))),
  SUMOF("sumof", Scope.CORE, expression(c -> BuiltinEmitters.unaryCall(c, "sum"))),
  RANGE("range", Scope.CORE, expression(BuiltinEmitters::range)),
  ENUMERATEARRAY(
      "enumeratearray", Scope.CORE, expression(c -> BuiltinEmitters.listOf(c, "enumerate"))),

  // Text
  UPPERCASE("uppercase", Scope.CORE, expression(c -> BuiltinEmitters.unaryMethod(c, "upper"))),
  LOWERCASE("lowercase", Scope.CORE, expression(c -> BuiltinEmitters.unaryMethod(c, "lower"))),
  CONCAT("concat", Scope.CORE, expression(BuiltinEmitters::concat)),
  SUBSTRING("substring", Scope.FULL, expression(BuiltinEmitters::substring)),
  REPLACE("replace", Scope.FULL, expression(BuiltinEmitters::replace)),
  SPLIT("split", Scope.FULL, expression(BuiltinEmitters::split)),
  JOIN("join", Scope.FULL, expression(BuiltinEmitters::join)),
  REVERSE("reverse", Scope.FULL, expression(BuiltinEmitters::reverse)),

  // Lists
  APPEND(
      "append", Scope.FULL, expression(c -> BuiltinEmitters.listMethod(c, "value", "append"))),
  REMOVE(
      "remove", Scope.FULL, expression(c -> BuiltinEmitters.listMethod(c, "value", "remove"))),
  POP("pop", Scope.FULL, expression(c -> BuiltinEmitters.listMethod(c, "index", "pop"))),
  INDEXOF(
      "indexof", Scope.FULL, expression(c -> BuiltinEmitters.listMethod(c, "value", "index"))),
  COUNTOF(
      "countof", Scope.FULL, expression(c -> BuiltinEmitters.listMethod(c, "value", "count"))),
  SORTLIST("sortlist", Scope.FULL, expression(BuiltinEmitters::sortList)),
  UNIQUELIST("uniquelist", Scope.FULL, expression(BuiltinEmitters::uniqueList)),

  // Dictionaries
  KEYSFROMDICTIONARY(
      "keysfromdictionary",
      Scope.FULL,
      expression(c -> BuiltinEmitters.dictionaryView(c, "keys"))),
  VALUESFROMDICTIONARY(
      "valuesfromdictionary",
      Scope.FULL,
      expression(c -> BuiltinEmitters.dictionaryView(c, "values"))),
  GETVALUEFROMDICTIONARY(
      "getvaluefromdictionary", Scope.FULL, expression(BuiltinEmitters::getValueFromDictionary)),
  SETVALUEINDICTIONARY(
      "setvalueindictionary", Scope.FULL, BuiltinEmitters::setValueInDictionary),
  REMOVEKEYFROMDICTIONARY(
      "removekeyfromdictionary", Scope.FULL, BuiltinEmitters::removeKeyFromDictionary),

  // Logic
  LOGICALNOT("logicalnot", Scope.FULL, expression(BuiltinEmitters::logicalNot)),
  LOGICALAND("logicaland", Scope.FULL, expression(c -> BuiltinEmitters.binaryOperator(c, "and"))),
  LOGICALOR("logicalor", Scope.FULL, expression(c -> BuiltinEmitters.binaryOperator(c, "or"))),
  LOGICALXOR("logicalxor", Scope.FULL, expression(BuiltinEmitters::logicalXor)),

  // Files
  READFILE("readfile", Scope.FULL, expression(BuiltinEmitters::readFile)),
  WRITEFILE("writefile", Scope.FULL, expression(c -> BuiltinEmitters.writeFile(c, "w"))),
  APPENDFILE("appendfile", Scope.FULL, expression(c -> BuiltinEmitters.writeFile(c, "a"))),

  // Zero argument utilities
  CLEARSCREEN("clearscreen", Scope.CORE, expression(BuiltinEmitters::clearScreen)),
  EXITPROGRAM("exitprogram", Scope.CORE, expression(BuiltinEmitters::exitProgram)),
  CURRENTTIME(
      "currenttime", Scope.CORE, expression(c -> BuiltinEmitters.formattedNow(c, "%H:%M:%S"))),
  CURRENTDATE(
      "currentdate", Scope.CORE, expression(c -> BuiltinEmitters.formattedNow(c, "%Y-%m-%d"))),
  CURRENTTIMESTAMP("currenttimestamp", Scope.CORE, expression(BuiltinEmitters::timestamp)),

  // Constructors
  CREATETEXT("createtext", Scope.CORE, expression(BuiltinEmitters::createText)),
  CREATEARRAY("createarray", Scope.CORE, expression(BuiltinEmitters::createArray)),
  CREATEDICTIONARY("createdictionary", Scope.CORE, expression(BuiltinEmitters::createDictionary));

  /** The smallest {@link Profile} that includes a builtin. */
  enum Scope {
    CORE,
    FULL;
  }

  @FunctionalInterface
  interface Emitter {
    PyStmt emit(BuiltinCall call) throws SyntaxException;
  }

  @FunctionalInterface
  interface ExpressionEmitter {
    PyExpr emit(BuiltinCall call) throws SyntaxException;
  }

  private static Emitter expression(ExpressionEmitter emitter) {
    return call -> PyStmt.expression(emitter.emit(call));
  }

  private final String sourceName;
  private final Scope scope;
  private final Emitter emitter;

  Builtin(String sourceName, Scope scope, Emitter emitter) {
    this.sourceName = sourceName;
    this.scope = scope;
    this.emitter = emitter;
  }

  public String sourceName() {
    return sourceName;
  }

  public boolean isAvailableIn(Profile profile) {
    return profile == Profile.FULL || scope == Scope.CORE;
  }

  /** True for builtins that take no arguments, which may be written alone after 'print'. */
  public boolean takesNoArguments() {
    return NO_ARGUMENTS.contains(this);
  }

  /** True for operations usable in the '<list> <operation> ...' shorthand. */
  public boolean isListOperation() {
    return LIST_OPERATIONS.contains(this);
  }

  PyStmt emit(BuiltinCall call) throws SyntaxException {
    return emitter.emit(call);
  }

  private static final ImmutableMap<String, Builtin> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(b -> b.sourceName, b -> b));

  private static final ImmutableSet<Builtin> NO_ARGUMENTS =
      Sets.immutableEnumSet(CLEARSCREEN, EXITPROGRAM, CURRENTTIME, CURRENTDATE, CURRENTTIMESTAMP);

  private static final ImmutableSet<Builtin> LIST_OPERATIONS =
      Sets.immutableEnumSet(APPEND, REMOVE, POP, INDEXOF, COUNTOF, SORTLIST, UNIQUELIST, REVERSE);

  /** Exact, case-sensitive lookup regardless of profile. */
  public static Optional<Builtin> forName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
