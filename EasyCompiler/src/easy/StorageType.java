package easy;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Ascii;

/** Declared types accepted by {@code storage <type> <name> = <value>}. */
public enum StorageType {
  NUMBER("number", Kind.INTEGER),
  INTEGER("integer", Kind.INTEGER),
  FLOAT("float", Kind.FLOAT),
  TEXT("text", Kind.TEXT),
  BOOLEAN("boolean", Kind.BOOLEAN),
  ARRAY("array", Kind.LIST),
  DICTIONARY("dictionary", Kind.MAPPING);

  public enum Kind {
    INTEGER,
    FLOAT,
    TEXT,
    BOOLEAN,
    LIST,
    MAPPING;
  }

  private final String keyword;
  private final Kind kind;

  StorageType(String keyword, Kind kind) {
    this.keyword = keyword;
    this.kind = kind;
  }

  public String keyword() {
    return keyword;
  }

  public Kind kind() {
    return kind;
  }

  /** Wraps a compiled value so the stored value has this type's numeric kind. */
  public PyExpr coerce(PyExpr value) {
    switch (kind) {
      case INTEGER:
        return PyExpr.call("int", value);
      case FLOAT:
        return PyExpr.call("float", value);
      default:
        return value;
    }
  }

  /** Case-insensitive. */
  public static Optional<StorageType> parse(String keyword) {
    String lower = Ascii.toLowerCase(keyword);
    return Arrays.stream(values()).filter(t -> t.keyword.equals(lower)).findFirst();
  }

  public static String allowedTypes() {
    return Arrays.stream(values()).map(StorageType::keyword).collect(Collectors.joining(", "));
  }
}
