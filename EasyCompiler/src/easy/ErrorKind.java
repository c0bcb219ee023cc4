package easy;

/** Every way a compilation can fail, grouped by the category reported to the user. */
public enum ErrorKind {
  UNMATCHED_BLOCK_END(Category.STRUCTURAL),
  UNCLOSED_BLOCK(Category.STRUCTURAL),

  EMPTY_CONDITION(Category.GRAMMAR),
  MALFORMED_CONDITION(Category.GRAMMAR),
  MALFORMED_FOR_LOOP(Category.GRAMMAR),
  EMPTY_PRINT_EXPRESSION(Category.GRAMMAR),
  INCOMPLETE_DECLARATION(Category.GRAMMAR),
  MISSING_ASSIGNMENT(Category.GRAMMAR),
  MISSING_VALUE(Category.GRAMMAR),
  MALFORMED_BUILTIN_CALL(Category.GRAMMAR),

  ARITY_ERROR(Category.ARITY),

  UNKNOWN_COMMAND(Category.UNKNOWN),
  UNKNOWN_FUNCTION(Category.UNKNOWN),
  UNKNOWN_TYPE(Category.UNKNOWN),
  UNKNOWN_RANDOM_TYPE(Category.UNKNOWN),

  INVALID_BOOLEAN_LITERAL(Category.VALUE),
  INVALID_IDENTIFIER(Category.VALUE),

  INTERNAL_ERROR(Category.INTERNAL);

  public enum Category {
    STRUCTURAL,
    GRAMMAR,
    ARITY,
    UNKNOWN,
    VALUE,
    INTERNAL;
  }

  private final Category category;

  ErrorKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
