package easy;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class CompilerOptions {
  public static final int DEFAULT_INDENT_WIDTH = 4;

  public abstract Profile profile();

  /** Spaces per nesting level in the generated program. */
  public abstract int indentWidth();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setProfile(Profile.FULL)
        .setIndentWidth(DEFAULT_INDENT_WIDTH);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setProfile(Profile profile);

    public abstract Builder setIndentWidth(int indentWidth);

    abstract CompilerOptions autoBuild();

    public final CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkState(options.indentWidth() > 0, "indentWidth must be positive");
      return options;
    }
  }
}
