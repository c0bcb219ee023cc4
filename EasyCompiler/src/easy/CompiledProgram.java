package easy;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/** Generated Python program: import header followed by the translated statements. */
@AutoValue
public abstract class CompiledProgram {
  static final ImmutableList<String> STANDARD_IMPORTS =
      ImmutableList.of("import math", "import sys", "import datetime", "import os");
  static final String RANDOM_IMPORT = "import random";

  public abstract ImmutableList<String> headerLines();

  public abstract ImmutableList<String> bodyLines();

  public boolean usesRandom() {
    return headerLines().contains(RANDOM_IMPORT);
  }

  public ImmutableList<String> lines() {
    return ImmutableList.copyOf(Iterables.concat(headerLines(), bodyLines()));
  }

  /** The program text, lines joined by '\n' with no trailing newline. */
  public String text() {
    return Joiner.on('\n').join(lines());
  }

  static CompiledProgram create(boolean randomUsed, ImmutableList<String> bodyLines) {
    ImmutableList.Builder<String> header = ImmutableList.<String>builder().addAll(STANDARD_IMPORTS);
    if (randomUsed) header.add(RANDOM_IMPORT);
    return new AutoValue_CompiledProgram(header.build(), bodyLines);
  }
}
