package easy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharSource;

/**
 * Runs a generated program with an external Python interpreter. The program is piped to the
 * interpreter's standard input; its output and errors go to this process's console.
 */
public class PythonRunner {
  public static final String DEFAULT_COMMAND = "python3";

  private final String command;

  public PythonRunner() {
    this(DEFAULT_COMMAND);
  }

  public PythonRunner(String command) {
    Preconditions.checkArgument(!command.isEmpty(), "empty interpreter command");
    this.command = command;
  }

  public String command() {
    return command;
  }

  /** Arguments that make the interpreter read its program from standard input. */
  ImmutableList<String> commandLine() {
    return ImmutableList.of(command, "-");
  }

  /** Returns the interpreter's exit status. */
  public int run(CompiledProgram program) throws IOException, InterruptedException {
    Process process =
        new ProcessBuilder(commandLine())
            .redirectOutput(ProcessBuilder.Redirect.INHERIT)
            .redirectError(ProcessBuilder.Redirect.INHERIT)
            .start();

    try (OutputStream stdin = process.getOutputStream()) {
      CharSource.wrap(program.text() + "\n")
          .asByteSource(StandardCharsets.UTF_8)
          .copyTo(stdin);
    }
    return process.waitFor();
  }
}
