package easy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.google.common.io.Files;

public class CompilerMain {

  private static final String USAGE =
      "Usage: $COMPILER [--profile=full|core] [--emit] [--python=<command>] easy_file";

  private static final String PROFILE_FLAG = "--profile=";
  private static final String PYTHON_FLAG = "--python=";
  private static final String EMIT_FLAG = "--emit";

  public static void main(String[] args) throws IOException, InterruptedException {
    CompilerOptions.Builder options = CompilerOptions.builder();
    String python = PythonRunner.DEFAULT_COMMAND;
    boolean emit = false;
    String path = null;

    for (String arg : args) {
      if (arg.startsWith(PROFILE_FLAG)) {
        Optional<Profile> profile = Profile.parse(arg.substring(PROFILE_FLAG.length()));
        if (!profile.isPresent()) usage();
        options.setProfile(profile.get());
      } else if (arg.startsWith(PYTHON_FLAG)) {
        python = arg.substring(PYTHON_FLAG.length());
        if (python.isEmpty()) usage();
      } else if (arg.equals(EMIT_FLAG)) {
        emit = true;
      } else if (arg.startsWith("--") || path != null) {
        usage();
      } else {
        path = arg;
      }
    }
    if (path == null) usage();

    File file = new File(path);
    if (!file.isFile()) {
      System.out.println("Error: Input file not found: " + path);
      System.exit(1);
    }

    CompiledProgram program;
    try {
      program = new Compiler(options.build()).compile(read(file));
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }

    if (emit) {
      System.out.println(program.text());
      return;
    }

    int status = new PythonRunner(python).run(program);
    if (status != 0) {
      System.out.println("Execution of '" + path + "' failed with exit status " + status + ".");
      System.exit(status);
    }
    System.out.println("Execution of '" + path + "' successful.");
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
