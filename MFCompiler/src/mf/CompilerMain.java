package mf;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.io.Files;

public class CompilerMain {

  private static final String USAGE =
      "Usage: $COMPILER [--shader] [--force-update] [--print-ast] formula_file [library_dir]";

  public static void main(String[] args) throws IOException {
    TreeType treeType = TreeType.GEOMETRY;
    boolean forceUpdate = false;
    boolean printAst = false;
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      switch (arg) {
        case "--shader":
          treeType = TreeType.SHADER;
          break;
        case "--force-update":
          forceUpdate = true;
          break;
        case "--print-ast":
          printAst = true;
          break;
        default:
          if (arg.startsWith("--")) {
            System.err.println("Unknown flag: " + arg);
            System.err.println(USAGE);
            System.exit(1);
          }
          positional.add(arg);
      }
    }
    if (positional.isEmpty() || positional.size() > 2) {
      System.err.println(USAGE);
      System.exit(1);
    }

    // Load the libraries.
    Optional<File> libraryDir =
        positional.size() == 2 ? Optional.of(new File(positional.get(1))) : Optional.empty();
    LibraryLoader.Result libraries = LibraryLoader.load(libraryDir, forceUpdate);
    if (libraries.hasErrors()) {
      libraries.printErrors();
      System.out.println("Loading libraries failed.  See errors above.");
      System.exit(1);
    }
    if (libraries.fromCache()) {
      System.out.println("Libraries loaded from cache");
    }

    // Compile and build.
    File formulaFile = new File(positional.get(0));
    String source = read(formulaFile);
    if (printAst) {
      Parser.Result parsed = Parser.parse(source);
      if (!parsed.hasErrors()) {
        System.out.println(AstPrinter.print(parsed.module()));
      }
    }

    MemoryGraphBackend backend = new MemoryGraphBackend();
    MemoryNodeTree tree = backend.createTree(formulaFile.getName(), treeType);
    Compiler compiler = new Compiler(libraries.library(treeType));
    Program program;
    try {
      program = compiler.compile(source);
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }
    Interpreter interpreter = new Interpreter(tree, new CompilationSession(backend));
    interpreter.execute(program.operations());

    for (MemoryNodeTree group : backend.nodeGroups().values()) {
      System.out.print(group.dump());
    }
    System.out.print(tree.dump());
    for (String output : program.outputs()) {
      System.out.println(
          String.format(
              "out %s = %s",
              output, interpreter.variable(output).map(Object::toString).orElse("?")));
    }
    System.out.println("Compilation succeeded!");
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
