package mf;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Parses, checks and lowers formulas against a library, and builds them into node trees. Nothing
 * is built while any diagnostic is pending.
 */
public class Compiler {

  private final Library library;

  public Compiler(Library library) {
    this.library = library;
  }

  public TreeType treeType() {
    return library.treeType();
  }

  /**
   * Compiles {@code source}. Definitions it makes are only visible to this compilation, not to
   * later ones.
   */
  public Program compile(String source) throws CompilerException {
    return compileInto(library.copy(), parse(source));
  }

  /** Compiles {@code source} and builds its operations into {@code tree}. */
  public Interpreter build(String source, NodeTree tree, GraphBackend backend)
      throws CompilerException {
    Program program = compile(source);
    Interpreter interpreter = new Interpreter(tree, new CompilationSession(backend));
    interpreter.execute(program.operations());
    return interpreter;
  }

  static AST.Module parse(String source) throws CompilerException {
    Parser.Result result = Parser.parse(source);
    if (result.hasErrors()) {
      throw new CompilerException(result.diagnostics());
    }
    return result.module();
  }

  /** Validates and lowers {@code module}; its definitions are added to {@code library}. */
  static Program compileInto(Library library, AST.Module module) throws CompilerException {
    ImmutableList<Diagnostic> errors = new ASTValidator(module).computeErrors();
    if (!errors.isEmpty()) {
      throw new CompilerException(errors);
    }
    Lowerer lowerer = new Lowerer(library);
    Program program = lowerer.lower(module);
    if (lowerer.hasErrors()) {
      throw new CompilerException(lowerer.diagnostics());
    }
    return program;
  }

  /**
   * Compiles a library source: only definitions are allowed. Definitions are added to {@code
   * library} only if the whole source compiles.
   */
  static void compileLibrary(Library library, String source) throws CompilerException {
    AST.Module module = parse(source);
    List<Diagnostic> errors = new ArrayList<>();
    for (AST.Statement statement : module.body()) {
      if (!(statement instanceof AST.Definition)) {
        errors.add(
            Diagnostic.at(
                statement.token(), "Library files can only contain function definitions."));
      }
    }
    if (!errors.isEmpty()) {
      throw new CompilerException(errors);
    }
    Library scratch = library.copy();
    Program program = compileInto(scratch, module);
    program.definitions().forEach(library::define);
  }
}
