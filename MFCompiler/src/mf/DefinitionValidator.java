package mf;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the shape of definitions and assignments: definitions only at the top level, unique
 * parameter and output names, constant defaults, and no target assigned twice in one statement.
 */
class DefinitionValidator extends ErrorCollectingValidator {
  private int depth = 0;

  @Override
  public void visitImpl(AST.FunctionDef def) {
    checkDefinition(def, "function");
    depth++;
    super.visitImpl(def);
    depth--;
  }

  @Override
  public void visitImpl(AST.NodegroupDef def) {
    checkDefinition(def, "node group");
    depth++;
    super.visitImpl(def);
    depth--;
  }

  @Override
  public void visitImpl(AST.Loop loop) {
    depth++;
    super.visitImpl(loop);
    depth--;
  }

  @Override
  public void visitImpl(AST.Assign assign) {
    checkTargets(assign.targets());
    super.visitImpl(assign);
  }

  @Override
  public void visitImpl(AST.Out out) {
    checkTargets(out.targets());
    super.visitImpl(out);
  }

  private void checkDefinition(AST.Definition def, String kind) {
    if (depth > 0) {
      logError(def.token(), String.format("A %s can only be defined at the top level.", kind));
    }
    Set<String> names = new HashSet<>();
    for (AST.Arg arg : def.args()) {
      if (!names.add(arg.name())) {
        logError(
            arg.token(), String.format("Duplicate argument '%s' in '%s'.", arg.name(), def.name()));
      }
      checkDefault(arg);
    }
    names.clear();
    for (AST.Arg ret : def.returns()) {
      if (!names.add(ret.name())) {
        logError(
            ret.token(), String.format("Duplicate output '%s' in '%s'.", ret.name(), def.name()));
      }
      checkDefault(ret);
    }
  }

  private void checkDefault(AST.Arg arg) {
    if (arg.defaultValue().isPresent()
        && !ConstantFolder.fold(arg.defaultValue().get()).isPresent()) {
      logError(
          arg.defaultValue().get().token(),
          String.format("Default value of '%s' must be a constant.", arg.name()));
    }
  }

  private void checkTargets(List<Optional<AST.Name>> targets) {
    Set<String> seen = new HashSet<>();
    for (Optional<AST.Name> target : targets) {
      if (target.isPresent() && !seen.add(target.get().id())) {
        logError(
            target.get().token(),
            String.format("'%s' is assigned more than once.", target.get().id()));
      }
    }
  }
}
