package mf;

import com.google.common.collect.ImmutableList;

/** Runs every syntax tree check that doesn't need the definitions already in scope. */
public class ASTValidator extends ErrorCollectingValidator {

  private final AST.Module module;

  public ASTValidator(AST.Module module) {
    this.module = module;
  }

  public ImmutableList<Diagnostic> computeErrors() {
    if (!acceptAll(new DefinitionValidator())) return errors();

    acceptAll(new RecursionDetector());
    return errors();
  }

  private boolean acceptAll(ErrorCollectingValidator visitor) {
    visitor.validate(module);
    takeErrors(visitor);
    return !visitor.hasErrors();
  }
}
