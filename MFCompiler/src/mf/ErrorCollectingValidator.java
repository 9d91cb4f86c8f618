package mf;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ForOverride;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<Diagnostic> errors = new ArrayList<>();

  protected ImmutableList<Diagnostic> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Token token, String msg) {
    logError(Diagnostic.at(token, msg));
  }

  protected void logError(Diagnostic diagnostic) {
    errors.add(diagnostic);
  }

  /** Visits the whole module, then runs {@link #finish()}. Returns true if nothing was logged. */
  final boolean validate(AST.Module module) {
    module.accept(this, null);
    finish();
    return !hasErrors();
  }

  /** Checks that need the whole module, run once after the visit. */
  @ForOverride
  protected void finish() {}

  /**
   * Calls {@code logError} once for every node of {@code graph} that lies on a cycle, self loops
   * included. Returns true if any did.
   */
  protected <T> boolean detectCycles(Graph<T> graph, Consumer<T> logError) {
    // transitiveClosure() adds a self loop to every node, so reachability is checked from each
    // direct successor instead.
    Graph<T> closure = Graphs.transitiveClosure(graph);
    boolean found = false;
    for (T node : graph.nodes()) {
      for (T next : graph.successors(node)) {
        if (closure.successors(next).contains(node)) {
          logError.accept(node);
          found = true;
          break;
        }
      }
    }
    return found;
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
