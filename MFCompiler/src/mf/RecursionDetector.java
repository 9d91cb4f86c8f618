package mf;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/** Rejects definitions that call themselves, directly or through other definitions. */
class RecursionDetector extends ErrorCollectingValidator {
  private final MutableGraph<String> edges = GraphBuilder.directed().allowsSelfLoops(true).build();
  private final Map<String, AST.Definition> definitions = new HashMap<>();
  private Optional<AST.Definition> current = Optional.empty();

  @Override
  public void visitImpl(AST.FunctionDef def) {
    enter(def);
    super.visitImpl(def);
    current = Optional.empty();
  }

  @Override
  public void visitImpl(AST.NodegroupDef def) {
    enter(def);
    super.visitImpl(def);
    current = Optional.empty();
  }

  private void enter(AST.Definition def) {
    definitions.put(def.name(), def);
    edges.addNode(def.name());
    current = Optional.of(def);
  }

  @Override
  public void visitImpl(AST.Call call) {
    if (current.isPresent()) {
      edges.putEdge(current.get().name(), calleeName(call));
    }
    super.visitImpl(call);
  }

  static String calleeName(AST.Call call) {
    if (call.func() instanceof AST.Attribute) {
      return ((AST.Attribute) call.func()).attr();
    }
    return ((AST.Name) call.func()).id();
  }

  @Override
  protected void finish() {
    detectCycles(
        edges,
        node -> {
          AST.Definition def = definitions.get(node);
          logError(
              def.token(),
              String.format(
                  "%s '%s' is recursive and can never be fully expanded",
                  def.isNodegroup() ? "node group" : "function",
                  node));
        });
  }
}
