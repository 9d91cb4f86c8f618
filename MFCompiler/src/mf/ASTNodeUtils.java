package mf;

import java.util.Optional;

/** Child traversal helpers called from the generated {@code visitChildren} methods. */
public final class ASTNodeUtils {
  public static <V> V accept(ASTNodeInterface node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  // Children are visited in source order.
  public static <V> V accept(
      Iterable<? extends ASTNodeInterface> nodes, ASTVisitor<V> visitor, V value) {
    for (ASTNodeInterface node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Optional<? extends ASTNodeInterface> node, ASTVisitor<V> visitor, V value) {
    if (!node.isPresent()) {
      return value;
    }
    return accept(node.get(), visitor, value);
  }

  private ASTNodeUtils() {}
}
