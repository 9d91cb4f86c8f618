package mf;

import java.util.List;

/**
 * The host environment that owns node trees.
 *
 * <p>The interpreter only creates nodes and links through the {@link NodeTree} it is given, and
 * asks the backend for fresh inner trees when it builds a node group.
 */
public interface GraphBackend {
  /** Creates an empty inner tree with the given interface sockets. */
  NodeTree createNodeGroup(
      String name,
      TreeType treeType,
      List<SocketDeclaration> inputs,
      List<SocketDeclaration> outputs);
}
