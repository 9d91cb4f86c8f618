package mf;

import com.google.common.collect.ImmutableList;

/** A directed graph of nodes; either the formula's target tree or the inner tree of a group. */
public interface NodeTree {
  String name();

  TreeType treeType();

  /** Interface inputs; empty for a top level tree. */
  ImmutableList<SocketDeclaration> inputs();

  /** Interface outputs; empty for a top level tree. */
  ImmutableList<SocketDeclaration> outputs();

  /**
   * Adds a node of a known type.
   *
   * @throws IllegalArgumentException if the backend doesn't know {@code typeId}
   */
  GraphNode addNode(String typeId);

  /** Adds the node whose outputs are this tree's interface inputs. */
  GraphNode addGroupInput();

  /** Adds the node whose inputs are this tree's interface outputs. */
  GraphNode addGroupOutput();

  /** Adds a node that instantiates {@code inner}, with sockets mirroring its interface. */
  GraphNode addGroupReference(NodeTree inner);

  /** Links an output socket to an input socket, both of nodes in this tree. */
  void link(GraphSocket from, GraphSocket to);
}
