package mf;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Verify;

/**
 * State shared by every call frame of one top level build: the backend, the inner trees of node
 * groups built so far, and the table of sockets by canonical identity.
 *
 * <p>Both tables only grow. A session belongs to a single build; concurrent builds each need their
 * own.
 */
public final class CompilationSession {
  private final GraphBackend backend;
  private final Map<String, NodeTree> nodeGroupTrees = new HashMap<>();
  private final Map<String, GraphSocket> socketTable = new HashMap<>();

  public CompilationSession(GraphBackend backend) {
    this.backend = backend;
  }

  public GraphBackend backend() {
    return backend;
  }

  public Optional<NodeTree> nodeGroupTree(String name) {
    return Optional.ofNullable(nodeGroupTrees.get(name));
  }

  void cacheNodeGroupTree(String name, NodeTree tree) {
    Verify.verify(
        !nodeGroupTrees.containsKey(name), "Node group '%s' was built more than once", name);
    nodeGroupTrees.put(name, tree);
  }

  void registerSocket(GraphSocket socket) {
    GraphSocket previous = socketTable.putIfAbsent(socket.identity(), socket);
    Verify.verify(
        previous == null || previous == socket, "Socket identity %s is not unique", socket);
  }

  public Optional<GraphSocket> lookupSocket(String identity) {
    return Optional.ofNullable(socketTable.get(identity));
  }
}
