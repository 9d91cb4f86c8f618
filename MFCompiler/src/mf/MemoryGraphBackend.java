package mf;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** A {@link GraphBackend} whose trees live in memory; used by the CLI and the tests. */
public final class MemoryGraphBackend implements GraphBackend {
  private final Map<String, MemoryNodeTree> nodeGroups = new LinkedHashMap<>();
  private final Set<String> treeKeys = new HashSet<>();

  // The tree name, suffixed like node names when another tree already has it.
  private String treeKey(String name) {
    String key = name;
    for (int i = 1; !treeKeys.add(key); i++) {
      key = String.format("%s.%03d", name, i);
    }
    return key;
  }

  /** Creates a top level tree to build a formula into. */
  public MemoryNodeTree createTree(String name, TreeType treeType) {
    return new MemoryNodeTree(
        name, treeKey(name), treeType, ImmutableList.of(), ImmutableList.of());
  }

  @Override
  public MemoryNodeTree createNodeGroup(
      String name,
      TreeType treeType,
      List<SocketDeclaration> inputs,
      List<SocketDeclaration> outputs) {
    Preconditions.checkArgument(
        !nodeGroups.containsKey(name), "Node group '%s' already exists", name);
    MemoryNodeTree tree = new MemoryNodeTree(name, treeKey(name), treeType, inputs, outputs);
    nodeGroups.put(name, tree);
    return tree;
  }

  public Optional<MemoryNodeTree> nodeGroup(String name) {
    return Optional.ofNullable(nodeGroups.get(name));
  }

  public ImmutableMap<String, MemoryNodeTree> nodeGroups() {
    return ImmutableMap.copyOf(nodeGroups);
  }

  /** How many inner trees were created, i.e. how many node group bodies were built. */
  public int nodeGroupCreations() {
    return nodeGroups.size();
  }
}
