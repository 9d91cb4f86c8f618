package mf;

/** The two kinds of node tree a formula can be built into. */
public enum TreeType {
  GEOMETRY("GeometryNodeTree", "GeometryNodeGroup", "_gn", "cache_gn"),
  SHADER("ShaderNodeTree", "ShaderNodeGroup", "_sh", "cache_sh");

  private final String treeId;
  private final String groupNodeId;
  private final String fileSuffix;
  private final String cacheFileName;

  private TreeType(String treeId, String groupNodeId, String fileSuffix, String cacheFileName) {
    this.treeId = treeId;
    this.groupNodeId = groupNodeId;
    this.fileSuffix = fileSuffix;
    this.cacheFileName = cacheFileName;
  }

  public String treeId() {
    return treeId;
  }

  /** Node type id of a node that references a node group of this tree type. */
  public String groupNodeId() {
    return groupNodeId;
  }

  /** Library files whose name ends with this suffix are only compiled for this tree type. */
  public String fileSuffix() {
    return fileSuffix;
  }

  public String cacheFileName() {
    return cacheFileName;
  }
}
