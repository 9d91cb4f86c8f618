package mf;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * The definitions formulas of one tree type can call. A later definition replaces an earlier one
 * of the same name, which is how custom libraries override the defaults.
 */
public final class Library {
  private final TreeType treeType;
  private final Map<String, Definition> definitions = new LinkedHashMap<>();

  public Library(TreeType treeType) {
    this.treeType = treeType;
  }

  public TreeType treeType() {
    return treeType;
  }

  public Optional<Definition> lookup(String name) {
    return Optional.ofNullable(definitions.get(name));
  }

  public void define(Definition definition) {
    definitions.remove(definition.name());
    definitions.put(definition.name(), definition);
  }

  /** All definitions, oldest first. */
  public ImmutableList<Definition> definitions() {
    return ImmutableList.copyOf(definitions.values());
  }

  public Library copy() {
    Library copy = new Library(treeType);
    copy.definitions.putAll(definitions);
    return copy;
  }
}
