package mf;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;
import com.google.common.io.Resources;

/**
 * Builds the libraries of both tree types: the bundled defaults first, then the custom directory
 * in file name order, so custom definitions replace defaults of the same name.
 *
 * <p>A file whose name ends in {@code _gn} is only compiled for geometry trees, {@code _sh} only
 * for shader trees, anything else for both. A trailing {@code .mf} is ignored for this. Files
 * whose names start with {@code cache} are the compiled caches and are never parsed.
 */
public final class LibraryLoader {
  private LibraryLoader() {}

  /** Bundled sources, relative to this class. */
  static final ImmutableList<String> DEFAULT_LIBRARIES =
      ImmutableList.of("stdlib/default_implementations.mf", "stdlib/geometry_gn.mf");

  private static final String CACHE_PREFIX = "cache";
  private static final String EXTENSION = ".mf";

  @AutoValue
  public abstract static class Result {
    /** Empty if there were errors. */
    public abstract ImmutableMap<TreeType, Library> libraries();

    /** Diagnostics by file name, in load order. */
    public abstract ImmutableListMultimap<String, Diagnostic> errors();

    public abstract boolean fromCache();

    public boolean hasErrors() {
      return !errors().isEmpty();
    }

    public Library library(TreeType treeType) {
      Preconditions.checkState(!hasErrors(), "Libraries failed to load");
      return libraries().get(treeType);
    }

    public void printErrors() {
      for (String file : errors().keySet()) {
        System.out.println("Errors in " + file);
        errors().get(file).forEach(Diagnostic::print);
      }
    }

    static Result create(
        Map<TreeType, Library> libraries,
        ImmutableListMultimap<String, Diagnostic> errors,
        boolean fromCache) {
      return new AutoValue_LibraryLoader_Result(
          ImmutableMap.copyOf(libraries), errors, fromCache);
    }
  }

  /** Loads the bundled defaults only. */
  public static Result loadDefaults() throws IOException {
    return load(Optional.empty(), false);
  }

  /**
   * Loads the libraries, reading the caches in {@code customDir} unless {@code forceUpdate} or a
   * cache is missing or unreadable. A successful compile rewrites both caches.
   */
  public static Result load(Optional<File> customDir, boolean forceUpdate) throws IOException {
    if (customDir.isPresent() && !forceUpdate) {
      Optional<Map<TreeType, Library>> cached = readCaches(customDir.get());
      if (cached.isPresent()) {
        return Result.create(cached.get(), ImmutableListMultimap.of(), true);
      }
    }

    Map<TreeType, Library> libraries = new EnumMap<>(TreeType.class);
    for (TreeType treeType : TreeType.values()) {
      libraries.put(treeType, new Library(treeType));
    }
    ImmutableListMultimap.Builder<String, Diagnostic> errors = ImmutableListMultimap.builder();
    for (String resource : DEFAULT_LIBRARIES) {
      String source =
          Resources.toString(
              Resources.getResource(LibraryLoader.class, resource), StandardCharsets.UTF_8);
      compileFile(new File(resource).getName(), source, libraries, errors);
    }
    if (customDir.isPresent()) {
      for (File file : sourceFiles(customDir.get())) {
        String source = Files.asCharSource(file, StandardCharsets.UTF_8).read();
        compileFile(file.getName(), source, libraries, errors);
      }
    }

    ImmutableListMultimap<String, Diagnostic> allErrors = errors.build();
    if (!allErrors.isEmpty()) {
      return Result.create(ImmutableMap.of(), allErrors, false);
    }
    if (customDir.isPresent()) {
      for (Library library : libraries.values()) {
        File cache = new File(customDir.get(), library.treeType().cacheFileName());
        Files.asByteSink(cache).write(LibraryCache.write(library));
      }
    }
    return Result.create(libraries, allErrors, false);
  }

  private static void compileFile(
      String fileName,
      String source,
      Map<TreeType, Library> libraries,
      ImmutableListMultimap.Builder<String, Diagnostic> errors) {
    for (TreeType treeType : treeTypesOf(fileName)) {
      try {
        Compiler.compileLibrary(libraries.get(treeType), source);
      } catch (CompilerException ex) {
        errors.putAll(fileName, ex.diagnostics());
      }
    }
  }

  static ImmutableList<TreeType> treeTypesOf(String fileName) {
    String base =
        fileName.endsWith(EXTENSION)
            ? fileName.substring(0, fileName.length() - EXTENSION.length())
            : fileName;
    for (TreeType treeType : TreeType.values()) {
      if (base.endsWith(treeType.fileSuffix())) {
        return ImmutableList.of(treeType);
      }
    }
    return ImmutableList.copyOf(TreeType.values());
  }

  private static List<File> sourceFiles(File dir) throws IOException {
    File[] files = dir.listFiles();
    if (files == null) {
      throw new IOException("Not a readable directory: " + dir);
    }
    return Arrays.stream(files)
        .filter(f -> f.isFile() && !f.isHidden() && !f.getName().startsWith(CACHE_PREFIX))
        .sorted(Comparator.comparing(File::getName))
        .collect(Collectors.toList());
  }

  // Both caches, or nothing.
  private static Optional<Map<TreeType, Library>> readCaches(File dir) {
    Map<TreeType, Library> libraries = new EnumMap<>(TreeType.class);
    for (TreeType treeType : TreeType.values()) {
      File cache = new File(dir, treeType.cacheFileName());
      if (!cache.isFile()) {
        return Optional.empty();
      }
      Library library;
      try {
        library = LibraryCache.read(Files.toByteArray(cache));
      } catch (IOException ex) {
        // Stale or corrupt; compile the sources instead.
        return Optional.empty();
      }
      if (library.treeType() != treeType) {
        return Optional.empty();
      }
      libraries.put(treeType, library);
    }
    return Optional.of(libraries);
  }
}
