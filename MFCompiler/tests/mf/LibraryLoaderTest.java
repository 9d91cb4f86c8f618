package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class LibraryLoaderTest {

  @TempDir File dir;

  private void write(String name, String... lines) throws IOException {
    Files.asCharSink(new File(dir, name), StandardCharsets.UTF_8)
        .write(String.join("\n", lines));
  }

  private static Value.Constant defaultOf(Library library, String function, String input) {
    Definition definition = library.lookup(function).get();
    return definition.inputs().get(definition.inputIndex(input).get()).defaultValue().get();
  }

  @Test
  public void defaults() throws IOException {
    LibraryLoader.Result result = LibraryLoader.loadDefaults();

    assertThat(result.errors()).isEmpty();
    assertThat(result.hasErrors()).isFalse();
    assertThat(result.fromCache()).isFalse();
    Library geometry = result.library(TreeType.GEOMETRY);
    Library shader = result.library(TreeType.SHADER);
    assertThat(geometry.lookup("lerp")).isPresent();
    assertThat(geometry.lookup("lift")).isPresent();
    assertThat(geometry.lookup("Scaled Cube").get().isNodegroup()).isTrue();
    assertThat(shader.lookup("lerp")).isPresent();
    assertThat(shader.lookup("lift")).isEmpty();
  }

  @Test
  public void customDefinitionsOverrideDefaults() throws IOException {
    write(
        "custom.mf",
        "function lerp(a: float, b: float, t: float = 0.25) -> result: float {",
        "  out result = a + (b - a) * t;",
        "}");

    LibraryLoader.Result result = LibraryLoader.load(Optional.of(dir), false);

    assertThat(result.hasErrors()).isFalse();
    for (TreeType treeType : TreeType.values()) {
      assertThat(defaultOf(result.library(treeType), "lerp", "t"))
          .isEqualTo(Value.Constant.of(0.25));
    }
    assertThat(new File(dir, "cache_gn").isFile()).isTrue();
    assertThat(new File(dir, "cache_sh").isFile()).isTrue();
  }

  @Test
  public void suffixSelectsTreeType() throws IOException {
    write("tint_sh.mf", "function tint(x: float = 0) -> r: float { out r = x * 0.5; }");
    write("bend_gn", "function bend(g: geo) -> g2: geo { out g2 = g; }");

    LibraryLoader.Result result = LibraryLoader.load(Optional.of(dir), false);

    assertThat(result.library(TreeType.SHADER).lookup("tint")).isPresent();
    assertThat(result.library(TreeType.GEOMETRY).lookup("tint")).isEmpty();
    assertThat(result.library(TreeType.GEOMETRY).lookup("bend")).isPresent();
    assertThat(result.library(TreeType.SHADER).lookup("bend")).isEmpty();
  }

  @Test
  public void laterFilesSeeEarlierOnes() throws IOException {
    write("a.mf", "function twice(x: float = 0) -> r: float { out r = x * 2; }");
    write("b.mf", "function quad(x: float = 0) -> r: float { out r = twice(twice(x)); }");

    LibraryLoader.Result result = LibraryLoader.load(Optional.of(dir), false);

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.library(TreeType.GEOMETRY).lookup("quad")).isPresent();
  }

  @Test
  public void secondLoadUsesTheCache() throws IOException {
    write("custom.mf", "function twice(x: float = 0) -> r: float { out r = x * 2; }");
    LibraryLoader.Result first = LibraryLoader.load(Optional.of(dir), false);

    LibraryLoader.Result second = LibraryLoader.load(Optional.of(dir), false);
    LibraryLoader.Result forced = LibraryLoader.load(Optional.of(dir), true);

    assertThat(second.fromCache()).isTrue();
    assertThat(forced.fromCache()).isFalse();
    for (TreeType treeType : TreeType.values()) {
      assertThat(second.library(treeType).definitions())
          .isEqualTo(first.library(treeType).definitions());
    }
  }

  @Test
  public void corruptCacheIsRebuilt() throws IOException {
    write("cache_gn", "garbage");
    write("cache_sh", "garbage");

    LibraryLoader.Result result = LibraryLoader.load(Optional.of(dir), false);

    assertThat(result.hasErrors()).isFalse();
    assertThat(result.fromCache()).isFalse();
    assertThat(LibraryCache.read(Files.toByteArray(new File(dir, "cache_gn"))).treeType())
        .isEqualTo(TreeType.GEOMETRY);
  }

  @Test
  public void anyErrorFailsTheWholeLoad() throws IOException {
    write("good.mf", "function twice(x: float = 0) -> r: float { out r = x * 2; }");
    write("bad.mf", "x = 1;");

    LibraryLoader.Result result = LibraryLoader.load(Optional.of(dir), false);

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.libraries()).isEmpty();
    assertThat(result.errors().keySet()).containsExactly("bad.mf");
    assertThat(result.errors().get("bad.mf").get(0).message())
        .isEqualTo("Library files can only contain function definitions.");
    assertThat(new File(dir, "cache_gn").exists()).isFalse();
    assertThrows(IllegalStateException.class, () -> result.library(TreeType.GEOMETRY));
  }

  @Test
  public void treeTypesOf() {
    assertThat(LibraryLoader.treeTypesOf("x_gn.mf")).containsExactly(TreeType.GEOMETRY);
    assertThat(LibraryLoader.treeTypesOf("x_sh")).containsExactly(TreeType.SHADER);
    assertThat(LibraryLoader.treeTypesOf("x_gn.txt"))
        .containsExactly(TreeType.GEOMETRY, TreeType.SHADER);
    assertThat(LibraryLoader.treeTypesOf("x.mf"))
        .containsExactly(TreeType.GEOMETRY, TreeType.SHADER);
  }
}
