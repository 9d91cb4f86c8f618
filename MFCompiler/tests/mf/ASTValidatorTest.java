package mf;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ASTValidatorTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<String> errors() throws CompilerException {
    return new ASTValidator(Compiler.parse(file.toString()))
        .computeErrors().stream()
            .map(Diagnostic::message)
            .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void validProgram() throws CompilerException {
    println("function double(x: float = 0) -> r: float { out r = x * 2; }");
    println("function quad(x: float = 0) -> r: float { out r = double(double(x)); }");
    println("loop i = 1 -> 3 { y = quad(i); }");
    println("a, _, c = position();");

    assertThat(errors()).isEmpty();
  }

  @Test
  public void directRecursion() throws CompilerException {
    println("function f(x: float = 0) -> r: float {");
    println("  out r = f(x);");
    println("}");

    assertThat(errors())
        .containsExactly("function 'f' is recursive and can never be fully expanded");
  }

  @Test
  public void mutualRecursion() throws CompilerException {
    println("function f(x: float = 0) -> r: float { out r = g(x); }");
    println("function g(x: float = 0) -> r: float { out r = x.f(); }");
    println("function h(x: float = 0) -> r: float { out r = f(x); }");

    assertThat(errors())
        .containsExactly(
            "function 'f' is recursive and can never be fully expanded",
            "function 'g' is recursive and can never be fully expanded");
  }

  @Test
  public void recursiveNodeGroup() throws CompilerException {
    println("nodegroup \"Tower\"(g: geo) -> g: geo {");
    println("  out g = @\"Tower\"(g);");
    println("}");

    assertThat(errors())
        .containsExactly("node group 'Tower' is recursive and can never be fully expanded");
  }

  @Test
  public void definitionsOnlyAtTopLevel() throws CompilerException {
    println("function f() {");
    println("  function g() {}");
    println("}");
    println("loop 2 {");
    println("  nodegroup n() {}");
    println("}");

    assertThat(errors())
        .containsExactly(
            "A function can only be defined at the top level.",
            "A node group can only be defined at the top level.");
  }

  @Test
  public void duplicateNames() throws CompilerException {
    println("function f(a: float = 0, a: int = 1) -> r: float, r: vec3 {}");

    assertThat(errors())
        .containsExactly("Duplicate argument 'a' in 'f'.", "Duplicate output 'r' in 'f'.");
  }

  @Test
  public void defaultsMustBeConstant() throws CompilerException {
    println("function f(a: float = -1, b: vec3 = {1, -2}, c: float = 1 + x) {}");

    assertThat(errors()).containsExactly("Default value of 'c' must be a constant.");
  }

  @Test
  public void targetAssignedTwice() throws CompilerException {
    println("a, b, a = position();");
    println("out c, _, _, c = f();");

    assertThat(errors())
        .containsExactly("'a' is assigned more than once.", "'c' is assigned more than once.");
  }

  @Test
  public void recursionNotCheckedAfterDefinitionErrors() throws CompilerException {
    println("function f(a: float = 0, a: float = 0) { f(1, 2); }");

    assertThat(errors()).containsExactly("Duplicate argument 'a' in 'f'.");
  }
}
