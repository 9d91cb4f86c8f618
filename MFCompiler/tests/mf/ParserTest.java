package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ParserTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private Parser.Result parse() {
    return Parser.parse(file.toString());
  }

  private void assertParsesAs(String expected, String... lines) throws CompilerException {
    String source = String.join("\n", lines);
    assertThat(AstPrinter.print(Compiler.parse(source))).isEqualTo(expected);
  }

  private void assertErrors(String errorSubstr, String... lines) {
    String source = String.join("\n", lines);
    CompilerException ex = assertThrows(CompilerException.class, () -> Compiler.parse(source));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  @Test
  public void precedence() throws CompilerException {
    assertParsesAs("x = (1 + (2 * (3 ^ 2)))", "x = 1 + 2 * 3 ^ 2;");
    assertParsesAs("x = ((1 - 2) - 3)", "x = 1 - 2 - 3;");
    assertParsesAs("x = ((a < b) or ((c == d) and e))", "x = a < b or c == d and e;");
  }

  @Test
  public void exponentIsLeftAssociative() throws CompilerException {
    assertParsesAs("((2 ^ 3) ^ 2)", "2^3^2");
    assertParsesAs("((2 ^ 3) ^ 2)", "2 ** 3 ** 2");
  }

  @Test
  public void unaryOperators() throws CompilerException {
    assertParsesAs("x = (-(2 ^ 2))", "x = -2 ^ 2;");
    assertParsesAs("x = (2 * (-y))", "x = 2 * -y;");
    assertParsesAs("x = ((not a) and b)", "x = not a and b;");
  }

  @Test
  public void literals() throws CompilerException {
    assertParsesAs(
        "a = 1.5\nb = true\nc = \"text\"\nd = [1, 2]\ne = {1, 2, _}\nf = {_, _, _}",
        "a = 1.5;",
        "b = true;",
        "c = \"text\";",
        "d = [1, 2];",
        "e = {1, 2};",
        "f = {};");
  }

  @Test
  public void hostExpressionIsFolded() throws CompilerException {
    assertParsesAs("x = 6.0", "x = #(2 * 3);");
  }

  @Test
  public void calls() throws CompilerException {
    assertParsesAs("x = f(1, b=2).x", "x = f(1, b=2).x;");
    assertParsesAs("x = v.normalize()", "x = v.normalize();");
    assertParsesAs("x = @\"My Group\"(size=2)", "x = @\"My Group\"(size=2);");
  }

  @Test
  public void methodCallKeepsReceiver() throws CompilerException {
    AST.Module module = Compiler.parse("v.scale(2);");

    AST.Call call = (AST.Call) ((AST.ExprStatement) module.body().get(0)).expr();
    assertThat(call.isGroupReference()).isFalse();
    assertThat(call.func()).isInstanceOf(AST.Attribute.class);
    assertThat(((AST.Attribute) call.func()).attr()).isEqualTo("scale");
    assertThat(call.args()).hasSize(1);
  }

  @Test
  public void joinGeometryTakesAList() throws CompilerException {
    assertParsesAs("g = join_geometry([a, b, c])", "g = join_geometry(a, b, c);");
    assertParsesAs("g = join_geometry(a)", "g = join_geometry(a);");
    assertParsesAs("g = join_geometry([a, b])", "g = join_geometry([a, b]);");
  }

  @Test
  public void assignments() throws CompilerException {
    assertParsesAs("a, _, c = position()", "a, _, c = position();");
    assertParsesAs("out x, _ = f()", "out x, _ = f();");
    assertParsesAs("out y = 1\nz = 2", "out y = 1", "z = 2");
  }

  @Test
  public void definitions() throws CompilerException {
    println("function f(a: float = 1, b: vec3) -> r: float {");
    println("  out r = a;");
    println("}");
    println("nodegroup \"Two Words\"(g: geometry) -> g: geo {}");

    assertThat(AstPrinter.print(Compiler.parse(file.toString())))
        .isEqualTo(
            "function f(a: float = 1, b: vec3) -> r: float { out r = a }\n"
                + "nodegroup \"Two Words\"(g: geo) -> g: geo {}");
  }

  @Test
  public void loops() throws CompilerException {
    assertParsesAs("loop i = 0 -> 3 { x = i }", "loop i = 0 -> 3 { x = i; }");
    assertParsesAs("loop 1 -> 3 {}", "loop 3 {}");
    assertParsesAs("loop i = 2 -> -2 {}", "loop i = 2 -> -2 {}");
  }

  @Test
  public void recoversAtStatementBoundaries() {
    println("x = 1 +;");
    println("y = 2;");
    println("z = * 3;");

    Parser.Result result = parse();

    assertThat(result.diagnostics()).hasSize(2);
    assertThat(result.diagnostics().get(0).format())
        .isEqualTo("line:1:8: Error at \";\": Expect expression.");
    assertThat(result.diagnostics().get(1).format())
        .isEqualTo("line:3:5: Error at \"*\": Expect expression.");
    assertThat(AstPrinter.print(result.module())).isEqualTo("y = 2");
  }

  @Test
  public void scannerErrorsAreReported() {
    println("x = $;");

    Parser.Result result = parse();

    assertThat(result.hasErrors()).isTrue();
    assertThat(result.diagnostics().get(0).format())
        .isEqualTo("line:1:5: Error: Unexpected character \"$\".");
  }

  @Test
  public void errorAtEnd() {
    println("x = (1 + 2");

    Parser.Result result = parse();

    assertThat(result.diagnostics()).hasSize(1);
    assertThat(result.diagnostics().get(0).format()).startsWith("line:2:1: Error at end:");
  }

  @Test
  public void errors() {
    assertErrors("No positional arguments allowed after keyword argument.", "f(a=1, 2);");
    assertErrors("Invalid assignment target.", "1 + 2 = 3;");
    assertErrors("Expect variable name or \"_\" after \"out\".", "out = 1;");
    assertErrors("Invalid data type: thing.", "function f(a: thing) {}");
    assertErrors("Integer literal is too large.", "x = 99999999999;");
    assertErrors("Expect closing \")\" after expression.", "x = (1 + 2;");
    assertErrors("Expect loop body.", "loop 3 x = 1;");
    assertErrors("Invalid embedded expression", "x = #(nope(1));");
  }
}
