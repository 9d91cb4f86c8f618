package mf;

import static com.google.common.truth.Truth.assertThat;

import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ScannerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Token> scan() {
    return new Scanner(file.toString()).scanTokens();
  }

  private static ImmutableList<Token.Type> types(ImmutableList<Token> tokens) {
    return tokens.stream().map(Token::type).collect(ImmutableList.toImmutableList());
  }

  private static String lexemes(ImmutableList<Token> tokens) {
    return tokens.stream().map(Token::lexeme).collect(Collectors.joining(" ")).trim();
  }

  @Test
  public void emptyFile() {
    ImmutableList<Token> tokens = scan();

    assertThat(types(tokens)).containsExactly(Token.Type.EOF);
    assertThat(tokens.get(0).line()).isEqualTo(1);
    assertThat(tokens.get(0).column()).isEqualTo(1);
  }

  @Test
  public void eofRepeats() {
    Scanner scanner = new Scanner("x");

    assertThat(scanner.scanToken().type()).isEqualTo(Token.Type.IDENTIFIER);
    assertThat(scanner.scanToken().type()).isEqualTo(Token.Type.EOF);
    assertThat(scanner.scanToken().type()).isEqualTo(Token.Type.EOF);
  }

  @Test
  public void operators() {
    println("( ) [ ] { } , . ; : -> _ = == != < <= > >= + - * ** ^ / %");

    assertThat(types(scan()))
        .containsExactly(
            Token.Type.LEFT_PAREN,
            Token.Type.RIGHT_PAREN,
            Token.Type.LEFT_SQUARE_BRACKET,
            Token.Type.RIGHT_SQUARE_BRACKET,
            Token.Type.LEFT_BRACE,
            Token.Type.RIGHT_BRACE,
            Token.Type.COMMA,
            Token.Type.DOT,
            Token.Type.SEMICOLON,
            Token.Type.COLON,
            Token.Type.ARROW,
            Token.Type.UNDERSCORE,
            Token.Type.EQUAL,
            Token.Type.EQUAL_EQUAL,
            Token.Type.BANG_EQUAL,
            Token.Type.LESS,
            Token.Type.LESS_EQUAL,
            Token.Type.GREATER,
            Token.Type.GREATER_EQUAL,
            Token.Type.PLUS,
            Token.Type.MINUS,
            Token.Type.STAR,
            Token.Type.STAR_STAR,
            Token.Type.HAT,
            Token.Type.SLASH,
            Token.Type.PERCENT,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void keywordsAndIdentifiers() {
    println("out function nodegroup loop not and or true false outer _x x_1");

    assertThat(types(scan()))
        .containsExactly(
            Token.Type.OUT,
            Token.Type.FUNCTION,
            Token.Type.NODEGROUP,
            Token.Type.LOOP,
            Token.Type.NOT,
            Token.Type.AND,
            Token.Type.OR,
            Token.Type.TRUE,
            Token.Type.FALSE,
            Token.Type.IDENTIFIER,
            Token.Type.IDENTIFIER,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
  }

  @Test
  public void numbers() {
    println("12 1.5 2.x 1e3 2.5E-2 3e");

    ImmutableList<Token> tokens = scan();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.INT,
            Token.Type.FLOAT,
            Token.Type.INT,
            Token.Type.DOT,
            Token.Type.IDENTIFIER,
            Token.Type.FLOAT,
            Token.Type.FLOAT,
            Token.Type.INT,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
    assertThat(lexemes(tokens)).isEqualTo("12 1.5 2 . x 1e3 2.5E-2 3 e");
  }

  @Test
  public void stringsAndGroupNames() {
    println("\"hello world\" @\"My Group\"");

    ImmutableList<Token> tokens = scan();

    assertThat(types(tokens))
        .containsExactly(Token.Type.STRING, Token.Type.GROUP_NAME, Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(0).lexeme()).isEqualTo("\"hello world\"");
    assertThat(tokens.get(1).lexeme()).isEqualTo("@\"My Group\"");
  }

  @Test
  public void hostExpression() {
    println("#(sin(pi / 2) * 3) + 1");

    ImmutableList<Token> tokens = scan();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.HOST_EXPRESSION, Token.Type.PLUS, Token.Type.INT, Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(0).lexeme()).isEqualTo("#(sin(pi / 2) * 3)");
  }

  @Test
  public void comments() {
    println("a // line comment");
    println("/* block");
    println("   comment */ b");

    ImmutableList<Token> tokens = scan();

    assertThat(lexemes(tokens)).isEqualTo("a b");
    assertThat(tokens.get(1).line()).isEqualTo(3);
    assertThat(tokens.get(1).column()).isEqualTo(15);
  }

  @Test
  public void positions() {
    println("x = 1;");
    println("  out y = x;");

    ImmutableList<Token> tokens = scan();

    Token out = tokens.get(4);
    assertThat(out.type()).isEqualTo(Token.Type.OUT);
    assertThat(out.line()).isEqualTo(2);
    assertThat(out.column()).isEqualTo(3);
    assertThat(out.start()).isEqualTo(9);
  }

  @Test
  public void errors() {
    println("$ ! \"open");
    println("@x #oops");

    ImmutableList<Token> tokens = scan();

    assertThat(types(tokens))
        .containsExactly(
            Token.Type.ERROR,
            Token.Type.ERROR,
            Token.Type.ERROR,
            Token.Type.ERROR,
            Token.Type.IDENTIFIER,
            Token.Type.ERROR,
            Token.Type.IDENTIFIER,
            Token.Type.EOF)
        .inOrder();
    assertThat(tokens.get(0).error()).hasValue("Unexpected character \"$\".");
    assertThat(tokens.get(1).error()).hasValue("Expected \"=\" after \"!\".");
    assertThat(tokens.get(2).error()).hasValue("Unterminated string.");
    assertThat(tokens.get(3).error()).hasValue("Expected a quoted node group name after \"@\".");
    assertThat(tokens.get(5).error()).hasValue("Expected \"(\" after \"#\".");
  }
}
