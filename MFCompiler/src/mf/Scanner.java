package mf;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Produces the token stream of a formula source.
 *
 * <p>Malformed input never throws; it yields {@link Token.Type#ERROR} tokens carrying a message,
 * and the parser reports them. Once the end of input is reached every further call returns an
 * {@link Token.Type#EOF} token.
 */
public class Scanner {
  private static final ImmutableMap<String, Token.Type> KEYWORDS =
      ImmutableMap.<String, Token.Type>builder()
          .put("out", Token.Type.OUT)
          .put("function", Token.Type.FUNCTION)
          .put("nodegroup", Token.Type.NODEGROUP)
          .put("loop", Token.Type.LOOP)
          .put("not", Token.Type.NOT)
          .put("and", Token.Type.AND)
          .put("or", Token.Type.OR)
          .put("true", Token.Type.TRUE)
          .put("false", Token.Type.FALSE)
          .build();

  /** Opening delimiter of a node group reference, {@code @"Group Name"}. */
  public static final String GROUP_NAME_PREFIX = "@\"";

  public static final char HOST_EXPRESSION_MARKER = '#';

  private final String source;

  private int start = 0;
  private int current = 0;
  private int line = 1;
  private int column = 1;
  private int startLine = 1;
  private int startColumn = 1;

  public Scanner(String source) {
    this.source = source;
  }

  /** Scans the whole source. The last token is the only {@link Token.Type#EOF}. */
  public ImmutableList<Token> scanTokens() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Token token;
    do {
      token = scanToken();
      tokens.add(token);
    } while (!token.is(Token.Type.EOF));
    return tokens.build();
  }

  public Token scanToken() {
    skipWhitespaceAndComments();
    start = current;
    startLine = line;
    startColumn = column;
    if (isAtEnd()) {
      return make(Token.Type.EOF);
    }

    char c = advance();
    if (isAlpha(c)) {
      return identifier();
    }
    if (isDigit(c)) {
      return number();
    }

    switch (c) {
      case '(':
        return make(Token.Type.LEFT_PAREN);
      case ')':
        return make(Token.Type.RIGHT_PAREN);
      case '[':
        return make(Token.Type.LEFT_SQUARE_BRACKET);
      case ']':
        return make(Token.Type.RIGHT_SQUARE_BRACKET);
      case '{':
        return make(Token.Type.LEFT_BRACE);
      case '}':
        return make(Token.Type.RIGHT_BRACE);
      case ',':
        return make(Token.Type.COMMA);
      case '.':
        return make(Token.Type.DOT);
      case ';':
        return make(Token.Type.SEMICOLON);
      case ':':
        return make(Token.Type.COLON);
      case '+':
        return make(Token.Type.PLUS);
      case '^':
        return make(Token.Type.HAT);
      case '/':
        return make(Token.Type.SLASH);
      case '%':
        return make(Token.Type.PERCENT);
      case '-':
        return make(match('>') ? Token.Type.ARROW : Token.Type.MINUS);
      case '*':
        return make(match('*') ? Token.Type.STAR_STAR : Token.Type.STAR);
      case '=':
        return make(match('=') ? Token.Type.EQUAL_EQUAL : Token.Type.EQUAL);
      case '<':
        return make(match('=') ? Token.Type.LESS_EQUAL : Token.Type.LESS);
      case '>':
        return make(match('=') ? Token.Type.GREATER_EQUAL : Token.Type.GREATER);
      case '!':
        if (match('=')) {
          return make(Token.Type.BANG_EQUAL);
        }
        return error("Expected \"=\" after \"!\".");
      case '"':
        return string();
      case '@':
        if (match('"') && string().is(Token.Type.STRING)) {
          return make(Token.Type.GROUP_NAME);
        }
        return error("Expected a quoted node group name after \"@\".");
      case HOST_EXPRESSION_MARKER:
        return hostExpression();
      default:
        return error(String.format("Unexpected character \"%c\".", c));
    }
  }

  private Token identifier() {
    while (isAlpha(peek()) || isDigit(peek())) {
      advance();
    }
    String text = source.substring(start, current);
    if (text.equals("_")) {
      return make(Token.Type.UNDERSCORE);
    }
    return make(KEYWORDS.getOrDefault(text, Token.Type.IDENTIFIER));
  }

  private Token number() {
    boolean isFloat = false;
    while (isDigit(peek())) {
      advance();
    }
    // "2.x" is the integer 2 followed by an attribute access.
    if (peek() == '.' && isDigit(peekNext())) {
      isFloat = true;
      advance();
      while (isDigit(peek())) {
        advance();
      }
    }
    if (peek() == 'e' || peek() == 'E') {
      int exponentLength = 1;
      if (peekAt(1) == '+' || peekAt(1) == '-') {
        exponentLength++;
      }
      if (isDigit(peekAt(exponentLength))) {
        isFloat = true;
        for (int i = 0; i < exponentLength; i++) {
          advance();
        }
        while (isDigit(peek())) {
          advance();
        }
      }
    }
    return make(isFloat ? Token.Type.FLOAT : Token.Type.INT);
  }

  // The lexeme keeps its quotes.
  private Token string() {
    while (!isAtEnd() && peek() != '"' && peek() != '\n') {
      advance();
    }
    if (isAtEnd() || peek() == '\n') {
      return error("Unterminated string.");
    }
    advance();
    return make(Token.Type.STRING);
  }

  // #(...) with balanced parentheses; the payload is evaluated by the parser.
  private Token hostExpression() {
    if (!match('(')) {
      return error("Expected \"(\" after \"#\".");
    }
    int depth = 1;
    while (depth > 0) {
      if (isAtEnd()) {
        return error("Unterminated embedded expression.");
      }
      char c = advance();
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      }
    }
    return make(Token.Type.HOST_EXPRESSION);
  }

  private void skipWhitespaceAndComments() {
    while (!isAtEnd()) {
      char c = peek();
      switch (c) {
        case ' ':
        case '\t':
        case '\r':
        case '\n':
          advance();
          break;
        case '/':
          if (peekNext() == '/') {
            while (!isAtEnd() && peek() != '\n') {
              advance();
            }
          } else if (peekNext() == '*') {
            advance();
            advance();
            while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
              advance();
            }
            if (!isAtEnd()) {
              advance();
              advance();
            }
          } else {
            return;
          }
          break;
        default:
          return;
      }
    }
  }

  private Token make(Token.Type type) {
    return Token.create(source.substring(start, current), type, startLine, startColumn, start);
  }

  private Token error(String message) {
    return Token.error(source.substring(start, current), message, startLine, startColumn, start);
  }

  private boolean isAtEnd() {
    return current >= source.length();
  }

  private char advance() {
    char c = source.charAt(current++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private boolean match(char expected) {
    if (isAtEnd() || source.charAt(current) != expected) {
      return false;
    }
    advance();
    return true;
  }

  private char peek() {
    return peekAt(0);
  }

  private char peekNext() {
    return peekAt(1);
  }

  private char peekAt(int offset) {
    int index = current + offset;
    return index < source.length() ? source.charAt(index) : '\0';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }
}
