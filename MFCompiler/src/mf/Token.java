package mf;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A lexeme produced by the {@link Scanner}. Lines and columns are 1-based. */
@AutoValue
public abstract class Token {
  public enum Type {
    // Structure.
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_SQUARE_BRACKET,
    RIGHT_SQUARE_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    DOT,
    SEMICOLON,
    COLON,
    ARROW,
    UNDERSCORE,

    // Operators.
    EQUAL,
    EQUAL_EQUAL,
    BANG_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    PLUS,
    MINUS,
    STAR,
    STAR_STAR,
    HAT,
    SLASH,
    PERCENT,

    // Literals.
    INT,
    FLOAT,
    STRING,
    TRUE,
    FALSE,
    HOST_EXPRESSION,
    GROUP_NAME,

    // Keywords.
    OUT,
    FUNCTION,
    NODEGROUP,
    LOOP,
    NOT,
    AND,
    OR,

    IDENTIFIER,
    ERROR,
    EOF;
  }

  public abstract String lexeme();

  public abstract Type type();

  public abstract int line();

  public abstract int column();

  /** 0-based offset of the first character in the source. */
  public abstract int start();

  /** Set for {@link Type#ERROR} tokens only. */
  public abstract Optional<String> error();

  public boolean is(Type type) {
    return type() == type;
  }

  public static Token create(String lexeme, Type type, int line, int column, int start) {
    return new AutoValue_Token(lexeme, type, line, column, start, Optional.empty());
  }

  public static Token error(String lexeme, String message, int line, int column, int start) {
    return new AutoValue_Token(lexeme, Type.ERROR, line, column, start, Optional.of(message));
  }

  /** A token that doesn't come from any source text, e.g. for synthesized nodes. */
  public static Token synthetic(String lexeme) {
    return create(lexeme, Type.IDENTIFIER, 0, 0, -1);
  }

  @Override
  public final String toString() {
    return type() + " '" + lexeme() + "' " + line() + ":" + column();
  }
}
