package mf;

import com.google.auto.value.AutoValue;

/** A user-facing compile error tied to a source token. */
@AutoValue
public abstract class Diagnostic implements Comparable<Diagnostic> {
  public abstract int line();

  public abstract int column();

  /** The offending lexeme, or empty when the error is at the end of input or on an error token. */
  public abstract String lexeme();

  public abstract Token.Type tokenType();

  public abstract String message();

  public static Diagnostic at(Token token, String message) {
    return new AutoValue_Diagnostic(
        token.line(), token.column(), token.lexeme(), token.type(), message);
  }

  /** Renders as {@code line:L:C: Error at "lexeme": message}. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append("line:").append(line()).append(':').append(column()).append(": Error");
    switch (tokenType()) {
      case EOF:
        sb.append(" at end:");
        break;
      case ERROR:
        sb.append(':');
        break;
      default:
        sb.append(" at \"").append(lexeme()).append("\":");
        break;
    }
    return sb.append(' ').append(message()).toString();
  }

  public void print() {
    System.out.println(format());
  }

  @Override
  public int compareTo(Diagnostic other) {
    if (line() != other.line()) {
      return Integer.compare(line(), other.line());
    }
    return Integer.compare(column(), other.column());
  }

  @Override
  public final String toString() {
    return format();
  }
}
