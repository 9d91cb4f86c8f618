package mf;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import com.google.common.collect.ImmutableMap;

/**
 * Folds an embedded numeric expression, {@code #(...)}, into a constant while parsing.
 *
 * <p>Only numbers, arithmetic ({@code + - * / // % **}), parentheses, a fixed set of math
 * constants and math functions are accepted; nothing else can be named or executed.
 */
public final class HostExpressionEvaluator {

  public static class EvaluationException extends Exception {
    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
      super(message);
    }
  }

  /** The expression is well formed but doesn't denote a number, e.g. a bare function name. */
  public static class NotANumberException extends EvaluationException {
    private static final long serialVersionUID = 1L;

    public NotANumberException(String message) {
      super(message);
    }
  }

  @FunctionalInterface
  private interface MathFunction {
    double apply(double[] args);
  }

  private static final class FunctionSpec {
    private final int minArgs;
    private final int maxArgs;
    private final MathFunction function;

    private FunctionSpec(int minArgs, int maxArgs, MathFunction function) {
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      this.function = function;
    }
  }

  private static FunctionSpec unary(DoubleUnaryOperator op) {
    return new FunctionSpec(1, 1, a -> op.applyAsDouble(a[0]));
  }

  private static FunctionSpec binary(DoubleBinaryOperator op) {
    return new FunctionSpec(2, 2, a -> op.applyAsDouble(a[0], a[1]));
  }

  private static final ImmutableMap<String, Double> CONSTANTS =
      ImmutableMap.of(
          "pi", Math.PI,
          "e", Math.E,
          "tau", 2 * Math.PI,
          "inf", Double.POSITIVE_INFINITY,
          "nan", Double.NaN);

  private static final ImmutableMap<String, FunctionSpec> FUNCTIONS =
      ImmutableMap.<String, FunctionSpec>builder()
          .put("sin", unary(Math::sin))
          .put("cos", unary(Math::cos))
          .put("tan", unary(Math::tan))
          .put("asin", unary(Math::asin))
          .put("acos", unary(Math::acos))
          .put("atan", unary(Math::atan))
          .put("atan2", binary(Math::atan2))
          .put("sinh", unary(Math::sinh))
          .put("cosh", unary(Math::cosh))
          .put("tanh", unary(Math::tanh))
          .put("sqrt", unary(Math::sqrt))
          .put("exp", unary(Math::exp))
          .put("log", new FunctionSpec(1, 2, HostExpressionEvaluator::log))
          .put("log2", unary(x -> Math.log(x) / Math.log(2)))
          .put("log10", unary(Math::log10))
          .put("pow", binary(Math::pow))
          .put("floor", unary(Math::floor))
          .put("ceil", unary(Math::ceil))
          .put("trunc", unary(x -> x < 0 ? Math.ceil(x) : Math.floor(x)))
          .put("fabs", unary(Math::abs))
          .put("abs", unary(Math::abs))
          .put("min", new FunctionSpec(1, Integer.MAX_VALUE, HostExpressionEvaluator::min))
          .put("max", new FunctionSpec(1, Integer.MAX_VALUE, HostExpressionEvaluator::max))
          .put("round", unary(Math::rint))
          .put("degrees", unary(Math::toDegrees))
          .put("radians", unary(Math::toRadians))
          .put("hypot", new FunctionSpec(0, Integer.MAX_VALUE, HostExpressionEvaluator::hypot))
          .put("copysign", binary(Math::copySign))
          .put("fmod", binary((x, y) -> x % y))
          .build();

  private static double log(double[] args) {
    if (args.length == 1) {
      return Math.log(args[0]);
    }
    return Math.log(args[0]) / Math.log(args[1]);
  }

  private static double min(double[] args) {
    double result = args[0];
    for (double arg : args) {
      result = Math.min(result, arg);
    }
    return result;
  }

  private static double max(double[] args) {
    double result = args[0];
    for (double arg : args) {
      result = Math.max(result, arg);
    }
    return result;
  }

  private static double hypot(double[] args) {
    double result = 0;
    for (double arg : args) {
      result = Math.hypot(result, arg);
    }
    return result;
  }

  private final String text;
  private int pos = 0;

  private HostExpressionEvaluator(String text) {
    this.text = text;
  }

  /** Evaluates {@code text}, e.g. {@code "(pi / 2)"}. */
  public static double evaluate(String text) throws EvaluationException {
    HostExpressionEvaluator evaluator = new HostExpressionEvaluator(text);
    double result = evaluator.expression();
    evaluator.skipWhitespace();
    if (!evaluator.isAtEnd()) {
      throw evaluator.syntaxError();
    }
    return result;
  }

  // expression := term (('+' | '-') term)*
  private double expression() throws EvaluationException {
    double value = term();
    while (true) {
      if (match("+")) {
        value += term();
      } else if (match("-")) {
        value -= term();
      } else {
        return value;
      }
    }
  }

  // term := unary (('*' | '//' | '/' | '%') unary)*
  private double term() throws EvaluationException {
    double value = unary();
    while (true) {
      if (match("*")) {
        value *= unary();
      } else if (match("//")) {
        value = Math.floor(value / nonZero(unary()));
      } else if (match("/")) {
        value /= nonZero(unary());
      } else if (match("%")) {
        double divisor = nonZero(unary());
        value = value - divisor * Math.floor(value / divisor);
      } else {
        return value;
      }
    }
  }

  private double nonZero(double divisor) throws EvaluationException {
    if (divisor == 0) {
      throw new EvaluationException("division by zero");
    }
    return divisor;
  }

  // unary := ('+' | '-') unary | power
  private double unary() throws EvaluationException {
    if (match("-")) {
      return -unary();
    } else if (match("+")) {
      return unary();
    }
    return power();
  }

  // power := primary ('**' unary)?, right associative.
  private double power() throws EvaluationException {
    double base = primary();
    if (match("**")) {
      double exponent = unary();
      if (base == 0 && exponent < 0) {
        throw new EvaluationException("0.0 cannot be raised to a negative power");
      }
      return Math.pow(base, exponent);
    }
    return base;
  }

  private double primary() throws EvaluationException {
    skipWhitespace();
    if (match("(")) {
      double value = expression();
      if (!match(")")) {
        throw syntaxError();
      }
      return value;
    }
    if (isAtEnd()) {
      throw syntaxError();
    }

    char c = text.charAt(pos);
    if (Character.isDigit(c) || c == '.') {
      return number();
    }
    if (Character.isLetter(c) || c == '_') {
      String name = name();
      if (match("(")) {
        return call(name);
      }
      Double constant = CONSTANTS.get(name);
      if (constant != null) {
        return constant;
      }
      if (FUNCTIONS.containsKey(name)) {
        throw new NotANumberException(String.format("'%s' is a function, not a number", name));
      }
      throw new EvaluationException(String.format("name '%s' is not defined", name));
    }
    throw syntaxError();
  }

  private double call(String name) throws EvaluationException {
    FunctionSpec spec = FUNCTIONS.get(name);
    if (spec == null) {
      throw new EvaluationException(String.format("name '%s' is not defined", name));
    }
    List<Double> args = new ArrayList<>();
    if (!match(")")) {
      do {
        args.add(expression());
      } while (match(","));
      if (!match(")")) {
        throw syntaxError();
      }
    }
    if (args.size() < spec.minArgs || args.size() > spec.maxArgs) {
      throw new EvaluationException(
          String.format(
              "%s() takes a different number of arguments (%d given)", name, args.size()));
    }

    double[] values = args.stream().mapToDouble(Double::doubleValue).toArray();
    double result = spec.function.apply(values);
    if (Double.isNaN(result) && args.stream().noneMatch(a -> a.isNaN())) {
      throw new EvaluationException("math domain error");
    }
    return result;
  }

  private double number() throws EvaluationException {
    int start = pos;
    while (!isAtEnd() && (Character.isDigit(peek()) || peek() == '.')) {
      pos++;
    }
    if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
      pos++;
      if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
        pos++;
      }
      while (!isAtEnd() && Character.isDigit(peek())) {
        pos++;
      }
    }
    try {
      return Double.parseDouble(text.substring(start, pos));
    } catch (NumberFormatException ex) {
      throw syntaxError();
    }
  }

  private String name() {
    int start = pos;
    while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
      pos++;
    }
    return text.substring(start, pos);
  }

  private boolean match(String expected) {
    skipWhitespace();
    if (!text.startsWith(expected, pos)) {
      return false;
    }
    // "*" must not split a "**", "/" must not split a "//".
    if (expected.length() == 1
        && (expected.equals("*") || expected.equals("/"))
        && text.startsWith(expected, pos + 1)) {
      return false;
    }
    pos += expected.length();
    return true;
  }

  private EvaluationException syntaxError() {
    return new EvaluationException(String.format("invalid syntax at offset %d", pos));
  }

  private char peek() {
    return text.charAt(pos);
  }

  private boolean isAtEnd() {
    return pos >= text.length();
  }

  private void skipWhitespace() {
    while (!isAtEnd() && Character.isWhitespace(peek())) {
      pos++;
    }
  }
}
