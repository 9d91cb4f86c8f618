package mf;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * Precedence climbing parser for formula sources.
 *
 * <p>Parsing never throws on malformed input. Errors are collected as {@link Diagnostic}s; after
 * the first error in a statement further errors are suppressed until the parser re-synchronizes
 * at a semicolon, the end of input, or the start of an {@code out}, {@code function} or {@code
 * nodegroup} declaration.
 *
 * <p>Every binary operator, exponentiation included, is left associative: {@code 2^3^2} parses as
 * {@code (2^3)^2}.
 */
public class Parser {

  public enum Precedence {
    NONE,
    ASSIGNMENT, // =
    OR, // or
    AND, // and
    NOT, // not
    COMPARISON, // < > <= >= == !=
    TERM, // + -
    FACTOR, // * / %
    UNARY, // -
    EXPONENT, // ^ **
    ATTRIBUTE, // .
    CALL, // ()
    PRIMARY;

    public Precedence next() {
      return this == PRIMARY ? PRIMARY : values()[ordinal() + 1];
    }
  }

  @FunctionalInterface
  interface ParseFn {
    void parse(Parser parser, boolean canAssign);
  }

  @AutoValue
  abstract static class ParseRule {
    abstract Optional<ParseFn> prefix();

    abstract Optional<ParseFn> infix();

    abstract Precedence precedence();

    static ParseRule create(ParseFn prefix, ParseFn infix, Precedence precedence) {
      return new AutoValue_Parser_ParseRule(
          Optional.ofNullable(prefix), Optional.ofNullable(infix), precedence);
    }
  }

  @AutoValue
  public abstract static class Result {
    public abstract AST.Module module();

    public abstract ImmutableList<Diagnostic> diagnostics();

    public boolean hasErrors() {
      return !diagnostics().isEmpty();
    }

    static Result create(AST.Module module, List<Diagnostic> diagnostics) {
      return new AutoValue_Parser_Result(module, ImmutableList.copyOf(diagnostics));
    }
  }

  /** Calls to this builtin with several positional arguments take them as one list. */
  public static final String JOIN_GEOMETRY = "join_geometry";

  private static final ImmutableMap<Token.Type, ParseRule> RULES;

  private static final ImmutableMap<Token.Type, AST.BinaryOperator> BINARY_OPERATORS =
      Maps.immutableEnumMap(
          ImmutableMap.<Token.Type, AST.BinaryOperator>builder()
              .put(Token.Type.PLUS, AST.BinaryOperator.ADD)
              .put(Token.Type.MINUS, AST.BinaryOperator.SUBTRACT)
              .put(Token.Type.STAR, AST.BinaryOperator.MULTIPLY)
              .put(Token.Type.SLASH, AST.BinaryOperator.DIVIDE)
              .put(Token.Type.PERCENT, AST.BinaryOperator.MODULO)
              .put(Token.Type.HAT, AST.BinaryOperator.POWER)
              .put(Token.Type.STAR_STAR, AST.BinaryOperator.POWER)
              .put(Token.Type.LESS, AST.BinaryOperator.LESS)
              .put(Token.Type.LESS_EQUAL, AST.BinaryOperator.LESS_EQUAL)
              .put(Token.Type.GREATER, AST.BinaryOperator.GREATER)
              .put(Token.Type.GREATER_EQUAL, AST.BinaryOperator.GREATER_EQUAL)
              .put(Token.Type.EQUAL_EQUAL, AST.BinaryOperator.EQUAL)
              .put(Token.Type.BANG_EQUAL, AST.BinaryOperator.NOT_EQUAL)
              .put(Token.Type.AND, AST.BinaryOperator.AND)
              .put(Token.Type.OR, AST.BinaryOperator.OR)
              .build());

  static {
    Map<Token.Type, ParseRule> rules = new EnumMap<>(Token.Type.class);
    rules.put(
        Token.Type.LEFT_PAREN, ParseRule.create(Parser::grouping, Parser::call, Precedence.CALL));
    rules.put(Token.Type.RIGHT_PAREN, ParseRule.create(null, null, Precedence.NONE));
    rules.put(
        Token.Type.LEFT_SQUARE_BRACKET,
        ParseRule.create(Parser::listLiteral, null, Precedence.NONE));
    rules.put(Token.Type.RIGHT_SQUARE_BRACKET, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.LEFT_BRACE, ParseRule.create(Parser::makeVector, null, Precedence.NONE));
    rules.put(Token.Type.RIGHT_BRACE, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.COMMA, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.DOT, ParseRule.create(null, Parser::dot, Precedence.ATTRIBUTE));
    rules.put(Token.Type.SEMICOLON, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.COLON, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.ARROW, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.UNDERSCORE, ParseRule.create(Parser::defaultValue, null, Precedence.NONE));

    rules.put(Token.Type.EQUAL, ParseRule.create(null, null, Precedence.NONE));
    rules.put(
        Token.Type.EQUAL_EQUAL, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(Token.Type.BANG_EQUAL, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(Token.Type.LESS, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(Token.Type.LESS_EQUAL, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(Token.Type.GREATER, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(
        Token.Type.GREATER_EQUAL, ParseRule.create(null, Parser::binary, Precedence.COMPARISON));
    rules.put(Token.Type.PLUS, ParseRule.create(null, Parser::binary, Precedence.TERM));
    rules.put(Token.Type.MINUS, ParseRule.create(Parser::unary, Parser::binary, Precedence.TERM));
    rules.put(Token.Type.STAR, ParseRule.create(null, Parser::binary, Precedence.FACTOR));
    rules.put(Token.Type.STAR_STAR, ParseRule.create(null, Parser::binary, Precedence.EXPONENT));
    rules.put(Token.Type.HAT, ParseRule.create(null, Parser::binary, Precedence.EXPONENT));
    rules.put(Token.Type.SLASH, ParseRule.create(null, Parser::binary, Precedence.FACTOR));
    rules.put(Token.Type.PERCENT, ParseRule.create(null, Parser::binary, Precedence.FACTOR));

    rules.put(Token.Type.INT, ParseRule.create(Parser::makeInt, null, Precedence.NONE));
    rules.put(Token.Type.FLOAT, ParseRule.create(Parser::makeFloat, null, Precedence.NONE));
    rules.put(Token.Type.STRING, ParseRule.create(Parser::string, null, Precedence.NONE));
    rules.put(Token.Type.TRUE, ParseRule.create(Parser::bool, null, Precedence.NONE));
    rules.put(Token.Type.FALSE, ParseRule.create(Parser::bool, null, Precedence.NONE));
    rules.put(
        Token.Type.HOST_EXPRESSION,
        ParseRule.create(Parser::hostExpression, null, Precedence.NONE));
    rules.put(Token.Type.GROUP_NAME, ParseRule.create(Parser::groupName, null, Precedence.NONE));

    rules.put(Token.Type.OUT, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.FUNCTION, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.NODEGROUP, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.LOOP, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.NOT, ParseRule.create(Parser::unary, null, Precedence.NOT));
    rules.put(Token.Type.AND, ParseRule.create(null, Parser::binary, Precedence.AND));
    rules.put(Token.Type.OR, ParseRule.create(null, Parser::binary, Precedence.OR));

    rules.put(Token.Type.IDENTIFIER, ParseRule.create(Parser::identifier, null, Precedence.NONE));
    rules.put(Token.Type.ERROR, ParseRule.create(null, null, Precedence.NONE));
    rules.put(Token.Type.EOF, ParseRule.create(null, null, Precedence.NONE));

    RULES = Maps.immutableEnumMap(rules);
    Verify.verify(
        RULES.keySet().equals(EnumSet.allOf(Token.Type.class)), "Missing parse rules: %s", RULES);
    for (Token.Type type : BINARY_OPERATORS.keySet()) {
      Verify.verify(RULES.get(type).infix().isPresent(), "No infix rule for %s", type);
    }
  }

  private final ImmutableList<Token> tokens;
  private int index;
  private Token current;
  private Token previous;
  private boolean panicMode = false;
  // The node built by the most recent prefix/infix handler.
  private AST.Node currNode = null;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  /** {@code tokens} must end with an {@link Token.Type#EOF} token. */
  public Parser(List<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(Token.Type.EOF),
        "token stream must end with EOF");
    this.tokens = ImmutableList.copyOf(tokens);
    this.index = -1;
    advance();
    this.previous = current;
  }

  public static Result parse(String source) {
    return new Parser(new Scanner(source).scanTokens()).parse();
  }

  public Result parse() {
    List<AST.Statement> body = new ArrayList<>();
    while (!match(Token.Type.EOF)) {
      AST.Statement statement = declaration();
      if (statement != null) {
        body.add(statement);
      }
      if (panicMode) {
        synchronize();
      }
    }
    return Result.create(new AST.Module(body), diagnostics);
  }

  // Errors.

  private void errorAtCurrent(String message) {
    errorAt(current, message);
  }

  private void error(String message) {
    errorAt(previous, message);
  }

  private void errorAt(Token token, String message) {
    if (panicMode) {
      return;
    }
    panicMode = true;
    diagnostics.add(Diagnostic.at(token, message));
  }

  private void synchronize() {
    panicMode = false;
    while (!previous.is(Token.Type.EOF)) {
      if (previous.is(Token.Type.SEMICOLON)) {
        return;
      }
      switch (current.type()) {
        case OUT:
        case FUNCTION:
        case NODEGROUP:
          return;
        default:
          advance();
      }
    }
  }

  // Token stream.

  private Token nextToken() {
    index = Math.min(index + 1, tokens.size() - 1);
    return tokens.get(index);
  }

  private void advance() {
    previous = current;
    while (true) {
      current = nextToken();
      if (!current.is(Token.Type.ERROR)) {
        break;
      }
      errorAtCurrent(current.error().orElse("Unexpected token."));
    }
  }

  private boolean check(Token.Type type) {
    return current.is(type);
  }

  private boolean match(Token.Type type) {
    if (!check(type)) {
      return false;
    }
    advance();
    return true;
  }

  private void consume(Token.Type type, String message) {
    if (check(type)) {
      advance();
      return;
    }
    errorAtCurrent(message);
  }

  private static ParseRule getRule(Token.Type type) {
    return RULES.get(type);
  }

  // Precedence climbing.

  private AST.Node parsePrecedence(Precedence precedence) {
    return parsePrecedence(precedence, false);
  }

  private AST.Node parsePrecedence(Precedence precedence, boolean skipAdvance) {
    if (!skipAdvance) {
      advance();
    }
    Optional<ParseFn> prefix = getRule(previous.type()).prefix();
    if (!prefix.isPresent()) {
      error("Expect expression.");
      return null;
    }
    boolean canAssign = precedence.ordinal() <= Precedence.ASSIGNMENT.ordinal();
    prefix.get().parse(this, canAssign);
    while (precedence.ordinal() <= getRule(current.type()).precedence().ordinal()) {
      advance();
      Optional<ParseFn> infix = getRule(previous.type()).infix();
      if (!infix.isPresent()) {
        error("Expect expression.");
        break;
      }
      infix.get().parse(this, canAssign);
    }
    if (canAssign && match(Token.Type.EQUAL)) {
      error("Invalid assignment target.");
    }
    if (currNode == null) {
      error("Expected expression with a value.");
    }
    return currNode;
  }

  // Assignment is not a valid expression.
  private AST.Expr expression() {
    AST.Node node = parsePrecedence(Precedence.OR);
    return node instanceof AST.Expr ? (AST.Expr) node : null;
  }

  private AST.Expr expressionAfterPrefix() {
    AST.Node node = parsePrecedence(Precedence.OR, true);
    return node instanceof AST.Expr ? (AST.Expr) node : null;
  }

  // Declarations and statements.

  private AST.Statement declaration() {
    if (match(Token.Type.OUT)) {
      return out();
    } else if (match(Token.Type.FUNCTION)) {
      return functionDef();
    } else if (match(Token.Type.NODEGROUP)) {
      return nodegroupDef();
    } else if (match(Token.Type.LOOP)) {
      return loop();
    }
    return statement();
  }

  // Assignment is a valid statement.
  private AST.Statement statement() {
    AST.Node node = parsePrecedence(Precedence.ASSIGNMENT);
    match(Token.Type.SEMICOLON); // Optional.
    currNode = null;
    if (node instanceof AST.Statement) {
      return (AST.Statement) node;
    } else if (node instanceof AST.Expr) {
      return new AST.ExprStatement((AST.Expr) node);
    }
    return null;
  }

  // out x = 10;
  // out x, y, z = 10;
  // out x, _, z = position();
  private AST.Out out() {
    Token token = previous;
    List<Optional<AST.Name>> targets = new ArrayList<>();
    String message = "Expect variable name or \"_\" after \"out\".";
    while (!match(Token.Type.EQUAL)) {
      if (match(Token.Type.IDENTIFIER)) {
        targets.add(Optional.of(new AST.Name(previous, previous.lexeme())));
      } else if (match(Token.Type.UNDERSCORE)) {
        targets.add(Optional.empty());
      } else {
        errorAtCurrent(message);
      }
      if (!match(Token.Type.COMMA)) {
        consume(Token.Type.EQUAL, "Expected \"=\".");
        break;
      }
    }
    if (targets.isEmpty()) {
      errorAt(token, message);
    }
    AST.Expr value = expression();
    if (value == null) {
      return null;
    }
    match(Token.Type.SEMICOLON); // Optional.
    currNode = null;
    return new AST.Out(token, targets, value);
  }

  private DataType parseType() {
    consume(Token.Type.COLON, "Expected type after argument name.");
    if (match(Token.Type.IDENTIFIER)) {
      Optional<DataType> type = DataType.parse(previous.lexeme());
      if (type.isPresent()) {
        return type.get();
      }
      error(String.format("Invalid data type: %s.", previous.lexeme()));
    } else {
      error("Expected a data type");
    }
    return DataType.UNKNOWN;
  }

  private AST.Arg parseArg() {
    consume(Token.Type.IDENTIFIER, "Expect argument name");
    Token token = previous;
    DataType type = parseType();
    Optional<AST.Expr> defaultValue = Optional.empty();
    if (match(Token.Type.EQUAL)) {
      defaultValue = Optional.ofNullable(expression());
    }
    return new AST.Arg(token, token.lexeme(), type, defaultValue);
  }

  private List<AST.Statement> block() {
    List<AST.Statement> body = new ArrayList<>();
    while (!(check(Token.Type.RIGHT_BRACE) || match(Token.Type.EOF))) {
      AST.Statement statement = declaration();
      if (statement != null) {
        body.add(statement);
      }
    }
    consume(Token.Type.RIGHT_BRACE, "Expect closing \"}\".");
    currNode = null;
    return body;
  }

  private String definitionName(String message) {
    if (!(match(Token.Type.IDENTIFIER) || match(Token.Type.STRING))) {
      error(message);
    }
    String name = previous.lexeme();
    if (previous.is(Token.Type.STRING)) {
      name = name.substring(1, name.length() - 1);
    }
    return name;
  }

  private AST.Statement functionDef() {
    String name = definitionName("Expected function name.");
    Token token = previous;
    DefinitionParts parts = parseFuncStructure();
    return new AST.FunctionDef(token, name, parts.args, parts.body, parts.returns);
  }

  private AST.Statement nodegroupDef() {
    String name = definitionName("Expected node group name.");
    Token token = previous;
    DefinitionParts parts = parseFuncStructure();
    return new AST.NodegroupDef(token, name, parts.args, parts.body, parts.returns);
  }

  private static final class DefinitionParts {
    private final List<AST.Arg> args = new ArrayList<>();
    private final List<AST.Arg> returns = new ArrayList<>();
    private List<AST.Statement> body = new ArrayList<>();
  }

  private DefinitionParts parseFuncStructure() {
    DefinitionParts parts = new DefinitionParts();
    consume(Token.Type.LEFT_PAREN, "Expect \"(\" after name.");
    while (!check(Token.Type.RIGHT_PAREN)) {
      parts.args.add(parseArg());
      if (!match(Token.Type.COMMA)) {
        break;
      }
    }
    consume(Token.Type.RIGHT_PAREN, "Expect closing \")\".");
    if (match(Token.Type.ARROW)) {
      parts.returns.add(parseArg());
      while (match(Token.Type.COMMA)) {
        parts.returns.add(parseArg());
      }
    }
    consume(Token.Type.LEFT_BRACE, "Expect function body.");
    parts.body = block();
    return parts;
  }

  // An optionally negative integer literal.
  private int parseInt() {
    boolean negative = match(Token.Type.MINUS);
    consume(Token.Type.INT, "Expected an integer");
    if (panicMode) {
      return 0;
    }
    try {
      int value = Integer.parseInt(previous.lexeme());
      return negative ? -value : value;
    } catch (NumberFormatException ex) {
      error("Integer literal is too large.");
      return 0;
    }
  }

  // loop 3 { ... }
  // loop i = 0 -> 10 { ... }
  private AST.Statement loop() {
    Token token = previous;
    Optional<AST.Name> var = Optional.empty();
    if (match(Token.Type.IDENTIFIER)) {
      var = Optional.of(new AST.Name(previous, previous.lexeme()));
      consume(Token.Type.EQUAL, "Expect \"=\" after loop variable.");
    }
    int start = 1;
    int end = parseInt();
    if (match(Token.Type.ARROW)) {
      start = end;
      end = parseInt();
    }
    consume(Token.Type.LEFT_BRACE, "Expect loop body.");
    List<AST.Statement> body = block();
    return new AST.Loop(token, var, start, end, body);
  }

  private static final class CallArgs {
    private final List<AST.Expr> positional = new ArrayList<>();
    private final List<AST.Keyword> keywords = new ArrayList<>();
  }

  // Keyword arguments are told apart from positional ones by the lookahead "identifier =".
  private Optional<CallArgs> callArgs() {
    CallArgs args = new CallArgs();
    if (!check(Token.Type.RIGHT_PAREN)) {
      while (match(Token.Type.COMMA) || previous.is(Token.Type.LEFT_PAREN)) {
        if (match(Token.Type.IDENTIFIER)) {
          if (check(Token.Type.EQUAL)) {
            Token argToken = previous;
            advance(); // "="
            AST.Expr value = expression();
            if (value == null) {
              return Optional.empty();
            }
            args.keywords.add(new AST.Keyword(argToken, argToken.lexeme(), value));

            // Only keyword arguments may follow.
            String message = "No positional arguments allowed after keyword argument.";
            while (match(Token.Type.COMMA)) {
              consume(Token.Type.IDENTIFIER, message);
              argToken = previous;
              consume(Token.Type.EQUAL, "Expect \"=\" after keyword.");
              value = expression();
              if (value == null) {
                return Optional.empty();
              }
              args.keywords.add(new AST.Keyword(argToken, argToken.lexeme(), value));
            }
          } else {
            AST.Expr value = expressionAfterPrefix();
            if (value == null) {
              return Optional.empty();
            }
            args.positional.add(value);
          }
        } else {
          AST.Expr value = expression();
          if (value == null) {
            return Optional.empty();
          }
          args.positional.add(value);
        }
      }
    }
    consume(Token.Type.RIGHT_PAREN, "Expect \")\" after arguments.");
    return Optional.of(args);
  }

  // join_geometry(a, b, c) -> join_geometry([a, b, c])
  private static List<AST.Expr> joinArguments(Token token, AST.Expr func, List<AST.Expr> args) {
    if (func instanceof AST.Name
        && ((AST.Name) func).id().equals(JOIN_GEOMETRY)
        && args.size() > 1) {
      return ImmutableList.of(new AST.ListLiteral(token, args));
    }
    return args;
  }

  // Prefix and infix handlers.

  private void makeInt(boolean canAssign) {
    Token token = previous;
    try {
      currNode = AST.Constant.ofInt(token, Integer.parseInt(token.lexeme()));
    } catch (NumberFormatException ex) {
      error("Integer literal is too large.");
      currNode = AST.Constant.ofInt(token, 0);
    }
  }

  private void makeFloat(boolean canAssign) {
    Token token = previous;
    currNode = AST.Constant.ofFloat(token, Double.parseDouble(token.lexeme()));
  }

  private void hostExpression(boolean canAssign) {
    Token token = previous;
    double value = 0.0;
    try {
      value = HostExpressionEvaluator.evaluate(token.lexeme().substring(1));
    } catch (HostExpressionEvaluator.NotANumberException ex) {
      error(
          String.format(
              "Expected result of embedded expression to be a number: %s.", ex.getMessage()));
    } catch (HostExpressionEvaluator.EvaluationException ex) {
      error(String.format("Invalid embedded expression: %s.", ex.getMessage()));
    }
    currNode = AST.Constant.ofFloat(token, value);
  }

  private void defaultValue(boolean canAssign) {
    currNode = AST.Constant.ofDefault(previous);
  }

  private void string(boolean canAssign) {
    Token token = previous;
    String lexeme = token.lexeme();
    currNode = AST.Constant.ofString(token, lexeme.substring(1, lexeme.length() - 1));
  }

  private void bool(boolean canAssign) {
    currNode = AST.Constant.ofBool(previous, previous.is(Token.Type.TRUE));
  }

  private void identifier(boolean canAssign) {
    Token identifierToken = previous;
    String name = identifierToken.lexeme();
    if (canAssign && (check(Token.Type.EQUAL) || match(Token.Type.COMMA))) {
      List<Optional<AST.Name>> targets = new ArrayList<>();
      targets.add(Optional.of(new AST.Name(identifierToken, name)));
      while (!check(Token.Type.EQUAL)) {
        if (match(Token.Type.IDENTIFIER)) {
          targets.add(Optional.of(new AST.Name(previous, previous.lexeme())));
        } else if (match(Token.Type.UNDERSCORE)) {
          targets.add(Optional.empty());
        } else {
          errorAtCurrent("Expect variable name or \"_\" separated by \",\".");
        }
        if (!match(Token.Type.COMMA)) {
          break;
        }
      }
      consume(Token.Type.EQUAL, "Expect \"=\"");
      Token equalToken = previous;
      AST.Expr value = expression();
      if (value == null) {
        currNode = null;
        return;
      }
      currNode = new AST.Assign(equalToken, targets, value);
    } else {
      currNode = new AST.Name(identifierToken, name);
    }
  }

  private void grouping(boolean canAssign) {
    currNode = expression();
    consume(Token.Type.RIGHT_PAREN, "Expect closing \")\" after expression.");
  }

  private void unary(boolean canAssign) {
    Token operatorToken = previous;
    AST.Node operand = parsePrecedence(Precedence.UNARY);
    if (!(operand instanceof AST.Expr)) {
      currNode = null;
      return;
    }
    AST.UnaryOperator op;
    switch (operatorToken.type()) {
      case MINUS:
        op = AST.UnaryOperator.NEGATE;
        break;
      case NOT:
        op = AST.UnaryOperator.NOT;
        break;
      default:
        throw new AssertionError("Unreachable: " + operatorToken);
    }
    currNode = new AST.UnaryOp(operatorToken, op, (AST.Expr) operand);
  }

  // {x, y, z}; missing components keep their default.
  private void makeVector(boolean canAssign) {
    Token bracketToken = previous;
    AST.Expr x = AST.Constant.ofDefault(bracketToken);
    AST.Expr y = x;
    AST.Expr z = x;
    if (!match(Token.Type.RIGHT_BRACE)) {
      x = expression();
      if (match(Token.Type.COMMA)) {
        y = expression();
      }
      if (match(Token.Type.COMMA)) {
        z = expression();
      }
      consume(Token.Type.RIGHT_BRACE, "Expect closing \"}\".");
    }
    if (x == null || y == null || z == null) {
      currNode = null;
      return;
    }
    currNode = new AST.Vec3(bracketToken, x, y, z);
  }

  private void listLiteral(boolean canAssign) {
    Token bracketToken = previous;
    List<AST.Expr> elements = new ArrayList<>();
    if (!check(Token.Type.RIGHT_SQUARE_BRACKET)) {
      do {
        AST.Expr element = expression();
        if (element == null) {
          currNode = null;
          return;
        }
        elements.add(element);
      } while (match(Token.Type.COMMA));
    }
    consume(Token.Type.RIGHT_SQUARE_BRACKET, "Expect closing \"]\".");
    currNode = new AST.ListLiteral(bracketToken, elements);
  }

  private void groupName(boolean canAssign) {
    Token token = previous;
    String lexeme = token.lexeme();
    AST.Name func =
        new AST.Name(
            token, lexeme.substring(Scanner.GROUP_NAME_PREFIX.length(), lexeme.length() - 1));
    consume(Token.Type.LEFT_PAREN, "Expect \"(\" after node group name.");
    Optional<CallArgs> args = callArgs();
    if (!args.isPresent()) {
      currNode = null;
      return;
    }
    currNode =
        new AST.Call(
            token,
            func,
            joinArguments(token, func, args.get().positional),
            args.get().keywords,
            true);
  }

  private void call(boolean canAssign) {
    Token token = previous;
    AST.Node func = currNode;
    if (!(func instanceof AST.Name || func instanceof AST.Attribute)) {
      error("Expected function name to call.");
      return;
    }
    Optional<CallArgs> args = callArgs();
    if (!args.isPresent()) {
      currNode = null;
      return;
    }
    AST.Expr callee = (AST.Expr) func;
    currNode =
        new AST.Call(
            token,
            callee,
            joinArguments(token, callee, args.get().positional),
            args.get().keywords,
            false);
  }

  private void dot(boolean canAssign) {
    Token token = previous;
    consume(Token.Type.IDENTIFIER, "Expect output name or function call after \".\".");
    Token identifierToken = previous;
    if (!(currNode instanceof AST.Expr)) {
      currNode = null;
      return;
    }
    currNode = new AST.Attribute(token, (AST.Expr) currNode, identifierToken.lexeme());
  }

  private void binary(boolean canAssign) {
    Token operatorToken = previous;
    AST.Node left = currNode;
    ParseRule rule = getRule(operatorToken.type());
    AST.Node right = parsePrecedence(rule.precedence().next());
    if (!(left instanceof AST.Expr) || !(right instanceof AST.Expr)) {
      currNode = null;
      return;
    }
    AST.BinaryOperator op =
        Verify.verifyNotNull(BINARY_OPERATORS.get(operatorToken.type()), "%s", operatorToken);
    currNode = new AST.BinOp(operatorToken, (AST.Expr) left, op, (AST.Expr) right);
  }
}
