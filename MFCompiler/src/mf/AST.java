package mf;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import mf.processor.ASTChild;
import mf.processor.ASTNode;

/** Syntax tree of a formula source, as produced by the {@link Parser}. */
public final class AST {

  /** Every node remembers the token it was parsed from, for diagnostics. */
  public abstract static class Node implements ASTNodeInterface {
    private final Token token;

    protected Node(Token token) {
      this.token = Preconditions.checkNotNull(token);
    }

    public Token token() {
      return token;
    }
  }

  public abstract static class Statement extends Node {
    protected Statement(Token token) {
      super(token);
    }
  }

  public abstract static class Expr extends Node {
    protected Expr(Token token) {
      super(token);
    }
  }

  public enum UnaryOperator {
    NEGATE("-"),
    NOT("not");

    private final String repr;

    UnaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }
  }

  public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    POWER("^"),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    AND("and"),
    OR("or");

    private final String repr;

    BinaryOperator(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }
  }

  @ASTNode
  public static class Module implements AST_Module_ASTNode {
    private final ImmutableList<Statement> body;

    public Module(List<Statement> body) {
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  // Statements.

  @ASTNode
  public static class Assign extends Statement implements AST_Assign_ASTNode {
    private final ImmutableList<Optional<Name>> targets;
    private final Expr value;

    public Assign(Token token, List<Optional<Name>> targets, Expr value) {
      super(token);
      this.targets = ImmutableList.copyOf(targets);
      this.value = value;
    }

    /** Assignment targets in source order; empty entries are "_" discards. */
    public ImmutableList<Optional<Name>> targets() {
      return targets;
    }

    @ASTChild
    @Override
    public Expr value() {
      return value;
    }
  }

  @ASTNode
  public static class Out extends Statement implements AST_Out_ASTNode {
    private final ImmutableList<Optional<Name>> targets;
    private final Expr value;

    public Out(Token token, List<Optional<Name>> targets, Expr value) {
      super(token);
      this.targets = ImmutableList.copyOf(targets);
      this.value = value;
    }

    public ImmutableList<Optional<Name>> targets() {
      return targets;
    }

    @ASTChild
    @Override
    public Expr value() {
      return value;
    }
  }

  /** Shared shape of function and node group definitions. */
  public abstract static class Definition extends Statement {
    private final String name;
    private final ImmutableList<Arg> args;
    private final ImmutableList<Statement> body;
    private final ImmutableList<Arg> returns;

    protected Definition(
        Token token, String name, List<Arg> args, List<Statement> body, List<Arg> returns) {
      super(token);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.body = ImmutableList.copyOf(body);
      this.returns = ImmutableList.copyOf(returns);
    }

    public String name() {
      return name;
    }

    public ImmutableList<Arg> args() {
      return args;
    }

    public ImmutableList<Statement> body() {
      return body;
    }

    public ImmutableList<Arg> returns() {
      return returns;
    }

    public abstract boolean isNodegroup();
  }

  @ASTNode
  public static class FunctionDef extends Definition implements AST_FunctionDef_ASTNode {
    public FunctionDef(
        Token token, String name, List<Arg> args, List<Statement> body, List<Arg> returns) {
      super(token, name, args, body, returns);
    }

    @ASTChild
    @Override
    public ImmutableList<Arg> args() {
      return super.args();
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return super.body();
    }

    @ASTChild
    @Override
    public ImmutableList<Arg> returns() {
      return super.returns();
    }

    @Override
    public boolean isNodegroup() {
      return false;
    }
  }

  @ASTNode
  public static class NodegroupDef extends Definition implements AST_NodegroupDef_ASTNode {
    public NodegroupDef(
        Token token, String name, List<Arg> args, List<Statement> body, List<Arg> returns) {
      super(token, name, args, body, returns);
    }

    @ASTChild
    @Override
    public ImmutableList<Arg> args() {
      return super.args();
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return super.body();
    }

    @ASTChild
    @Override
    public ImmutableList<Arg> returns() {
      return super.returns();
    }

    @Override
    public boolean isNodegroup() {
      return true;
    }
  }

  @ASTNode
  public static class Loop extends Statement implements AST_Loop_ASTNode {
    private final Optional<Name> var;
    private final int start;
    private final int end;
    private final ImmutableList<Statement> body;

    public Loop(Token token, Optional<Name> var, int start, int end, List<Statement> body) {
      super(token);
      this.var = var;
      this.start = start;
      this.end = end;
      this.body = ImmutableList.copyOf(body);
    }

    @ASTChild
    @Override
    public Optional<Name> var() {
      return var;
    }

    public int start() {
      return start;
    }

    public int end() {
      return end;
    }

    @ASTChild
    @Override
    public ImmutableList<Statement> body() {
      return body;
    }
  }

  /** An expression evaluated for its side effects, e.g. a bare call. */
  @ASTNode
  public static class ExprStatement extends Statement implements AST_ExprStatement_ASTNode {
    private final Expr expr;

    public ExprStatement(Expr expr) {
      super(expr.token());
      this.expr = expr;
    }

    @ASTChild
    @Override
    public Expr expr() {
      return expr;
    }
  }

  // Definition parts.

  @ASTNode
  public static class Arg extends Node implements AST_Arg_ASTNode {
    private final String name;
    private final DataType type;
    private final Optional<Expr> defaultValue;

    public Arg(Token token, String name, DataType type, Optional<Expr> defaultValue) {
      super(token);
      this.name = name;
      this.type = type;
      this.defaultValue = defaultValue;
    }

    public String name() {
      return name;
    }

    public DataType type() {
      return type;
    }

    @ASTChild
    @Override
    public Optional<Expr> defaultValue() {
      return defaultValue;
    }
  }

  @ASTNode
  public static class Keyword extends Node implements AST_Keyword_ASTNode {
    private final String name;
    private final Expr value;

    public Keyword(Token token, String name, Expr value) {
      super(token);
      this.name = name;
      this.value = value;
    }

    public String name() {
      return name;
    }

    @ASTChild
    @Override
    public Expr value() {
      return value;
    }
  }

  // Expressions.

  @ASTNode
  public static class Constant extends Expr implements AST_Constant_ASTNode {
    private final Optional<Object> value;
    private final DataType type;

    private Constant(Token token, Optional<Object> value, DataType type) {
      super(token);
      this.value = value;
      this.type = type;
    }

    public static Constant ofInt(Token token, int value) {
      return new Constant(token, Optional.of(value), DataType.INT);
    }

    public static Constant ofFloat(Token token, double value) {
      return new Constant(token, Optional.of(value), DataType.FLOAT);
    }

    public static Constant ofBool(Token token, boolean value) {
      return new Constant(token, Optional.of(value), DataType.BOOL);
    }

    public static Constant ofString(Token token, String value) {
      return new Constant(token, Optional.of(value), DataType.STRING);
    }

    /** The "_" constant, which leaves a socket at its default value. */
    public static Constant ofDefault(Token token) {
      return new Constant(token, Optional.empty(), DataType.DEFAULT);
    }

    /** Integer, Double, Boolean or String; empty for {@link DataType#DEFAULT}. */
    public Optional<Object> value() {
      return value;
    }

    public DataType type() {
      return type;
    }
  }

  @ASTNode
  public static class Name extends Expr implements AST_Name_ASTNode {
    private final String id;

    public Name(Token token, String id) {
      super(token);
      this.id = id;
    }

    public String id() {
      return id;
    }
  }

  @ASTNode
  public static class Vec3 extends Expr implements AST_Vec3_ASTNode {
    private final Expr x;
    private final Expr y;
    private final Expr z;

    public Vec3(Token token, Expr x, Expr y, Expr z) {
      super(token);
      this.x = x;
      this.y = y;
      this.z = z;
    }

    @ASTChild
    @Override
    public Expr x() {
      return x;
    }

    @ASTChild
    @Override
    public Expr y() {
      return y;
    }

    @ASTChild
    @Override
    public Expr z() {
      return z;
    }
  }

  @ASTNode
  public static class ListLiteral extends Expr implements AST_ListLiteral_ASTNode {
    private final ImmutableList<Expr> elements;

    public ListLiteral(Token token, List<Expr> elements) {
      super(token);
      this.elements = ImmutableList.copyOf(elements);
    }

    @ASTChild
    @Override
    public ImmutableList<Expr> elements() {
      return elements;
    }
  }

  @ASTNode
  public static class UnaryOp extends Expr implements AST_UnaryOp_ASTNode {
    private final UnaryOperator op;
    private final Expr operand;

    public UnaryOp(Token token, UnaryOperator op, Expr operand) {
      super(token);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expr operand() {
      return operand;
    }
  }

  @ASTNode
  public static class BinOp extends Expr implements AST_BinOp_ASTNode {
    private final Expr left;
    private final BinaryOperator op;
    private final Expr right;

    public BinOp(Token token, Expr left, BinaryOperator op, Expr right) {
      super(token);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @ASTChild
    @Override
    public Expr left() {
      return left;
    }

    public BinaryOperator op() {
      return op;
    }

    @ASTChild
    @Override
    public Expr right() {
      return right;
    }
  }

  @ASTNode
  public static class Call extends Expr implements AST_Call_ASTNode {
    private final Expr func;
    private final ImmutableList<Expr> args;
    private final ImmutableList<Keyword> keywords;
    private final boolean groupReference;

    public Call(
        Token token,
        Expr func,
        List<Expr> args,
        List<Keyword> keywords,
        boolean groupReference) {
      super(token);
      Preconditions.checkArgument(
          func instanceof Name || func instanceof Attribute, "cannot call %s", func);
      this.func = func;
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
      this.groupReference = groupReference;
    }

    /** A {@link Name}, or an {@link Attribute} for the method form {@code a.f(b)}. */
    @ASTChild
    @Override
    public Expr func() {
      return func;
    }

    @ASTChild
    @Override
    public ImmutableList<Expr> args() {
      return args;
    }

    @ASTChild
    @Override
    public ImmutableList<Keyword> keywords() {
      return keywords;
    }

    /** True for {@code @"Group Name"(...)}, which can only call a node group. */
    public boolean isGroupReference() {
      return groupReference;
    }
  }

  @ASTNode
  public static class Attribute extends Expr implements AST_Attribute_ASTNode {
    private final Expr value;
    private final String attr;

    public Attribute(Token token, Expr value, String attr) {
      super(token);
      this.value = value;
      this.attr = attr;
    }

    @ASTChild
    @Override
    public Expr value() {
      return value;
    }

    public String attr() {
      return attr;
    }
  }

  private AST() {}
}
