package mf;

import java.util.List;
import java.util.Optional;

/**
 * Renders a syntax tree back to source-like text with every operator application parenthesized,
 * so {@code 2 ^ 3 ^ 2} prints as {@code ((2 ^ 3) ^ 2)}. Top level statements go one per line.
 */
public final class AstPrinter extends DefaultASTVisitor<StringBuilder> {

  public static String print(AST.Module module) {
    return module.accept(new AstPrinter(), new StringBuilder()).toString();
  }

  public static String print(AST.Node node) {
    return node.accept(new AstPrinter(), new StringBuilder()).toString();
  }

  private AstPrinter() {}

  @Override
  public StringBuilder visit(AST.Module module, StringBuilder out) {
    for (int i = 0; i < module.body().size(); i++) {
      if (i > 0) {
        out.append('\n');
      }
      module.body().get(i).accept(this, out);
    }
    return out;
  }

  // Statements.

  @Override
  public StringBuilder visit(AST.Assign assign, StringBuilder out) {
    targets(assign.targets(), out).append(" = ");
    return assign.value().accept(this, out);
  }

  @Override
  public StringBuilder visit(AST.Out stmt, StringBuilder out) {
    targets(stmt.targets(), out.append("out ")).append(" = ");
    return stmt.value().accept(this, out);
  }

  @Override
  public StringBuilder visit(AST.ExprStatement stmt, StringBuilder out) {
    return stmt.expr().accept(this, out);
  }

  @Override
  public StringBuilder visit(AST.FunctionDef def, StringBuilder out) {
    return definition("function", def, out);
  }

  @Override
  public StringBuilder visit(AST.NodegroupDef def, StringBuilder out) {
    return definition("nodegroup", def, out);
  }

  @Override
  public StringBuilder visit(AST.Loop loop, StringBuilder out) {
    out.append("loop ");
    loop.var().ifPresent(v -> out.append(v.id()).append(" = "));
    out.append(loop.start()).append(" -> ").append(loop.end()).append(' ');
    return block(loop.body(), out);
  }

  @Override
  public StringBuilder visit(AST.Arg arg, StringBuilder out) {
    out.append(arg.name()).append(": ").append(arg.type().repr());
    if (arg.defaultValue().isPresent()) {
      arg.defaultValue().get().accept(this, out.append(" = "));
    }
    return out;
  }

  @Override
  public StringBuilder visit(AST.Keyword keyword, StringBuilder out) {
    return keyword.value().accept(this, out.append(keyword.name()).append('='));
  }

  private StringBuilder definition(String keyword, AST.Definition def, StringBuilder out) {
    out.append(keyword).append(' ');
    if (def.name().matches("[A-Za-z_][A-Za-z0-9_]*")) {
      out.append(def.name());
    } else {
      out.append('"').append(def.name()).append('"');
    }
    list(def.args(), out.append('(')).append(')');
    if (!def.returns().isEmpty()) {
      list(def.returns(), out.append(" -> "));
    }
    return block(def.body(), out.append(' '));
  }

  private StringBuilder block(List<AST.Statement> body, StringBuilder out) {
    if (body.isEmpty()) {
      return out.append("{}");
    }
    out.append("{ ");
    for (int i = 0; i < body.size(); i++) {
      if (i > 0) {
        out.append("; ");
      }
      body.get(i).accept(this, out);
    }
    return out.append(" }");
  }

  private StringBuilder targets(List<Optional<AST.Name>> targets, StringBuilder out) {
    for (int i = 0; i < targets.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      out.append(targets.get(i).map(AST.Name::id).orElse("_"));
    }
    return out;
  }

  private StringBuilder list(List<? extends AST.Node> nodes, StringBuilder out) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      nodes.get(i).accept(this, out);
    }
    return out;
  }

  // Expressions.

  @Override
  public StringBuilder visit(AST.Constant constant, StringBuilder out) {
    if (!constant.value().isPresent()) {
      return out.append('_');
    }
    Object value = constant.value().get();
    if (value instanceof String) {
      return out.append('"').append(value).append('"');
    }
    return out.append(value);
  }

  @Override
  public StringBuilder visit(AST.Name name, StringBuilder out) {
    return out.append(name.id());
  }

  @Override
  public StringBuilder visit(AST.Vec3 vec, StringBuilder out) {
    out.append('{');
    vec.x().accept(this, out).append(", ");
    vec.y().accept(this, out).append(", ");
    return vec.z().accept(this, out).append('}');
  }

  @Override
  public StringBuilder visit(AST.ListLiteral list, StringBuilder out) {
    return list(list.elements(), out.append('[')).append(']');
  }

  @Override
  public StringBuilder visit(AST.UnaryOp unary, StringBuilder out) {
    out.append('(').append(unary.op().repr());
    if (unary.op() == AST.UnaryOperator.NOT) {
      out.append(' ');
    }
    return unary.operand().accept(this, out).append(')');
  }

  @Override
  public StringBuilder visit(AST.BinOp binOp, StringBuilder out) {
    binOp.left().accept(this, out.append('('));
    out.append(' ').append(binOp.op().repr()).append(' ');
    return binOp.right().accept(this, out).append(')');
  }

  @Override
  public StringBuilder visit(AST.Call call, StringBuilder out) {
    if (call.isGroupReference()) {
      out.append("@\"").append(RecursionDetector.calleeName(call)).append('"');
    } else {
      call.func().accept(this, out);
    }
    out.append('(');
    list(call.args(), out);
    if (!call.args().isEmpty() && !call.keywords().isEmpty()) {
      out.append(", ");
    }
    return list(call.keywords(), out).append(')');
  }

  @Override
  public StringBuilder visit(AST.Attribute attribute, StringBuilder out) {
    return attribute.value().accept(this, out).append('.').append(attribute.attr());
  }
}
