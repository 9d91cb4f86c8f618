package mf;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** Evaluates the expressions that denote a constant without building any node. */
final class ConstantFolder {

  /**
   * Literals, negated numeric literals, and vectors whose components are all of those; an
   * omitted vector component is 0.
   */
  static Optional<Value.Constant> fold(AST.Expr expr) {
    if (expr instanceof AST.Constant) {
      Optional<Object> value = ((AST.Constant) expr).value();
      return Optional.of(value.map(Value.Constant::of).orElse(Value.Constant.none()));
    }
    if (expr instanceof AST.UnaryOp) {
      AST.UnaryOp unary = (AST.UnaryOp) expr;
      if (unary.op() != AST.UnaryOperator.NEGATE) {
        return Optional.empty();
      }
      return fold(unary.operand()).flatMap(ConstantFolder::negate);
    }
    if (expr instanceof AST.Vec3) {
      AST.Vec3 vec = (AST.Vec3) expr;
      ImmutableList.Builder<Double> components = ImmutableList.builder();
      for (AST.Expr component : ImmutableList.of(vec.x(), vec.y(), vec.z())) {
        Optional<Value.Constant> folded = fold(component);
        if (!folded.isPresent()) {
          return Optional.empty();
        }
        if (!folded.get().value().isPresent()) {
          components.add(0.0);
          continue;
        }
        Optional<Double> number = asDouble(folded.get().value().get());
        if (!number.isPresent()) {
          return Optional.empty();
        }
        components.add(number.get());
      }
      return Optional.of(Value.Constant.of(components.build()));
    }
    return Optional.empty();
  }

  static Optional<Double> asDouble(Object value) {
    if (value instanceof Integer) {
      return Optional.of(((Integer) value).doubleValue());
    }
    if (value instanceof Double) {
      return Optional.of((Double) value);
    }
    return Optional.empty();
  }

  private static Optional<Value.Constant> negate(Value.Constant constant) {
    Object value = constant.value().orElse(null);
    if (value instanceof Integer) {
      return Optional.of(Value.Constant.of(-((Integer) value)));
    }
    if (value instanceof Double) {
      return Optional.of(Value.Constant.of(-((Double) value)));
    }
    return Optional.empty();
  }

  private ConstantFolder() {}
}
