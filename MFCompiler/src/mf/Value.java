package mf;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A value on the interpreter stack or bound to a variable. */
public abstract class Value {
  public enum Kind {
    CONSTANT,
    NAME_REF,
    PORT,
    STRUCT;
  }

  public abstract Kind kind();

  public boolean is(Kind kind) {
    return kind() == kind;
  }

  @SuppressWarnings("unchecked")
  public <T extends Value> T cast() {
    return (T) this;
  }

  /**
   * A literal: Integer, Double, Boolean, String, a 3-element ImmutableList of Doubles for vectors,
   * or empty for "leave the socket at its default".
   */
  @AutoValue
  public abstract static class Constant extends Value {
    private static final Constant NONE = new AutoValue_Value_Constant(Optional.empty());

    public abstract Optional<Object> value();

    @Override
    public Kind kind() {
      return Kind.CONSTANT;
    }

    public boolean isInteger() {
      return value().isPresent() && value().get() instanceof Integer;
    }

    public static Constant of(Object value) {
      checkConstant(value);
      return new AutoValue_Value_Constant(Optional.of(value));
    }

    public static Constant none() {
      return NONE;
    }

    static void checkConstant(Object value) {
      Preconditions.checkArgument(
          value instanceof Integer
              || value instanceof Double
              || value instanceof Boolean
              || value instanceof String
              || isVector(value),
          "Not a constant: %s",
          value);
    }

    private static boolean isVector(Object value) {
      if (!(value instanceof ImmutableList) || ((ImmutableList<?>) value).size() != 3) {
        return false;
      }
      return ((ImmutableList<?>) value).stream().allMatch(e -> e instanceof Double);
    }

    @Override
    public final String toString() {
      return value().map(String::valueOf).orElse("_");
    }
  }

  /** An indirect reference to a variable, resolved when it is bound or linked. */
  @AutoValue
  public abstract static class NameRef extends Value {
    public abstract String id();

    @Override
    public Kind kind() {
      return Kind.NAME_REF;
    }

    public static NameRef of(String id) {
      return new AutoValue_Value_NameRef(id);
    }

    @Override
    public final String toString() {
      return "&" + id();
    }
  }

  @AutoValue
  public abstract static class Port extends Value {
    public abstract GraphSocket socket();

    @Override
    public Kind kind() {
      return Kind.PORT;
    }

    public static Port of(GraphSocket socket) {
      return new AutoValue_Value_Port(socket);
    }

    @Override
    public final String toString() {
      return socket().identity();
    }
  }

  /**
   * An ordered group of values: the outputs of a multi-output call, or a packed list.
   *
   * <p>Elements are stored last-first. {@link #output(int)} takes indices in declaration order and
   * {@link #elements()} returns the storage order, which is the order {@code SPLIT_STRUCT} pushes
   * them in.
   */
  public static final class Struct extends Value {
    private final ImmutableList<Value> storage;

    private Struct(ImmutableList<Value> storage) {
      this.storage = storage;
    }

    /** A multi-output result; {@code outputs} are in declaration order. */
    public static Struct ofOutputs(List<? extends Value> outputs) {
      return new Struct(ImmutableList.<Value>copyOf(outputs).reverse());
    }

    /** A packed list; {@code elements} are in storage order. */
    public static Struct ofElements(List<? extends Value> elements) {
      return new Struct(ImmutableList.copyOf(elements));
    }

    @Override
    public Kind kind() {
      return Kind.STRUCT;
    }

    public int size() {
      return storage.size();
    }

    public Value output(int index) {
      Preconditions.checkElementIndex(index, storage.size(), "output index");
      return storage.get(storage.size() - 1 - index);
    }

    public ImmutableList<Value> elements() {
      return storage;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Struct && ((Struct) obj).storage.equals(storage);
    }

    @Override
    public int hashCode() {
      return storage.hashCode();
    }

    @Override
    public String toString() {
      return storage.toString();
    }
  }
}
