package animexpr;

import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CheckReturnValue;

/** A node producing a value of one of the {@link ValueType}s. */
@CheckReturnValue
public abstract class ValueNode extends ExpressionNode {

  ValueNode(Shape shape) {
    super(shape);
  }

  public abstract ValueType valueType();

  /** The literal value of a constant node. */
  public final Optional<ConstantValue> literal() {
    return shape().literal();
  }

  /**
   * Selects channels of this value, e.g. {@code "X", "Y"} of a vector or {@code "_11"} of a
   * matrix. The result type follows the channel count: 1 scalar, 2/3/4 vector, 6 Matrix3x2, 16
   * Matrix4x4.
   */
  public ValueNode subchannels(String... channels) {
    return NodeFactory.createSwizzle(ImmutableList.of(this), channels);
  }

  final <T extends ValueNode> T subchannels(Class<T> type, String... channels) {
    ValueNode swizzle = subchannels(channels);
    if (!type.isInstance(swizzle))
      throw ExpressionException.invalidArgument(
          "%d channels select a %s, not a %s",
          channels.length, swizzle.getClass().getSimpleName(), type.getSimpleName());
    return type.cast(swizzle);
  }

  final <T extends ValueNode> T unary(Class<T> type, NodeType op) {
    return NodeFactory.create(type, op, this);
  }

  final <T extends ValueNode> T binary(Class<T> type, NodeType op, ValueNode rhs) {
    return NodeFactory.create(type, op, this, rhs);
  }

  final BooleanNode compare(NodeType op, ValueNode rhs) {
    return binary(BooleanNode.class, op, rhs);
  }
}
