package animexpr;

import animexpr.Numerics.Quaternion;

public final class QuaternionNode extends ValueNode {

  QuaternionNode(Shape shape) {
    super(shape);
  }

  public static QuaternionNode of(Quaternion value) {
    return NodeFactory.literal(QuaternionNode.class, ConstantValue.ofQuaternion(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.QUATERNION;
  }

  public QuaternionNode multiply(QuaternionNode rhs) {
    return binary(QuaternionNode.class, NodeType.MULTIPLY, rhs);
  }

  public QuaternionNode multiply(ScalarNode rhs) {
    return binary(QuaternionNode.class, NodeType.MULTIPLY, rhs);
  }

  public BooleanNode isEqualTo(QuaternionNode rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(QuaternionNode rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
