package animexpr;

import animexpr.Numerics.Vector2;

public final class Vector2Node extends ValueNode {

  Vector2Node(Shape shape) {
    super(shape);
  }

  public static Vector2Node of(Vector2 value) {
    return NodeFactory.literal(Vector2Node.class, ConstantValue.ofVector2(value));
  }

  public static Vector2Node of(float x, float y) {
    return of(Vector2.of(x, y));
  }

  @Override
  public ValueType valueType() {
    return ValueType.VECTOR2;
  }

  public ScalarNode x() {
    return subchannels(ScalarNode.class, "X");
  }

  public ScalarNode y() {
    return subchannels(ScalarNode.class, "Y");
  }

  public Vector2Node yx() {
    return subchannels(Vector2Node.class, "Y", "X");
  }

  public Vector2Node add(Vector2Node rhs) {
    return binary(Vector2Node.class, NodeType.ADD, rhs);
  }

  public Vector2Node subtract(Vector2Node rhs) {
    return binary(Vector2Node.class, NodeType.SUBTRACT, rhs);
  }

  public Vector2Node multiply(Vector2Node rhs) {
    return binary(Vector2Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector2Node multiply(ScalarNode rhs) {
    return binary(Vector2Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector2Node divide(Vector2Node rhs) {
    return binary(Vector2Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector2Node divide(ScalarNode rhs) {
    return binary(Vector2Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector2Node negate() {
    return unary(Vector2Node.class, NodeType.NEGATE);
  }

  public BooleanNode isEqualTo(Vector2Node rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(Vector2Node rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
