package animexpr;

import animexpr.Numerics.Vector4;

public final class Vector4Node extends ValueNode {

  Vector4Node(Shape shape) {
    super(shape);
  }

  public static Vector4Node of(Vector4 value) {
    return NodeFactory.literal(Vector4Node.class, ConstantValue.ofVector4(value));
  }

  public static Vector4Node of(float x, float y, float z, float w) {
    return of(Vector4.of(x, y, z, w));
  }

  @Override
  public ValueType valueType() {
    return ValueType.VECTOR4;
  }

  public ScalarNode x() {
    return subchannels(ScalarNode.class, "X");
  }

  public ScalarNode y() {
    return subchannels(ScalarNode.class, "Y");
  }

  public ScalarNode z() {
    return subchannels(ScalarNode.class, "Z");
  }

  public ScalarNode w() {
    return subchannels(ScalarNode.class, "W");
  }

  public Vector2Node xy() {
    return subchannels(Vector2Node.class, "X", "Y");
  }

  public Vector3Node xyz() {
    return subchannels(Vector3Node.class, "X", "Y", "Z");
  }

  public Vector4Node add(Vector4Node rhs) {
    return binary(Vector4Node.class, NodeType.ADD, rhs);
  }

  public Vector4Node subtract(Vector4Node rhs) {
    return binary(Vector4Node.class, NodeType.SUBTRACT, rhs);
  }

  public Vector4Node multiply(Vector4Node rhs) {
    return binary(Vector4Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector4Node multiply(ScalarNode rhs) {
    return binary(Vector4Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector4Node divide(Vector4Node rhs) {
    return binary(Vector4Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector4Node divide(ScalarNode rhs) {
    return binary(Vector4Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector4Node negate() {
    return unary(Vector4Node.class, NodeType.NEGATE);
  }

  public BooleanNode isEqualTo(Vector4Node rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(Vector4Node rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
