package animexpr;

import animexpr.Numerics.Vector3;

public final class Vector3Node extends ValueNode {

  Vector3Node(Shape shape) {
    super(shape);
  }

  public static Vector3Node of(Vector3 value) {
    return NodeFactory.literal(Vector3Node.class, ConstantValue.ofVector3(value));
  }

  public static Vector3Node of(float x, float y, float z) {
    return of(Vector3.of(x, y, z));
  }

  @Override
  public ValueType valueType() {
    return ValueType.VECTOR3;
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

  public Vector2Node xy() {
    return subchannels(Vector2Node.class, "X", "Y");
  }

  public Vector2Node xz() {
    return subchannels(Vector2Node.class, "X", "Z");
  }

  public Vector3Node add(Vector3Node rhs) {
    return binary(Vector3Node.class, NodeType.ADD, rhs);
  }

  public Vector3Node subtract(Vector3Node rhs) {
    return binary(Vector3Node.class, NodeType.SUBTRACT, rhs);
  }

  public Vector3Node multiply(Vector3Node rhs) {
    return binary(Vector3Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector3Node multiply(ScalarNode rhs) {
    return binary(Vector3Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector3Node divide(Vector3Node rhs) {
    return binary(Vector3Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector3Node divide(ScalarNode rhs) {
    return binary(Vector3Node.class, NodeType.DIVIDE, rhs);
  }

  public Vector3Node negate() {
    return unary(Vector3Node.class, NodeType.NEGATE);
  }

  public BooleanNode isEqualTo(Vector3Node rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(Vector3Node rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
