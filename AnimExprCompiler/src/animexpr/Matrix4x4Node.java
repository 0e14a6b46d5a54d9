package animexpr;

import animexpr.Numerics.Matrix4x4;

public final class Matrix4x4Node extends ValueNode {

  Matrix4x4Node(Shape shape) {
    super(shape);
  }

  public static Matrix4x4Node of(Matrix4x4 value) {
    return NodeFactory.literal(Matrix4x4Node.class, ConstantValue.ofMatrix4x4(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.MATRIX4X4;
  }

  /** The element at a 1-based row and column, rendered as channel {@code _rc}. */
  public ScalarNode element(int row, int column) {
    if (row < 1 || row > 4 || column < 1 || column > 4)
      throw ExpressionException.invalidArgument("no element _%d%d in a Matrix4x4", row, column);
    return subchannels(ScalarNode.class, "_" + row + column);
  }

  public Vector3Node translation() {
    return subchannels(Vector3Node.class, "_41", "_42", "_43");
  }

  public Matrix4x4Node add(Matrix4x4Node rhs) {
    return binary(Matrix4x4Node.class, NodeType.ADD, rhs);
  }

  public Matrix4x4Node subtract(Matrix4x4Node rhs) {
    return binary(Matrix4x4Node.class, NodeType.SUBTRACT, rhs);
  }

  public Matrix4x4Node multiply(Matrix4x4Node rhs) {
    return binary(Matrix4x4Node.class, NodeType.MULTIPLY, rhs);
  }

  public Matrix4x4Node multiply(ScalarNode rhs) {
    return binary(Matrix4x4Node.class, NodeType.MULTIPLY, rhs);
  }

  public Matrix4x4Node negate() {
    return unary(Matrix4x4Node.class, NodeType.NEGATE);
  }

  public BooleanNode isEqualTo(Matrix4x4Node rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(Matrix4x4Node rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
