package animexpr;

import animexpr.Numerics.Matrix3x2;

public final class Matrix3x2Node extends ValueNode {

  Matrix3x2Node(Shape shape) {
    super(shape);
  }

  public static Matrix3x2Node of(Matrix3x2 value) {
    return NodeFactory.literal(Matrix3x2Node.class, ConstantValue.ofMatrix3x2(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.MATRIX3X2;
  }

  /** The element at a 1-based row and column, rendered as channel {@code _rc}. */
  public ScalarNode element(int row, int column) {
    if (row < 1 || row > 3 || column < 1 || column > 2)
      throw ExpressionException.invalidArgument("no element _%d%d in a Matrix3x2", row, column);
    return subchannels(ScalarNode.class, "_" + row + column);
  }

  public Vector2Node translation() {
    return subchannels(Vector2Node.class, "_31", "_32");
  }

  public Matrix3x2Node add(Matrix3x2Node rhs) {
    return binary(Matrix3x2Node.class, NodeType.ADD, rhs);
  }

  public Matrix3x2Node subtract(Matrix3x2Node rhs) {
    return binary(Matrix3x2Node.class, NodeType.SUBTRACT, rhs);
  }

  public Matrix3x2Node multiply(Matrix3x2Node rhs) {
    return binary(Matrix3x2Node.class, NodeType.MULTIPLY, rhs);
  }

  public Matrix3x2Node multiply(ScalarNode rhs) {
    return binary(Matrix3x2Node.class, NodeType.MULTIPLY, rhs);
  }

  public Matrix3x2Node negate() {
    return unary(Matrix3x2Node.class, NodeType.NEGATE);
  }

  public BooleanNode isEqualTo(Matrix3x2Node rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(Matrix3x2Node rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
