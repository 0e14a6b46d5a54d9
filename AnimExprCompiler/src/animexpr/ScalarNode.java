package animexpr;

public final class ScalarNode extends ValueNode {

  ScalarNode(Shape shape) {
    super(shape);
  }

  public static ScalarNode of(float value) {
    return NodeFactory.literal(ScalarNode.class, ConstantValue.ofScalar(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.SCALAR;
  }

  public ScalarNode add(ScalarNode rhs) {
    return binary(ScalarNode.class, NodeType.ADD, rhs);
  }

  public ScalarNode subtract(ScalarNode rhs) {
    return binary(ScalarNode.class, NodeType.SUBTRACT, rhs);
  }

  public ScalarNode multiply(ScalarNode rhs) {
    return binary(ScalarNode.class, NodeType.MULTIPLY, rhs);
  }

  public Vector2Node multiply(Vector2Node rhs) {
    return binary(Vector2Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector3Node multiply(Vector3Node rhs) {
    return binary(Vector3Node.class, NodeType.MULTIPLY, rhs);
  }

  public Vector4Node multiply(Vector4Node rhs) {
    return binary(Vector4Node.class, NodeType.MULTIPLY, rhs);
  }

  public ScalarNode divide(ScalarNode rhs) {
    return binary(ScalarNode.class, NodeType.DIVIDE, rhs);
  }

  public ScalarNode modulus(ScalarNode rhs) {
    return binary(ScalarNode.class, NodeType.MODULUS, rhs);
  }

  public ScalarNode negate() {
    return unary(ScalarNode.class, NodeType.NEGATE);
  }

  public BooleanNode lessThan(ScalarNode rhs) {
    return compare(NodeType.LESS_THAN, rhs);
  }

  public BooleanNode lessThanOrEqual(ScalarNode rhs) {
    return compare(NodeType.LESS_THAN_OR_EQUAL, rhs);
  }

  public BooleanNode greaterThan(ScalarNode rhs) {
    return compare(NodeType.GREATER_THAN, rhs);
  }

  public BooleanNode greaterThanOrEqual(ScalarNode rhs) {
    return compare(NodeType.GREATER_THAN_OR_EQUAL, rhs);
  }

  public BooleanNode isEqualTo(ScalarNode rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(ScalarNode rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
