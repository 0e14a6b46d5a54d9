package animexpr;

public final class BooleanNode extends ValueNode {

  BooleanNode(Shape shape) {
    super(shape);
  }

  public static BooleanNode of(boolean value) {
    return NodeFactory.literal(BooleanNode.class, ConstantValue.ofBoolean(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.BOOLEAN;
  }

  public BooleanNode and(BooleanNode rhs) {
    return binary(BooleanNode.class, NodeType.AND, rhs);
  }

  public BooleanNode or(BooleanNode rhs) {
    return binary(BooleanNode.class, NodeType.OR, rhs);
  }

  public BooleanNode not() {
    return unary(BooleanNode.class, NodeType.NOT);
  }

  public BooleanNode isEqualTo(BooleanNode rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(BooleanNode rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
