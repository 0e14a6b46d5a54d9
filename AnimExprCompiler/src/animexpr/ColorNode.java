package animexpr;

import animexpr.Numerics.Color;

public final class ColorNode extends ValueNode {

  ColorNode(Shape shape) {
    super(shape);
  }

  public static ColorNode of(Color value) {
    return NodeFactory.literal(ColorNode.class, ConstantValue.ofColor(value));
  }

  @Override
  public ValueType valueType() {
    return ValueType.COLOR;
  }

  public BooleanNode isEqualTo(ColorNode rhs) {
    return compare(NodeType.EQUAL, rhs);
  }

  public BooleanNode isNotEqualTo(ColorNode rhs) {
    return compare(NodeType.NOT_EQUAL, rhs);
  }
}
