package animexpr;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CheckReturnValue;

/**
 * Constructs value nodes by result type.
 *
 * <p>Arity is not checked here: a node may be built with any number of children and is
 * validated when compiled.
 */
@CheckReturnValue
public final class NodeFactory {

  private static final ImmutableMap<Class<? extends ValueNode>, Function<ExpressionNode.Shape, ? extends ValueNode>>
      CONSTRUCTORS =
          ImmutableMap.<Class<? extends ValueNode>, Function<ExpressionNode.Shape, ? extends ValueNode>>builder()
              .put(BooleanNode.class, BooleanNode::new)
              .put(ScalarNode.class, ScalarNode::new)
              .put(Vector2Node.class, Vector2Node::new)
              .put(Vector3Node.class, Vector3Node::new)
              .put(Vector4Node.class, Vector4Node::new)
              .put(ColorNode.class, ColorNode::new)
              .put(QuaternionNode.class, QuaternionNode::new)
              .put(Matrix3x2Node.class, Matrix3x2Node::new)
              .put(Matrix4x4Node.class, Matrix4x4Node::new)
              .build();

  private static final ImmutableBiMap<ValueType, Class<? extends ValueNode>> CLASSES_BY_TYPE =
      ImmutableBiMap.<ValueType, Class<? extends ValueNode>>builder()
          .put(ValueType.BOOLEAN, BooleanNode.class)
          .put(ValueType.SCALAR, ScalarNode.class)
          .put(ValueType.VECTOR2, Vector2Node.class)
          .put(ValueType.VECTOR3, Vector3Node.class)
          .put(ValueType.VECTOR4, Vector4Node.class)
          .put(ValueType.COLOR, ColorNode.class)
          .put(ValueType.QUATERNION, QuaternionNode.class)
          .put(ValueType.MATRIX3X2, Matrix3x2Node.class)
          .put(ValueType.MATRIX4X4, Matrix4x4Node.class)
          .build();

  // Swizzle result type by channel count.
  private static final ImmutableMap<Integer, Class<? extends ValueNode>> SWIZZLE_TYPES =
      ImmutableMap.<Integer, Class<? extends ValueNode>>builder()
          .put(1, ScalarNode.class)
          .put(2, Vector2Node.class)
          .put(3, Vector3Node.class)
          .put(4, Vector4Node.class)
          .put(6, Matrix3x2Node.class)
          .put(16, Matrix4x4Node.class)
          .build();

  static {
    Verify.verify(CLASSES_BY_TYPE.size() == ValueType.values().length);
    Verify.verify(CONSTRUCTORS.keySet().equals(CLASSES_BY_TYPE.values()));
  }

  /**
   * Creates a function, operator, unary operator or conditional node producing {@code type}.
   * Leaves, swizzles and reference properties have dedicated factories.
   */
  public static <T extends ValueNode> T create(
      Class<T> type, NodeType nodeType, ExpressionNode... children) {
    return create(type, nodeType, Arrays.asList(children));
  }

  public static <T extends ValueNode> T create(
      Class<T> type, NodeType nodeType, List<? extends ExpressionNode> children) {
    Preconditions.checkNotNull(nodeType);
    switch (nodeType.operationType()) {
      case FUNCTION:
      case OPERATOR:
      case UNARY_OPERATOR:
      case CONDITIONAL:
        break;
      default:
        throw ExpressionException.invalidArgument(
            "%s nodes cannot be created from children alone", nodeType);
    }

    return build(
        type,
        ExpressionNode.Shape.builder(nodeType)
            .setChildren(ImmutableList.copyOf(children))
            .build());
  }

  /** Like {@link #create(Class, NodeType, ExpressionNode...)}, choosing the class by tag. */
  public static ValueNode forValueType(
      ValueType valueType, NodeType nodeType, ExpressionNode... children) {
    return create(classFor(valueType), nodeType, children);
  }

  public static Class<? extends ValueNode> classFor(ValueType valueType) {
    Class<? extends ValueNode> type = CLASSES_BY_TYPE.get(valueType);
    if (type == null) throw ExpressionException.unsupportedType("unsupported value type %s", valueType);
    return type;
  }

  /** A {@code this.CurrentValue} or {@code this.StartingValue} node. */
  public static <T extends ValueNode> T createValueKeyword(Class<T> type, NodeType keyword) {
    if (keyword == null || !keyword.isValueKeyword())
      throw ExpressionException.invalidArgument("invalid value keyword %s", keyword);

    return build(type, ExpressionNode.Shape.of(keyword));
  }

  /**
   * A swizzle of {@code children} selecting {@code channels}. The result type follows the
   * channel count; counts other than 1, 2, 3, 4, 6 and 16 are rejected.
   */
  public static ValueNode createSwizzle(
      List<? extends ExpressionNode> children, String... channels) {
    Class<? extends ValueNode> type = SWIZZLE_TYPES.get(channels.length);
    if (type == null)
      throw ExpressionException.invalidArgument("invalid subchannel count (%d)", channels.length);

    return build(
        type,
        ExpressionNode.Shape.builder(NodeType.SWIZZLE)
            .setChildren(ImmutableList.copyOf(children))
            .setSubchannels(ImmutableList.copyOf(channels))
            .build());
  }

  static <T extends ValueNode> T createReferenceProperty(
      Class<T> type, ExpressionNode owner, String propertyName) {
    Preconditions.checkNotNull(owner);
    ExpressionNode.checkName(propertyName);

    return build(
        type,
        ExpressionNode.Shape.builder(NodeType.REFERENCE_PROPERTY)
            .setChildren(ImmutableList.of(owner))
            .setPropertyName(propertyName)
            .build());
  }

  static <T extends ValueNode> T literal(Class<T> type, ConstantValue value) {
    Verify.verify(CLASSES_BY_TYPE.get(value.type()) == type, "%s for %s", value.type(), type);

    return build(
        type, ExpressionNode.Shape.builder(NodeType.CONSTANT_VALUE).setLiteral(value).build());
  }

  static <T extends ValueNode> T constantParameter(Class<T> type, String name) {
    T node = build(type, ExpressionNode.Shape.of(NodeType.CONSTANT_PARAMETER));
    node.setParameterName(name);
    return node;
  }

  private static <T extends ValueNode> T build(Class<T> type, ExpressionNode.Shape shape) {
    Function<ExpressionNode.Shape, ? extends ValueNode> constructor =
        type == null ? null : CONSTRUCTORS.get(type);
    if (constructor == null)
      throw ExpressionException.unsupportedType("unexpected node type %s", type);

    return type.cast(constructor.apply(shape));
  }

  private NodeFactory() {}
}
