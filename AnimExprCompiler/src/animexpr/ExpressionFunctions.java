package animexpr;

import com.google.errorprone.annotations.CheckReturnValue;

/**
 * The runtime's built-in functions as typed node constructors.
 *
 * <p>Functions that apply to several value types take and return the argument's own type.
 */
@CheckReturnValue
public final class ExpressionFunctions {

  // Scalar and component-wise math

  public static <T extends ValueNode> T abs(T value) {
    return NodeFactory.create(classOf(value), NodeType.ABSOLUTE, value);
  }

  public static <T extends ValueNode> T clamp(T value, T min, T max) {
    return NodeFactory.create(classOf(value), NodeType.CLAMP, value, min, max);
  }

  public static <T extends ValueNode> T max(T first, T second) {
    return NodeFactory.create(classOf(first), NodeType.MAX, first, second);
  }

  public static <T extends ValueNode> T min(T first, T second) {
    return NodeFactory.create(classOf(first), NodeType.MIN, first, second);
  }

  public static ScalarNode acos(ScalarNode value) {
    return scalar(NodeType.ACOS, value);
  }

  public static ScalarNode asin(ScalarNode value) {
    return scalar(NodeType.ASIN, value);
  }

  public static ScalarNode atan(ScalarNode value) {
    return scalar(NodeType.ATAN, value);
  }

  public static ScalarNode ceil(ScalarNode value) {
    return scalar(NodeType.CEIL, value);
  }

  public static ScalarNode cos(ScalarNode value) {
    return scalar(NodeType.COS, value);
  }

  public static ScalarNode floor(ScalarNode value) {
    return scalar(NodeType.FLOOR, value);
  }

  public static ScalarNode ln(ScalarNode value) {
    return scalar(NodeType.LN, value);
  }

  public static ScalarNode log10(ScalarNode value) {
    return scalar(NodeType.LOG10, value);
  }

  public static ScalarNode mod(ScalarNode dividend, ScalarNode divisor) {
    return scalar(NodeType.MOD, dividend, divisor);
  }

  public static ScalarNode pow(ScalarNode value, ScalarNode power) {
    return scalar(NodeType.POW, value, power);
  }

  public static ScalarNode round(ScalarNode value) {
    return scalar(NodeType.ROUND, value);
  }

  public static ScalarNode sin(ScalarNode value) {
    return scalar(NodeType.SIN, value);
  }

  public static ScalarNode sqrt(ScalarNode value) {
    return scalar(NodeType.SQRT, value);
  }

  public static ScalarNode square(ScalarNode value) {
    return scalar(NodeType.SQUARE, value);
  }

  public static ScalarNode tan(ScalarNode value) {
    return scalar(NodeType.TAN, value);
  }

  public static ScalarNode toDegrees(ScalarNode radians) {
    return scalar(NodeType.TO_DEGREES, radians);
  }

  public static ScalarNode toRadians(ScalarNode degrees) {
    return scalar(NodeType.TO_RADIANS, degrees);
  }

  // Vectors, quaternions and matrices

  public static ScalarNode length(ValueNode value) {
    return scalar(NodeType.LENGTH, value);
  }

  public static ScalarNode lengthSquared(ValueNode value) {
    return scalar(NodeType.LENGTH_SQUARED, value);
  }

  public static <T extends ValueNode> ScalarNode distance(T first, T second) {
    return scalar(NodeType.DISTANCE, first, second);
  }

  public static <T extends ValueNode> ScalarNode distanceSquared(T first, T second) {
    return scalar(NodeType.DISTANCE_SQUARED, first, second);
  }

  public static <T extends ValueNode> T normalize(T value) {
    return NodeFactory.create(classOf(value), NodeType.NORMALIZE, value);
  }

  public static <T extends ValueNode> T lerp(T start, T end, ScalarNode progress) {
    return NodeFactory.create(classOf(start), NodeType.LERP, start, end, progress);
  }

  public static QuaternionNode slerp(QuaternionNode start, QuaternionNode end, ScalarNode progress) {
    return NodeFactory.create(QuaternionNode.class, NodeType.SLERP, start, end, progress);
  }

  public static <T extends ValueNode> T concatenate(T first, T second) {
    return NodeFactory.create(classOf(first), NodeType.CONCATENATE, first, second);
  }

  public static <T extends ValueNode> T inverse(T value) {
    return NodeFactory.create(classOf(value), NodeType.INVERSE, value);
  }

  public static <T extends ValueNode> T scale(T value, ScalarNode factor) {
    return NodeFactory.create(classOf(value), NodeType.SCALE, value, factor);
  }

  public static Vector2Node transform(Vector2Node value, Matrix3x2Node matrix) {
    return NodeFactory.create(Vector2Node.class, NodeType.TRANSFORM, value, matrix);
  }

  public static Vector4Node transform(Vector4Node value, Matrix4x4Node matrix) {
    return NodeFactory.create(Vector4Node.class, NodeType.TRANSFORM, value, matrix);
  }

  // Colors

  public static ColorNode colorArgb(ScalarNode a, ScalarNode r, ScalarNode g, ScalarNode b) {
    return NodeFactory.create(ColorNode.class, NodeType.COLOR_ARGB, a, r, g, b);
  }

  public static ColorNode colorHsl(ScalarNode h, ScalarNode s, ScalarNode l) {
    return NodeFactory.create(ColorNode.class, NodeType.COLOR_HSL, h, s, l);
  }

  public static ColorNode colorLerp(ColorNode start, ColorNode end, ScalarNode progress) {
    return NodeFactory.create(ColorNode.class, NodeType.COLOR_LERP, start, end, progress);
  }

  public static ColorNode colorLerpHsl(ColorNode start, ColorNode end, ScalarNode progress) {
    return NodeFactory.create(ColorNode.class, NodeType.COLOR_LERP_HSL, start, end, progress);
  }

  public static ColorNode colorLerpRgb(ColorNode start, ColorNode end, ScalarNode progress) {
    return NodeFactory.create(ColorNode.class, NodeType.COLOR_LERP_RGB, start, end, progress);
  }

  // Constructors

  public static Vector2Node vector2(ScalarNode x, ScalarNode y) {
    return NodeFactory.create(Vector2Node.class, NodeType.VECTOR2, x, y);
  }

  public static Vector3Node vector3(ScalarNode x, ScalarNode y, ScalarNode z) {
    return NodeFactory.create(Vector3Node.class, NodeType.VECTOR3, x, y, z);
  }

  public static Vector4Node vector4(ScalarNode x, ScalarNode y, ScalarNode z, ScalarNode w) {
    return NodeFactory.create(Vector4Node.class, NodeType.VECTOR4, x, y, z, w);
  }

  public static QuaternionNode quaternion(ScalarNode x, ScalarNode y, ScalarNode z, ScalarNode w) {
    return NodeFactory.create(QuaternionNode.class, NodeType.QUATERNION, x, y, z, w);
  }

  public static QuaternionNode quaternionFromAxisAngle(Vector3Node axis, ScalarNode angle) {
    return NodeFactory.create(
        QuaternionNode.class, NodeType.QUATERNION_FROM_AXIS_ANGLE, axis, angle);
  }

  public static Matrix3x2Node matrix3x2(
      ScalarNode m11, ScalarNode m12, ScalarNode m21, ScalarNode m22, ScalarNode m31, ScalarNode m32) {
    return NodeFactory.create(
        Matrix3x2Node.class, NodeType.MATRIX3X2, m11, m12, m21, m22, m31, m32);
  }

  public static Matrix3x2Node matrix3x2FromRotation(ScalarNode radians) {
    return NodeFactory.create(Matrix3x2Node.class, NodeType.MATRIX3X2_FROM_ROTATION, radians);
  }

  public static Matrix3x2Node matrix3x2FromScale(Vector2Node scale) {
    return NodeFactory.create(Matrix3x2Node.class, NodeType.MATRIX3X2_FROM_SCALE, scale);
  }

  public static Matrix3x2Node matrix3x2FromSkew(
      ScalarNode radiansX, ScalarNode radiansY, Vector2Node centerPoint) {
    return NodeFactory.create(
        Matrix3x2Node.class, NodeType.MATRIX3X2_FROM_SKEW, radiansX, radiansY, centerPoint);
  }

  public static Matrix3x2Node matrix3x2FromTranslation(Vector2Node translation) {
    return NodeFactory.create(
        Matrix3x2Node.class, NodeType.MATRIX3X2_FROM_TRANSLATION, translation);
  }

  /** A 4x4 matrix from its sixteen elements in row-major order. */
  public static Matrix4x4Node matrix4x4(ScalarNode... elements) {
    return NodeFactory.create(Matrix4x4Node.class, NodeType.MATRIX4X4, elements);
  }

  public static Matrix4x4Node matrix4x4FromAxisAngle(Vector3Node axis, ScalarNode angle) {
    return NodeFactory.create(
        Matrix4x4Node.class, NodeType.MATRIX4X4_FROM_AXIS_ANGLE, axis, angle);
  }

  public static Matrix4x4Node matrix4x4FromScale(Vector3Node scale) {
    return NodeFactory.create(Matrix4x4Node.class, NodeType.MATRIX4X4_FROM_SCALE, scale);
  }

  public static Matrix4x4Node matrix4x4FromTranslation(Vector3Node translation) {
    return NodeFactory.create(
        Matrix4x4Node.class, NodeType.MATRIX4X4_FROM_TRANSLATION, translation);
  }

  /** {@code ifTrue} when {@code condition} holds, else {@code ifFalse}. */
  public static <T extends ValueNode> T conditional(BooleanNode condition, T ifTrue, T ifFalse) {
    return NodeFactory.create(classOf(ifTrue), NodeType.CONDITIONAL, condition, ifTrue, ifFalse);
  }

  private static ScalarNode scalar(NodeType function, ValueNode... args) {
    return NodeFactory.create(ScalarNode.class, function, args);
  }

  // Node classes are final, so the runtime class is exactly T.
  @SuppressWarnings("unchecked")
  private static <T extends ValueNode> Class<T> classOf(T node) {
    return (Class<T>) node.getClass();
  }

  private ExpressionFunctions() {}
}
