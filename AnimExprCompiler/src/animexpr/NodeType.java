package animexpr;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Every kind of expression node, with the grammar production it compiles to. */
public enum NodeType {
  // Leaves
  CONSTANT_VALUE(OperationType.CONSTANT),
  CONSTANT_PARAMETER(OperationType.CONSTANT),
  REFERENCE(OperationType.REFERENCE),
  TARGET_REFERENCE(OperationType.REFERENCE),
  CURRENT_VALUE_PROPERTY(OperationType.REFERENCE),
  STARTING_VALUE_PROPERTY(OperationType.REFERENCE),

  // Member access
  REFERENCE_PROPERTY(OperationType.REFERENCE),
  SWIZZLE(OperationType.SWIZZLE),

  // Operators
  ADD(OperationType.OPERATOR, "+"),
  SUBTRACT(OperationType.OPERATOR, "-"),
  MULTIPLY(OperationType.OPERATOR, "*"),
  DIVIDE(OperationType.OPERATOR, "/"),
  MODULUS(OperationType.OPERATOR, "%"),
  AND(OperationType.OPERATOR, "&&"),
  OR(OperationType.OPERATOR, "||"),
  LESS_THAN(OperationType.OPERATOR, "<"),
  LESS_THAN_OR_EQUAL(OperationType.OPERATOR, "<="),
  GREATER_THAN(OperationType.OPERATOR, ">"),
  GREATER_THAN_OR_EQUAL(OperationType.OPERATOR, ">="),
  EQUAL(OperationType.OPERATOR, "=="),
  NOT_EQUAL(OperationType.OPERATOR, "!="),

  NEGATE(OperationType.UNARY_OPERATOR, "-"),
  NOT(OperationType.UNARY_OPERATOR, "!"),

  CONDITIONAL(OperationType.CONDITIONAL),

  // Scalar math
  ABSOLUTE(OperationType.FUNCTION, "Abs"),
  ACOS(OperationType.FUNCTION, "Acos"),
  ASIN(OperationType.FUNCTION, "Asin"),
  ATAN(OperationType.FUNCTION, "Atan"),
  CEIL(OperationType.FUNCTION, "Ceil"),
  CLAMP(OperationType.FUNCTION, "Clamp"),
  COS(OperationType.FUNCTION, "Cos"),
  FLOOR(OperationType.FUNCTION, "Floor"),
  LN(OperationType.FUNCTION, "Ln"),
  LOG10(OperationType.FUNCTION, "Log10"),
  MAX(OperationType.FUNCTION, "Max"),
  MIN(OperationType.FUNCTION, "Min"),
  MOD(OperationType.FUNCTION, "Mod"),
  POW(OperationType.FUNCTION, "Pow"),
  ROUND(OperationType.FUNCTION, "Round"),
  SIN(OperationType.FUNCTION, "Sin"),
  SQRT(OperationType.FUNCTION, "Sqrt"),
  SQUARE(OperationType.FUNCTION, "Square"),
  TAN(OperationType.FUNCTION, "Tan"),
  TO_DEGREES(OperationType.FUNCTION, "ToDegrees"),
  TO_RADIANS(OperationType.FUNCTION, "ToRadians"),

  // Vector, quaternion and matrix math
  CONCATENATE(OperationType.FUNCTION, "Concatenate"),
  DISTANCE(OperationType.FUNCTION, "Distance"),
  DISTANCE_SQUARED(OperationType.FUNCTION, "DistanceSquared"),
  INVERSE(OperationType.FUNCTION, "Inverse"),
  LENGTH(OperationType.FUNCTION, "Length"),
  LENGTH_SQUARED(OperationType.FUNCTION, "LengthSquared"),
  LERP(OperationType.FUNCTION, "Lerp"),
  NORMALIZE(OperationType.FUNCTION, "Normalize"),
  SCALE(OperationType.FUNCTION, "Scale"),
  SLERP(OperationType.FUNCTION, "Slerp"),
  TRANSFORM(OperationType.FUNCTION, "Transform"),

  // Colors
  COLOR_ARGB(OperationType.FUNCTION, "ColorArgb"),
  COLOR_HSL(OperationType.FUNCTION, "ColorHsl"),
  COLOR_LERP(OperationType.FUNCTION, "ColorLerp"),
  COLOR_LERP_HSL(OperationType.FUNCTION, "ColorLerpHSL"),
  COLOR_LERP_RGB(OperationType.FUNCTION, "ColorLerpRGB"),

  // Constructors
  VECTOR2(OperationType.FUNCTION, "Vector2"),
  VECTOR3(OperationType.FUNCTION, "Vector3"),
  VECTOR4(OperationType.FUNCTION, "Vector4"),
  QUATERNION(OperationType.FUNCTION, "Quaternion"),
  QUATERNION_FROM_AXIS_ANGLE(OperationType.FUNCTION, "Quaternion.CreateFromAxisAngle"),
  MATRIX3X2(OperationType.FUNCTION, "Matrix3x2"),
  MATRIX3X2_FROM_ROTATION(OperationType.FUNCTION, "Matrix3x2.CreateRotation"),
  MATRIX3X2_FROM_SCALE(OperationType.FUNCTION, "Matrix3x2.CreateScale"),
  MATRIX3X2_FROM_SKEW(OperationType.FUNCTION, "Matrix3x2.CreateSkew"),
  MATRIX3X2_FROM_TRANSLATION(OperationType.FUNCTION, "Matrix3x2.CreateTranslation"),
  MATRIX4X4(OperationType.FUNCTION, "Matrix4x4"),
  MATRIX4X4_FROM_AXIS_ANGLE(OperationType.FUNCTION, "Matrix4x4.CreateFromAxisAngle"),
  MATRIX4X4_FROM_SCALE(OperationType.FUNCTION, "Matrix4x4.CreateScale"),
  MATRIX4X4_FROM_TRANSLATION(OperationType.FUNCTION, "Matrix4x4.CreateTranslation");

  public enum OperationType {
    CONSTANT,
    REFERENCE,
    FUNCTION,
    OPERATOR,
    UNARY_OPERATOR,
    SWIZZLE,
    CONDITIONAL;
  }

  private final OperationType operationType;
  private final Optional<String> operation;

  NodeType(OperationType operationType) {
    this.operationType = operationType;
    this.operation = Optional.empty();
  }

  NodeType(OperationType operationType, String operation) {
    this.operationType = operationType;
    this.operation = Optional.of(operation);
  }

  public OperationType operationType() {
    return operationType;
  }

  // The function name or operator symbol, for functions and (unary) operators.
  public Optional<String> operation() {
    return operation;
  }

  public boolean isFunction() {
    return operationType == OperationType.FUNCTION;
  }

  public boolean isOperator() {
    return operationType == OperationType.OPERATOR
        || operationType == OperationType.UNARY_OPERATOR;
  }

  public boolean isValueKeyword() {
    return this == CURRENT_VALUE_PROPERTY || this == STARTING_VALUE_PROPERTY;
  }

  private static final ImmutableMap<String, NodeType> FUNCTIONS_BY_NAME =
      Maps.uniqueIndex(
          Arrays.stream(values()).filter(NodeType::isFunction).iterator(),
          t -> t.operation().get());

  public static Optional<NodeType> function(String name) {
    return Optional.ofNullable(FUNCTIONS_BY_NAME.get(name));
  }

  static {
    // Functions and operators must all carry their text; nothing else may.
    Verify.verify(
        Arrays.stream(values())
            .allMatch(t -> t.operation().isPresent() == (t.isFunction() || t.isOperator())));
  }
}
