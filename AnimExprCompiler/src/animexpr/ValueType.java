package animexpr;

/** The result types an expression node or constant parameter can have. */
public enum ValueType {
  BOOLEAN,
  SCALAR,
  VECTOR2,
  VECTOR3,
  VECTOR4,
  COLOR,
  QUATERNION,
  MATRIX3X2,
  MATRIX4X4
}
