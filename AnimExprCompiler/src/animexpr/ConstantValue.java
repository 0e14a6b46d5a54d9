package animexpr;

import com.google.auto.value.AutoValue;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

/**
 * A strongly-typed immediate value, used for literal constant nodes and for named constant
 * parameters.
 *
 * <p>The set of variants is closed: construction goes through the static factories and
 * consumers dispatch through {@link Visitor}, so a new variant does not compile until every
 * visitor handles it.
 */
public abstract class ConstantValue {

  public interface Visitor<R> {
    R visitBoolean(boolean value);

    R visitScalar(float value);

    R visitVector2(Vector2 value);

    R visitVector3(Vector3 value);

    R visitVector4(Vector4 value);

    R visitColor(Color value);

    R visitQuaternion(Quaternion value);

    R visitMatrix3x2(Matrix3x2 value);

    R visitMatrix4x4(Matrix4x4 value);
  }

  ConstantValue() {}

  public abstract ValueType type();

  public abstract <R> R accept(Visitor<R> visitor);

  public static ConstantValue ofBoolean(boolean value) {
    return new AutoValue_ConstantValue_BooleanValue(value);
  }

  public static ConstantValue ofScalar(float value) {
    return new AutoValue_ConstantValue_ScalarValue(value);
  }

  public static ConstantValue ofVector2(Vector2 value) {
    return new AutoValue_ConstantValue_Vector2Value(value);
  }

  public static ConstantValue ofVector3(Vector3 value) {
    return new AutoValue_ConstantValue_Vector3Value(value);
  }

  public static ConstantValue ofVector4(Vector4 value) {
    return new AutoValue_ConstantValue_Vector4Value(value);
  }

  public static ConstantValue ofColor(Color value) {
    return new AutoValue_ConstantValue_ColorValue(value);
  }

  public static ConstantValue ofQuaternion(Quaternion value) {
    return new AutoValue_ConstantValue_QuaternionValue(value);
  }

  public static ConstantValue ofMatrix3x2(Matrix3x2 value) {
    return new AutoValue_ConstantValue_Matrix3x2Value(value);
  }

  public static ConstantValue ofMatrix4x4(Matrix4x4 value) {
    return new AutoValue_ConstantValue_Matrix4x4Value(value);
  }

  @AutoValue
  abstract static class BooleanValue extends ConstantValue {
    abstract boolean value();

    @Override
    public final ValueType type() {
      return ValueType.BOOLEAN;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitBoolean(value());
    }
  }

  @AutoValue
  abstract static class ScalarValue extends ConstantValue {
    abstract float value();

    @Override
    public final ValueType type() {
      return ValueType.SCALAR;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitScalar(value());
    }
  }

  @AutoValue
  abstract static class Vector2Value extends ConstantValue {
    abstract Vector2 value();

    @Override
    public final ValueType type() {
      return ValueType.VECTOR2;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitVector2(value());
    }
  }

  @AutoValue
  abstract static class Vector3Value extends ConstantValue {
    abstract Vector3 value();

    @Override
    public final ValueType type() {
      return ValueType.VECTOR3;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitVector3(value());
    }
  }

  @AutoValue
  abstract static class Vector4Value extends ConstantValue {
    abstract Vector4 value();

    @Override
    public final ValueType type() {
      return ValueType.VECTOR4;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitVector4(value());
    }
  }

  @AutoValue
  abstract static class ColorValue extends ConstantValue {
    abstract Color value();

    @Override
    public final ValueType type() {
      return ValueType.COLOR;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitColor(value());
    }
  }

  @AutoValue
  abstract static class QuaternionValue extends ConstantValue {
    abstract Quaternion value();

    @Override
    public final ValueType type() {
      return ValueType.QUATERNION;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitQuaternion(value());
    }
  }

  @AutoValue
  abstract static class Matrix3x2Value extends ConstantValue {
    abstract Matrix3x2 value();

    @Override
    public final ValueType type() {
      return ValueType.MATRIX3X2;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitMatrix3x2(value());
    }
  }

  @AutoValue
  abstract static class Matrix4x4Value extends ConstantValue {
    abstract Matrix4x4 value();

    @Override
    public final ValueType type() {
      return ValueType.MATRIX4X4;
    }

    @Override
    public final <R> R accept(Visitor<R> visitor) {
      return visitor.visitMatrix4x4(value());
    }
  }
}
