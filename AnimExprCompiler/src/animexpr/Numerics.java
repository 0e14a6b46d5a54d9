package animexpr;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Immutable value types for the non-primitive constants an expression can carry. */
public final class Numerics {

  @AutoValue
  public abstract static class Vector2 {
    public abstract float x();

    public abstract float y();

    public static Vector2 of(float x, float y) {
      return new AutoValue_Numerics_Vector2(x, y);
    }

    public final ImmutableList<Float> components() {
      return ImmutableList.of(x(), y());
    }
  }

  @AutoValue
  public abstract static class Vector3 {
    public abstract float x();

    public abstract float y();

    public abstract float z();

    public static Vector3 of(float x, float y, float z) {
      return new AutoValue_Numerics_Vector3(x, y, z);
    }

    public final ImmutableList<Float> components() {
      return ImmutableList.of(x(), y(), z());
    }
  }

  @AutoValue
  public abstract static class Vector4 {
    public abstract float x();

    public abstract float y();

    public abstract float z();

    public abstract float w();

    public static Vector4 of(float x, float y, float z, float w) {
      return new AutoValue_Numerics_Vector4(x, y, z, w);
    }

    public final ImmutableList<Float> components() {
      return ImmutableList.of(x(), y(), z(), w());
    }
  }

  @AutoValue
  public abstract static class Quaternion {
    public abstract float x();

    public abstract float y();

    public abstract float z();

    public abstract float w();

    public static Quaternion of(float x, float y, float z, float w) {
      return new AutoValue_Numerics_Quaternion(x, y, z, w);
    }

    public static Quaternion identity() {
      return of(0, 0, 0, 1);
    }

    public final ImmutableList<Float> components() {
      return ImmutableList.of(x(), y(), z(), w());
    }
  }

  // 8 bits per channel.
  @AutoValue
  public abstract static class Color {
    public abstract int a();

    public abstract int r();

    public abstract int g();

    public abstract int b();

    public static Color argb(int a, int r, int g, int b) {
      checkChannel("alpha", a);
      checkChannel("red", r);
      checkChannel("green", g);
      checkChannel("blue", b);
      return new AutoValue_Numerics_Color(a, r, g, b);
    }

    public static Color rgb(int r, int g, int b) {
      return argb(255, r, g, b);
    }

    private static void checkChannel(String channel, int value) {
      if (value < 0 || value > 255)
        throw ExpressionException.invalidArgument(
            "%s channel must be in [0, 255], but was %d", channel, value);
    }
  }

  // Row-major, named after the row and column of each element.
  @AutoValue
  public abstract static class Matrix3x2 {
    public abstract float m11();

    public abstract float m12();

    public abstract float m21();

    public abstract float m22();

    public abstract float m31();

    public abstract float m32();

    public static Matrix3x2 of(float m11, float m12, float m21, float m22, float m31, float m32) {
      return new AutoValue_Numerics_Matrix3x2(m11, m12, m21, m22, m31, m32);
    }

    public static Matrix3x2 identity() {
      return of(1, 0, 0, 1, 0, 0);
    }

    public final ImmutableList<Float> components() {
      return ImmutableList.of(m11(), m12(), m21(), m22(), m31(), m32());
    }
  }

  @AutoValue
  public abstract static class Matrix4x4 {
    // Row-major, 16 elements.
    abstract ImmutableList<Float> elements();

    public static Matrix4x4 of(float... elements) {
      if (elements.length != 16)
        throw ExpressionException.invalidArgument(
            "Matrix4x4 requires 16 elements, but got %d", elements.length);

      ImmutableList.Builder<Float> builder = ImmutableList.builder();
      for (float element : elements) {
        builder.add(element);
      }
      return new AutoValue_Numerics_Matrix4x4(builder.build());
    }

    public static Matrix4x4 identity() {
      return of(1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1);
    }

    // 1-based, as in m11..m44.
    public final float get(int row, int column) {
      if (row < 1 || row > 4 || column < 1 || column > 4)
        throw ExpressionException.invalidArgument("no element m%d%d in a Matrix4x4", row, column);
      return elements().get((row - 1) * 4 + (column - 1));
    }

    public final ImmutableList<Float> components() {
      return elements();
    }
  }

  private Numerics() {}
}
