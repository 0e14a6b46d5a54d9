package animexpr;

import java.math.BigDecimal;
import java.util.List;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

// Literal text for constants, as accepted by the animation runtime's expression grammar.
final class Literals {

  static void appendTo(ConstantValue value, StringBuilder out) {
    value.accept(new LiteralWriter(out));
  }

  // Plain decimal, no exponent, no trailing zeros: 2, 0.5, -3.25
  static String formatScalar(float value) {
    if (!Float.isFinite(value))
      throw ExpressionException.invalidArgument("cannot write non-finite scalar literal %s", value);
    if (value == 0) return "0";

    return new BigDecimal(Float.toString(value)).stripTrailingZeros().toPlainString();
  }

  private static final class LiteralWriter implements ConstantValue.Visitor<StringBuilder> {
    private final StringBuilder out;

    private LiteralWriter(StringBuilder out) {
      this.out = out;
    }

    private StringBuilder call(String function, List<Float> args) {
      out.append(function).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) out.append(',');
        out.append(formatScalar(args.get(i)));
      }
      return out.append(')');
    }

    @Override
    public StringBuilder visitBoolean(boolean value) {
      return out.append(value ? "true" : "false");
    }

    @Override
    public StringBuilder visitScalar(float value) {
      return out.append(formatScalar(value));
    }

    @Override
    public StringBuilder visitVector2(Vector2 value) {
      return call("Vector2", value.components());
    }

    @Override
    public StringBuilder visitVector3(Vector3 value) {
      return call("Vector3", value.components());
    }

    @Override
    public StringBuilder visitVector4(Vector4 value) {
      return call("Vector4", value.components());
    }

    @Override
    public StringBuilder visitColor(Color value) {
      return out.append("ColorArgb(")
          .append(value.a())
          .append(',')
          .append(value.r())
          .append(',')
          .append(value.g())
          .append(',')
          .append(value.b())
          .append(')');
    }

    @Override
    public StringBuilder visitQuaternion(Quaternion value) {
      return call("Quaternion", value.components());
    }

    @Override
    public StringBuilder visitMatrix3x2(Matrix3x2 value) {
      return call("Matrix3x2", value.components());
    }

    @Override
    public StringBuilder visitMatrix4x4(Matrix4x4 value) {
      return call("Matrix4x4", value.components());
    }
  }

  private Literals() {}
}
