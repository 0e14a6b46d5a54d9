package animexpr;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

/**
 * The runtime's handle for an expression-driven animation. Parameters set here resolve the
 * names used in the expression text.
 */
public interface ExpressionAnimation extends AutoCloseable {
  void setExpression(String expression);

  void setReferenceParameter(String name, AnimatableObject object);

  void setBooleanParameter(String name, boolean value);

  void setScalarParameter(String name, float value);

  void setVector2Parameter(String name, Vector2 value);

  void setVector3Parameter(String name, Vector3 value);

  void setVector4Parameter(String name, Vector4 value);

  void setColorParameter(String name, Color value);

  void setQuaternionParameter(String name, Quaternion value);

  void setMatrix3x2Parameter(String name, Matrix3x2 value);

  void setMatrix4x4Parameter(String name, Matrix4x4 value);

  /** Releases the runtime resources behind this animation. */
  @Override
  void close();
}
