package animexpr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

// Records every call, keyed by parameter name.
class RecordingExpressionAnimation implements ExpressionAnimation {
  String expression;
  boolean closed;

  final Map<String, AnimatableObject> references = new LinkedHashMap<>();
  final Map<String, Object> constants = new LinkedHashMap<>();
  final List<String> setterCalls = new ArrayList<>();

  private void record(String setter, String name, Object value) {
    constants.put(name, value);
    setterCalls.add(setter + " " + name);
  }

  @Override
  public void setExpression(String expression) {
    this.expression = expression;
  }

  @Override
  public void setReferenceParameter(String name, AnimatableObject object) {
    references.put(name, object);
  }

  @Override
  public void setBooleanParameter(String name, boolean value) {
    record("boolean", name, value);
  }

  @Override
  public void setScalarParameter(String name, float value) {
    record("scalar", name, value);
  }

  @Override
  public void setVector2Parameter(String name, Vector2 value) {
    record("vector2", name, value);
  }

  @Override
  public void setVector3Parameter(String name, Vector3 value) {
    record("vector3", name, value);
  }

  @Override
  public void setVector4Parameter(String name, Vector4 value) {
    record("vector4", name, value);
  }

  @Override
  public void setColorParameter(String name, Color value) {
    record("color", name, value);
  }

  @Override
  public void setQuaternionParameter(String name, Quaternion value) {
    record("quaternion", name, value);
  }

  @Override
  public void setMatrix3x2Parameter(String name, Matrix3x2 value) {
    record("matrix3x2", name, value);
  }

  @Override
  public void setMatrix4x4Parameter(String name, Matrix4x4 value) {
    record("matrix4x4", name, value);
  }

  @Override
  public void close() {
    closed = true;
  }
}
