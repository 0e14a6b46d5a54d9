package animexpr;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

// Pushes a collected ParameterSet onto an animation.
final class ParameterBinder {
  private static final Logger logger = LoggerFactory.getLogger(ParameterBinder.class);

  static void bindAll(ParameterSet parameters, ExpressionAnimation target) {
    for (ParameterSet.ReferenceParameter reference : parameters.references()) {
      AnimatableObject object =
          reference
              .object()
              .orElseThrow(
                  () ->
                      ExpressionException.ambiguousReference(
                          "reference parameter '%s' has no object bound", reference.name()));
      target.setReferenceParameter(reference.name(), object);
    }

    for (Map.Entry<String, ConstantValue> constant : parameters.constants().entrySet()) {
      constant.getValue().accept(new ConstantSetter(target, constant.getKey()));
    }

    logger.debug(
        "Bound {} reference(s) and {} constant(s)",
        parameters.references().size(),
        parameters.constants().size());
  }

  private static final class ConstantSetter implements ConstantValue.Visitor<Void> {
    private final ExpressionAnimation target;
    private final String name;

    private ConstantSetter(ExpressionAnimation target, String name) {
      this.target = target;
      this.name = name;
    }

    @Override
    public Void visitBoolean(boolean value) {
      target.setBooleanParameter(name, value);
      return null;
    }

    @Override
    public Void visitScalar(float value) {
      target.setScalarParameter(name, value);
      return null;
    }

    @Override
    public Void visitVector2(Vector2 value) {
      target.setVector2Parameter(name, value);
      return null;
    }

    @Override
    public Void visitVector3(Vector3 value) {
      target.setVector3Parameter(name, value);
      return null;
    }

    @Override
    public Void visitVector4(Vector4 value) {
      target.setVector4Parameter(name, value);
      return null;
    }

    @Override
    public Void visitColor(Color value) {
      target.setColorParameter(name, value);
      return null;
    }

    @Override
    public Void visitQuaternion(Quaternion value) {
      target.setQuaternionParameter(name, value);
      return null;
    }

    @Override
    public Void visitMatrix3x2(Matrix3x2 value) {
      target.setMatrix3x2Parameter(name, value);
      return null;
    }

    @Override
    public Void visitMatrix4x4(Matrix4x4 value) {
      target.setMatrix4x4Parameter(name, value);
      return null;
    }
  }

  private ParameterBinder() {}
}
