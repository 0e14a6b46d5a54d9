package animexpr;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

/** Leaf nodes: named constants, references, the target and the animated value keywords. */
public final class ExpressionValues {

  /**
   * Constant parameters. A parameter created without a value must have one set before the
   * animation starts, either on an ancestor node or directly on the animation.
   */
  public static final class Constant {
    public static BooleanNode createConstantBoolean(String name) {
      return NodeFactory.constantParameter(BooleanNode.class, name);
    }

    public static BooleanNode createConstantBoolean(String name, boolean value) {
      BooleanNode node = createConstantBoolean(name);
      node.setBooleanParameter(name, value);
      return node;
    }

    public static ScalarNode createConstantScalar(String name) {
      return NodeFactory.constantParameter(ScalarNode.class, name);
    }

    public static ScalarNode createConstantScalar(String name, float value) {
      ScalarNode node = createConstantScalar(name);
      node.setScalarParameter(name, value);
      return node;
    }

    public static Vector2Node createConstantVector2(String name) {
      return NodeFactory.constantParameter(Vector2Node.class, name);
    }

    public static Vector2Node createConstantVector2(String name, Vector2 value) {
      Vector2Node node = createConstantVector2(name);
      node.setVector2Parameter(name, value);
      return node;
    }

    public static Vector3Node createConstantVector3(String name) {
      return NodeFactory.constantParameter(Vector3Node.class, name);
    }

    public static Vector3Node createConstantVector3(String name, Vector3 value) {
      Vector3Node node = createConstantVector3(name);
      node.setVector3Parameter(name, value);
      return node;
    }

    public static Vector4Node createConstantVector4(String name) {
      return NodeFactory.constantParameter(Vector4Node.class, name);
    }

    public static Vector4Node createConstantVector4(String name, Vector4 value) {
      Vector4Node node = createConstantVector4(name);
      node.setVector4Parameter(name, value);
      return node;
    }

    public static ColorNode createConstantColor(String name) {
      return NodeFactory.constantParameter(ColorNode.class, name);
    }

    public static ColorNode createConstantColor(String name, Color value) {
      ColorNode node = createConstantColor(name);
      node.setColorParameter(name, value);
      return node;
    }

    public static QuaternionNode createConstantQuaternion(String name) {
      return NodeFactory.constantParameter(QuaternionNode.class, name);
    }

    public static QuaternionNode createConstantQuaternion(String name, Quaternion value) {
      QuaternionNode node = createConstantQuaternion(name);
      node.setQuaternionParameter(name, value);
      return node;
    }

    public static Matrix3x2Node createConstantMatrix3x2(String name) {
      return NodeFactory.constantParameter(Matrix3x2Node.class, name);
    }

    public static Matrix3x2Node createConstantMatrix3x2(String name, Matrix3x2 value) {
      Matrix3x2Node node = createConstantMatrix3x2(name);
      node.setMatrix3x2Parameter(name, value);
      return node;
    }

    public static Matrix4x4Node createConstantMatrix4x4(String name) {
      return NodeFactory.constantParameter(Matrix4x4Node.class, name);
    }

    public static Matrix4x4Node createConstantMatrix4x4(String name, Matrix4x4 value) {
      Matrix4x4Node node = createConstantMatrix4x4(name);
      node.setMatrix4x4Parameter(name, value);
      return node;
    }

    private Constant() {}
  }

  public static final class Reference {
    public static ReferenceNode create(AnimatableObject object) {
      return ReferenceNode.of(object);
    }

    public static ReferenceNode create(String name) {
      return ReferenceNode.named(name);
    }

    public static ReferenceNode create(String name, AnimatableObject object) {
      return ReferenceNode.named(name, object);
    }

    private Reference() {}
  }

  public static final class Target {
    public static ReferenceNode create() {
      return ReferenceNode.target();
    }

    private Target() {}
  }

  /** {@code this.CurrentValue}: the animated property's value on the current frame. */
  public static final class CurrentValue {
    public static BooleanNode createBoolean() {
      return create(BooleanNode.class);
    }

    public static ScalarNode createScalar() {
      return create(ScalarNode.class);
    }

    public static Vector2Node createVector2() {
      return create(Vector2Node.class);
    }

    public static Vector3Node createVector3() {
      return create(Vector3Node.class);
    }

    public static Vector4Node createVector4() {
      return create(Vector4Node.class);
    }

    public static ColorNode createColor() {
      return create(ColorNode.class);
    }

    public static QuaternionNode createQuaternion() {
      return create(QuaternionNode.class);
    }

    public static Matrix3x2Node createMatrix3x2() {
      return create(Matrix3x2Node.class);
    }

    public static Matrix4x4Node createMatrix4x4() {
      return create(Matrix4x4Node.class);
    }

    public static <T extends ValueNode> T create(Class<T> type) {
      return NodeFactory.createValueKeyword(type, NodeType.CURRENT_VALUE_PROPERTY);
    }

    private CurrentValue() {}
  }

  /** {@code this.StartingValue}: the animated property's value when the animation started. */
  public static final class StartingValue {
    public static BooleanNode createBoolean() {
      return create(BooleanNode.class);
    }

    public static ScalarNode createScalar() {
      return create(ScalarNode.class);
    }

    public static Vector2Node createVector2() {
      return create(Vector2Node.class);
    }

    public static Vector3Node createVector3() {
      return create(Vector3Node.class);
    }

    public static Vector4Node createVector4() {
      return create(Vector4Node.class);
    }

    public static ColorNode createColor() {
      return create(ColorNode.class);
    }

    public static QuaternionNode createQuaternion() {
      return create(QuaternionNode.class);
    }

    public static Matrix3x2Node createMatrix3x2() {
      return create(Matrix3x2Node.class);
    }

    public static Matrix4x4Node createMatrix4x4() {
      return create(Matrix4x4Node.class);
    }

    public static <T extends ValueNode> T create(Class<T> type) {
      return NodeFactory.createValueKeyword(type, NodeType.STARTING_VALUE_PROPERTY);
    }

    private StartingValue() {}
  }

  private ExpressionValues() {}
}
