package animexpr;

import java.lang.ref.WeakReference;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * A reference to an external animatable object, or to the animation's own target.
 *
 * <p>The object is held weakly: its lifetime belongs to the animation runtime. A reference may
 * also be named only, with the object supplied later through {@link
 * ExpressionNode#setReferenceParameter}.
 */
public final class ReferenceNode extends ExpressionNode {
  static final String TARGET = "this.target";

  private WeakReference<AnimatableObject> object;

  private ReferenceNode(NodeType nodeType, Optional<AnimatableObject> object) {
    super(Shape.of(nodeType));
    this.object = new WeakReference<>(object.orElse(null));
  }

  /** A reference that will be given a generated parameter name. */
  public static ReferenceNode of(AnimatableObject object) {
    return new ReferenceNode(NodeType.REFERENCE, Optional.of(Preconditions.checkNotNull(object)));
  }

  /** A named reference whose object is bound later. */
  public static ReferenceNode named(String name) {
    ReferenceNode node = new ReferenceNode(NodeType.REFERENCE, Optional.empty());
    node.setParameterName(name);
    return node;
  }

  public static ReferenceNode named(String name, AnimatableObject object) {
    ReferenceNode node = of(object);
    node.setParameterName(name);
    return node;
  }

  /** The object being animated, written as {@code this.target}. */
  public static ReferenceNode target() {
    return new ReferenceNode(NodeType.TARGET_REFERENCE, Optional.empty());
  }

  public boolean isTarget() {
    return nodeType() == NodeType.TARGET_REFERENCE;
  }

  /** The bound object, unless none was bound or it has since been garbage collected. */
  public Optional<AnimatableObject> object() {
    return Optional.ofNullable(object.get());
  }

  void setObject(AnimatableObject object) {
    this.object = new WeakReference<>(object);
    invalidate();
  }

  @Override
  public void setParameterName(String name) {
    if (isTarget())
      throw ExpressionException.invalidArgument("the target reference cannot be renamed");
    super.setParameterName(name);
  }

  public BooleanNode getBooleanProperty(String propertyName) {
    return getProperty(BooleanNode.class, propertyName);
  }

  public ScalarNode getScalarProperty(String propertyName) {
    return getProperty(ScalarNode.class, propertyName);
  }

  public Vector2Node getVector2Property(String propertyName) {
    return getProperty(Vector2Node.class, propertyName);
  }

  public Vector3Node getVector3Property(String propertyName) {
    return getProperty(Vector3Node.class, propertyName);
  }

  public Vector4Node getVector4Property(String propertyName) {
    return getProperty(Vector4Node.class, propertyName);
  }

  public ColorNode getColorProperty(String propertyName) {
    return getProperty(ColorNode.class, propertyName);
  }

  public QuaternionNode getQuaternionProperty(String propertyName) {
    return getProperty(QuaternionNode.class, propertyName);
  }

  public Matrix3x2Node getMatrix3x2Property(String propertyName) {
    return getProperty(Matrix3x2Node.class, propertyName);
  }

  public Matrix4x4Node getMatrix4x4Property(String propertyName) {
    return getProperty(Matrix4x4Node.class, propertyName);
  }

  public <T extends ValueNode> T getProperty(Class<T> type, String propertyName) {
    return NodeFactory.createReferenceProperty(type, this, propertyName);
  }
}
