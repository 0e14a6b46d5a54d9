package animexpr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

/**
 * A node of an expression tree.
 *
 * <p>The shape of a node (its type, children, property name and swizzle channels) is fixed at
 * construction. Its parameter name, local constants and, for references, the bound object may
 * change; any such change invalidates the compiled form of every tree containing the node.
 *
 * <p>Children may be shared between trees. Closing a node releases only what the node itself
 * holds and never touches its children.
 *
 * <p>Not thread-safe. Callers sharing a tree across threads must serialize access to it.
 */
public abstract class ExpressionNode implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ExpressionNode.class);

  // Bumped by every mutation of any node. A cache is valid only while this is unchanged, so
  // changes to a shared child are seen by every tree holding it.
  private static final AtomicLong mutations = new AtomicLong();

  @AutoValue
  abstract static class Shape {
    abstract NodeType nodeType();

    abstract ImmutableList<ExpressionNode> children();

    abstract Optional<String> propertyName();

    abstract ImmutableList<String> subchannels();

    // Only for CONSTANT_VALUE nodes.
    abstract Optional<ConstantValue> literal();

    static Builder builder(NodeType nodeType) {
      return new AutoValue_ExpressionNode_Shape.Builder()
          .setNodeType(nodeType)
          .setChildren(ImmutableList.of())
          .setSubchannels(ImmutableList.of());
    }

    static Shape of(NodeType nodeType) {
      return builder(nodeType).build();
    }

    @AutoValue.Builder
    abstract static class Builder {
      abstract Builder setNodeType(NodeType nodeType);

      abstract Builder setChildren(ImmutableList<ExpressionNode> children);

      abstract Builder setPropertyName(String propertyName);

      abstract Builder setSubchannels(ImmutableList<String> subchannels);

      abstract Builder setLiteral(ConstantValue literal);

      abstract Shape build();
    }
  }

  private final Shape shape;

  private Optional<String> parameterName = Optional.empty();
  // Keyed by lower-cased name; the entry keeps the name as last written.
  private final Map<String, Map.Entry<String, ConstantValue>> localConstants =
      new LinkedHashMap<>();

  private Optional<ParameterSet> parameters = Optional.empty();
  private Optional<String> expression = Optional.empty();
  private long cachedAt = -1;

  private Optional<ExpressionAnimation> animation = Optional.empty();

  ExpressionNode(Shape shape) {
    this.shape = shape;
  }

  final Shape shape() {
    return shape;
  }

  public final NodeType nodeType() {
    return shape.nodeType();
  }

  public final ImmutableList<ExpressionNode> children() {
    return shape.children();
  }

  public final Optional<String> propertyName() {
    return shape.propertyName();
  }

  public final ImmutableList<String> subchannels() {
    return shape.subchannels();
  }

  /** The name this node was explicitly given, if any. Generated names are not reported here. */
  public final Optional<String> parameterName() {
    return parameterName;
  }

  public void setParameterName(String name) {
    parameterName = Optional.of(checkName(name));
    invalidate();
  }

  public void clearParameterName() {
    parameterName = Optional.empty();
    invalidate();
  }

  public final void setBooleanParameter(String name, boolean value) {
    setConstantParameter(name, ConstantValue.ofBoolean(value));
  }

  public final void setScalarParameter(String name, float value) {
    setConstantParameter(name, ConstantValue.ofScalar(value));
  }

  public final void setVector2Parameter(String name, Vector2 value) {
    setConstantParameter(name, ConstantValue.ofVector2(value));
  }

  public final void setVector3Parameter(String name, Vector3 value) {
    setConstantParameter(name, ConstantValue.ofVector3(value));
  }

  public final void setVector4Parameter(String name, Vector4 value) {
    setConstantParameter(name, ConstantValue.ofVector4(value));
  }

  public final void setColorParameter(String name, Color value) {
    setConstantParameter(name, ConstantValue.ofColor(value));
  }

  public final void setQuaternionParameter(String name, Quaternion value) {
    setConstantParameter(name, ConstantValue.ofQuaternion(value));
  }

  public final void setMatrix3x2Parameter(String name, Matrix3x2 value) {
    setConstantParameter(name, ConstantValue.ofMatrix3x2(value));
  }

  public final void setMatrix4x4Parameter(String name, Matrix4x4 value) {
    setConstantParameter(name, ConstantValue.ofMatrix4x4(value));
  }

  /** Declares a named constant on this node. Names are case-insensitive; the last write wins. */
  public final void setConstantParameter(String name, ConstantValue value) {
    Preconditions.checkNotNull(value);
    checkName(name);
    localConstants.put(Ascii.toLowerCase(name), Maps.immutableEntry(name, value));
    invalidate();
  }

  /** The constants declared directly on this node, in declaration order. */
  public final ImmutableMap<String, ConstantValue> localConstants() {
    ImmutableMap.Builder<String, ConstantValue> builder = ImmutableMap.builder();
    localConstants.values().forEach(e -> builder.put(e.getKey(), e.getValue()));
    return builder.build();
  }

  /**
   * Points every reference in this tree whose parameter name matches {@code name}, ignoring
   * case, at {@code object}. Generated names match as well as explicit ones.
   */
  public final void setReferenceParameter(String name, AnimatableObject object) {
    Preconditions.checkNotNull(object);
    checkName(name);

    int matches = 0;
    for (Map.Entry<ReferenceNode, String> entry : parameters().referenceNames().entrySet()) {
      if (entry.getValue().equalsIgnoreCase(name)) {
        entry.getKey().setObject(object);
        matches++;
      }
    }

    if (matches == 0) {
      logger.warn("No reference parameter named '{}' in expression; binding ignored", name);
    }
    invalidate();
  }

  /** Collects the reference and constant parameters of this tree, reusing the cached set. */
  public final ParameterSet parameters() {
    if (!isCacheValid()) {
      parameters = Optional.of(ParameterCollector.collect(this));
      expression = Optional.empty();
      cachedAt = mutations.get();
    }
    return parameters.get();
  }

  /** Compiles this tree to the animation runtime's expression text. */
  public final String toExpressionString() {
    ParameterSet collected = parameters();
    if (!expression.isPresent()) {
      expression = Optional.of(ExpressionStringCompiler.compile(this, collected));
    }
    return expression.get();
  }

  /** Pushes every collected parameter of this tree onto {@code target}. */
  public final void setAllParameters(ExpressionAnimation target) {
    ParameterBinder.bindAll(parameters(), target);
  }

  // The animation this node owns, created on first use.
  final ExpressionAnimation ensureAnimation(Compositor compositor) {
    if (!animation.isPresent()) {
      logger.debug("Creating expression animation for {}", this);
      animation = Optional.of(compositor.createExpressionAnimation());
    }
    return animation.get();
  }

  final Optional<ExpressionAnimation> animation() {
    return animation;
  }

  final void invalidate() {
    parameters = Optional.empty();
    expression = Optional.empty();
    mutations.incrementAndGet();
  }

  private boolean isCacheValid() {
    return parameters.isPresent() && cachedAt == mutations.get();
  }

  /**
   * Drops this node's cached parameters and expression text and closes the animation it owns.
   * Children are left alone; they may belong to other live trees.
   */
  @Override
  public void close() {
    parameters = Optional.empty();
    expression = Optional.empty();
    cachedAt = -1;

    if (animation.isPresent()) {
      logger.debug("Releasing expression animation for {}", this);
      animation.get().close();
      animation = Optional.empty();
    }
  }

  static String checkName(String name) {
    Preconditions.checkNotNull(name);
    if (name.isEmpty()) throw ExpressionException.invalidArgument("parameter name is empty");
    return name;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", nodeType())
        .add("name", parameterName.orElse(null))
        .add("children", children().size())
        .toString();
  }
}
