package animexpr;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import com.google.common.collect.ImmutableList;

import animexpr.ExpressionValues.Constant;
import animexpr.ExpressionValues.CurrentValue;
import animexpr.ExpressionValues.StartingValue;
import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector4;

public class ExpressionStringCompilerTest {

  private static ScalarNode named(String name, float value) {
    ScalarNode node = ScalarNode.of(value);
    node.setParameterName(name);
    return node;
  }

  private static void assertFails(ExpressionException.Kind kind, Executable executable) {
    ExpressionException e = assertThrows(ExpressionException.class, executable);
    assertThat(e.kind()).isEqualTo(kind);
  }

  @Test
  public void addition() {
    assertThat(named("A", 1).add(named("B", 2)).toExpressionString()).isEqualTo("(A + B)");
  }

  @Test
  public void operatorArity() {
    ScalarNode one = NodeFactory.create(ScalarNode.class, NodeType.ADD, named("A", 1));
    ScalarNode three =
        NodeFactory.create(
            ScalarNode.class, NodeType.ADD, named("A", 1), named("B", 2), named("C", 3));

    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, one::toExpressionString);
    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, three::toExpressionString);
  }

  @Test
  public void literalOrParameterName() {
    ScalarNode node = ScalarNode.of(2);
    assertThat(node.toExpressionString()).isEqualTo("2");

    node.setParameterName("x");
    assertThat(node.toExpressionString()).isEqualTo("x");

    node.setParameterName("y");
    assertThat(node.toExpressionString()).isEqualTo("y");

    node.clearParameterName();
    assertThat(node.toExpressionString()).isEqualTo("2");
  }

  @Test
  public void scalarLiterals() {
    assertThat(ScalarNode.of(0.5f).toExpressionString()).isEqualTo("0.5");
    assertThat(ScalarNode.of(-3.25f).toExpressionString()).isEqualTo("-3.25");
    assertThat(ScalarNode.of(100).toExpressionString()).isEqualTo("100");
    assertThat(ScalarNode.of(1e-7f).toExpressionString()).isEqualTo("0.0000001");
    assertThat(ScalarNode.of(-0f).toExpressionString()).isEqualTo("0");
  }

  @Test
  public void nonFiniteLiteral() {
    assertFails(
        ExpressionException.Kind.INVALID_ARGUMENT,
        () -> ScalarNode.of(Float.NaN).toExpressionString());
    assertFails(
        ExpressionException.Kind.INVALID_ARGUMENT,
        () -> ScalarNode.of(Float.POSITIVE_INFINITY).toExpressionString());
  }

  @Test
  public void compositeLiterals() {
    assertThat(BooleanNode.of(true).toExpressionString()).isEqualTo("true");
    assertThat(Vector2Node.of(1, 2).toExpressionString()).isEqualTo("Vector2(1,2)");
    assertThat(Vector3Node.of(1, 2.5f, 0).toExpressionString()).isEqualTo("Vector3(1,2.5,0)");
    assertThat(Vector4Node.of(Vector4.of(1, 2, 3, 4)).toExpressionString())
        .isEqualTo("Vector4(1,2,3,4)");
    assertThat(ColorNode.of(Color.argb(255, 10, 20, 30)).toExpressionString())
        .isEqualTo("ColorArgb(255,10,20,30)");
    assertThat(QuaternionNode.of(Quaternion.identity()).toExpressionString())
        .isEqualTo("Quaternion(0,0,0,1)");
    assertThat(Matrix3x2Node.of(Matrix3x2.identity()).toExpressionString())
        .isEqualTo("Matrix3x2(1,0,0,1,0,0)");
    assertThat(Matrix4x4Node.of(Matrix4x4.identity()).toExpressionString())
        .isEqualTo("Matrix4x4(1,0,0,0,0,1,0,0,0,0,1,0,0,0,0,1)");
  }

  @Test
  public void unaryOperators() {
    assertThat(named("a", 1).negate().toExpressionString()).isEqualTo("( - a )");
    assertThat(BooleanNode.of(false).not().toExpressionString()).isEqualTo("( ! false )");
  }

  @Test
  public void nestedOperators() {
    ScalarNode a = named("a", 1);
    ScalarNode b = named("b", 2);

    assertThat(a.add(b).multiply(a.subtract(b)).toExpressionString())
        .isEqualTo("((a + b) * (a - b))");
    assertThat(a.lessThan(b).and(b.isNotEqualTo(a)).toExpressionString())
        .isEqualTo("((a < b) && (b != a))");
  }

  @Test
  public void functions() {
    ScalarNode a = named("a", 1);
    ScalarNode b = named("b", 2);

    assertThat(ExpressionFunctions.max(a, b).toExpressionString()).isEqualTo("Max(a,b)");
    assertThat(ExpressionFunctions.sin(a).toExpressionString()).isEqualTo("Sin(a)");
    assertThat(ExpressionFunctions.vector2(a, b).toExpressionString()).isEqualTo("Vector2(a,b)");
    assertThat(
            ExpressionFunctions.quaternionFromAxisAngle(Vector3Node.of(0, 0, 1), a)
                .toExpressionString())
        .isEqualTo("Quaternion.CreateFromAxisAngle(Vector3(0,0,1),a)");
    assertThat(
            ExpressionFunctions.colorLerpHsl(
                    ColorNode.of(Color.rgb(0, 0, 0)), ColorNode.of(Color.rgb(255, 255, 255)), a)
                .toExpressionString())
        .isEqualTo("ColorLerpHSL(ColorArgb(255,0,0,0),ColorArgb(255,255,255,255),a)");
  }

  @Test
  public void functionWithoutArguments() {
    ScalarNode node = NodeFactory.create(ScalarNode.class, NodeType.SIN);

    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, node::toExpressionString);
  }

  @Test
  public void conditional() {
    ScalarNode node =
        ExpressionFunctions.conditional(BooleanNode.of(true), ScalarNode.of(1), ScalarNode.of(2));

    assertThat(node.toExpressionString()).isEqualTo("((true) ? (1) : (2))");
  }

  @Test
  public void conditionalArity() {
    ScalarNode node =
        NodeFactory.create(ScalarNode.class, NodeType.CONDITIONAL, BooleanNode.of(true));

    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, node::toExpressionString);
  }

  @Test
  public void swizzle() {
    Vector3Node v = Constant.createConstantVector3("v");

    assertThat(v.xy().toExpressionString()).isEqualTo("v.XY");
    assertThat(v.z().toExpressionString()).isEqualTo("v.Z");
    assertThat(v.subchannels("Z", "Y", "X").toExpressionString()).isEqualTo("v.ZYX");
  }

  @Test
  public void swizzleArity() {
    ValueNode none = NodeFactory.createSwizzle(ImmutableList.of(), "X", "Y");
    ValueNode two =
        NodeFactory.createSwizzle(
            ImmutableList.of(Vector2Node.of(1, 2), Vector2Node.of(3, 4)), "X", "Y");

    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, none::toExpressionString);
    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, two::toExpressionString);
  }

  @Test
  public void swizzleChannelCount() {
    Vector4Node v = Constant.createConstantVector4("v");

    assertFails(
        ExpressionException.Kind.INVALID_ARGUMENT, () -> v.subchannels("X", "Y", "Z", "W", "X"));
  }

  @Test
  public void matrixElements() {
    Matrix4x4Node m = Constant.createConstantMatrix4x4("m");

    assertThat(m.element(4, 1).toExpressionString()).isEqualTo("m._41");
    assertThat(m.translation().toExpressionString()).isEqualTo("m._41_42_43");
    assertFails(ExpressionException.Kind.INVALID_ARGUMENT, () -> m.element(0, 1));
  }

  @Test
  public void targetAndKeywords() {
    ScalarNode opacity = ExpressionValues.Target.create().getScalarProperty("Opacity");
    ScalarNode node = CurrentValue.createScalar().add(StartingValue.createScalar());

    assertThat(opacity.toExpressionString()).isEqualTo("this.target.Opacity");
    assertThat(node.toExpressionString()).isEqualTo("(this.CurrentValue + this.StartingValue)");
  }

  @Test
  public void constantParameterWithoutName() {
    ScalarNode node = Constant.createConstantScalar("speed");
    node.clearParameterName();

    assertFails(ExpressionException.Kind.STRUCTURAL_ERROR, node::toExpressionString);
  }

  @Test
  public void repeatedCompileIsStable() {
    FakeAnimatableObject visual = new FakeAnimatableObject("visual");
    ScalarNode node =
        ExpressionValues.Reference.create(visual)
            .getScalarProperty("Offset")
            .multiply(Constant.createConstantScalar("k", 2));

    String first = node.toExpressionString();

    assertThat(first).isEqualTo("(A.Offset * k)");
    assertThat(node.toExpressionString()).isEqualTo(first);
    assertThat(visual.running).isEmpty();
  }
}
