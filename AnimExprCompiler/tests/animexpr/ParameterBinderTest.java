package animexpr;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import animexpr.ExpressionValues.Constant;
import animexpr.ExpressionValues.Reference;
import animexpr.Numerics.Color;
import animexpr.Numerics.Matrix3x2;
import animexpr.Numerics.Matrix4x4;
import animexpr.Numerics.Quaternion;
import animexpr.Numerics.Vector2;
import animexpr.Numerics.Vector3;
import animexpr.Numerics.Vector4;

public class ParameterBinderTest {

  private final FakeAnimatableObject visual = new FakeAnimatableObject("visual");
  private final RecordingExpressionAnimation animation = new RecordingExpressionAnimation();

  @Test
  public void everyConstantUsesItsTypedSetter() {
    ScalarNode root = Reference.create(visual).getScalarProperty("Offset");
    root.setBooleanParameter("b", true);
    root.setScalarParameter("s", 1.5f);
    root.setVector2Parameter("v2", Vector2.of(1, 2));
    root.setVector3Parameter("v3", Vector3.of(1, 2, 3));
    root.setVector4Parameter("v4", Vector4.of(1, 2, 3, 4));
    root.setColorParameter("c", Color.rgb(1, 2, 3));
    root.setQuaternionParameter("q", Quaternion.identity());
    root.setMatrix3x2Parameter("m3", Matrix3x2.identity());
    root.setMatrix4x4Parameter("m4", Matrix4x4.identity());

    root.setAllParameters(animation);

    assertThat(animation.setterCalls)
        .containsExactly(
            "boolean b",
            "scalar s",
            "vector2 v2",
            "vector3 v3",
            "vector4 v4",
            "color c",
            "quaternion q",
            "matrix3x2 m3",
            "matrix4x4 m4")
        .inOrder();
    assertThat(animation.constants).containsEntry("s", 1.5f);
    assertThat(animation.constants).containsEntry("c", Color.argb(255, 1, 2, 3));
    assertThat(animation.constants).containsEntry("m4", Matrix4x4.identity());
    assertThat(animation.references).containsExactly("A", visual);
  }

  @Test
  public void constantsFromChildren() {
    ScalarNode node = Constant.createConstantScalar("k", 4).add(ScalarNode.of(1));

    node.setAllParameters(animation);

    assertThat(animation.constants).containsExactly("k", 4f);
  }

  @Test
  public void unboundNamedReference() {
    ScalarNode node = Reference.create("source").getScalarProperty("Offset");

    ExpressionException e =
        assertThrows(ExpressionException.class, () -> node.setAllParameters(animation));
    assertThat(e.kind()).isEqualTo(ExpressionException.Kind.AMBIGUOUS_REFERENCE);
  }

  @Test
  public void namedReferenceBoundLater() {
    ScalarNode node = Reference.create("source").getScalarProperty("Offset");
    node.setReferenceParameter("SOURCE", visual);

    node.setAllParameters(animation);

    assertThat(animation.references).containsExactly("source", visual);
  }
}
