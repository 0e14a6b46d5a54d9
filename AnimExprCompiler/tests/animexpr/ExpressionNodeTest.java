package animexpr;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import animexpr.ExpressionValues.Constant;
import animexpr.ExpressionValues.Reference;

public class ExpressionNodeTest {

  private final FakeAnimatableObject visual = new FakeAnimatableObject("visual");
  private final FakeAnimatableObject other = new FakeAnimatableObject("other");

  @Test
  public void sharedChildMutationSeenByBothTrees() {
    ScalarNode shared = ScalarNode.of(1);
    ScalarNode first = shared.add(ScalarNode.of(2));
    ScalarNode second = shared.multiply(ScalarNode.of(3));
    assertThat(first.toExpressionString()).isEqualTo("(1 + 2)");
    assertThat(second.toExpressionString()).isEqualTo("(1 * 3)");

    shared.setParameterName("s");

    assertThat(first.toExpressionString()).isEqualTo("(s + 2)");
    assertThat(second.toExpressionString()).isEqualTo("(s * 3)");
  }

  @Test
  public void closingOneTreeLeavesSharedChildUsable() {
    ScalarNode shared = Reference.create(visual).getScalarProperty("Offset");
    ScalarNode first = shared.add(ScalarNode.of(2));
    ScalarNode second = shared.multiply(ScalarNode.of(3));
    first.toExpressionString();
    second.toExpressionString();

    first.close();

    assertThat(second.toExpressionString()).isEqualTo("(A.Offset * 3)");
    assertThat(shared.toExpressionString()).isEqualTo("A.Offset");
    assertThat(first.toExpressionString()).isEqualTo("(A.Offset + 2)");
  }

  @Test
  public void closeReleasesOwnedAnimationOnly() {
    ScalarNode child = Reference.create(visual).getScalarProperty("Offset");
    ScalarNode root = child.add(ScalarNode.of(1));
    ExpressionAnimations.startAnimation(visual, "Opacity", child);
    ExpressionAnimations.startAnimation(visual, "Scale", root);
    RecordingExpressionAnimation childAnimation = visual.compositor().created.get(0);
    RecordingExpressionAnimation rootAnimation = visual.compositor().created.get(1);

    root.close();
    root.close();

    assertThat(rootAnimation.closed).isTrue();
    assertThat(childAnimation.closed).isFalse();
    assertThat(root.animation()).isEmpty();
  }

  @Test
  public void rebindGeneratedName() {
    ReferenceNode first = Reference.create(visual);
    ReferenceNode second = Reference.create(visual);
    ScalarNode expression = first.getScalarProperty("X").add(second.getScalarProperty("Y"));
    expression.toExpressionString();

    expression.setReferenceParameter("a", other);

    assertThat(first.object()).hasValue(other);
    assertThat(second.object()).hasValue(other);
    assertThat(expression.parameters().references().get(0).object()).hasValue(other);
  }

  @Test
  public void rebindNamedReference() {
    ReferenceNode source = Reference.create("Source");
    ScalarNode expression = source.getScalarProperty("Offset");

    expression.setReferenceParameter("source", visual);

    assertThat(source.object()).hasValue(visual);
    assertThat(expression.toExpressionString()).isEqualTo("Source.Offset");
  }

  @Test
  public void rebindUnknownNameIsIgnored() {
    ReferenceNode source = Reference.create("source", visual);

    source.setReferenceParameter("missing", other);

    assertThat(source.object()).hasValue(visual);
  }

  @Test
  public void constantsAreCaseInsensitiveLastWriteWins() {
    ScalarNode node = Constant.createConstantScalar("speed");
    node.setScalarParameter("Speed", 1);
    node.setScalarParameter("SPEED", 2);

    assertThat(node.localConstants()).containsExactly("SPEED", ConstantValue.ofScalar(2));
  }

  @Test
  public void invalidNames() {
    ScalarNode node = ScalarNode.of(1);

    ExpressionException e =
        assertThrows(ExpressionException.class, () -> node.setParameterName(""));
    assertThat(e.kind()).isEqualTo(ExpressionException.Kind.INVALID_ARGUMENT);
    assertThrows(NullPointerException.class, () -> node.setScalarParameter(null, 1));
  }

  @Test
  public void targetCannotBeRenamed() {
    ReferenceNode target = ExpressionValues.Target.create();

    ExpressionException e =
        assertThrows(ExpressionException.class, () -> target.setParameterName("t"));
    assertThat(e.kind()).isEqualTo(ExpressionException.Kind.INVALID_ARGUMENT);
  }

  @Test
  public void parametersAreCachedUntilMutation() {
    ScalarNode node = Constant.createConstantScalar("k", 1).add(ScalarNode.of(2));
    ParameterSet first = node.parameters();

    assertThat(node.parameters()).isSameInstanceAs(first);

    node.setScalarParameter("j", 3);

    assertThat(node.parameters()).isNotSameInstanceAs(first);
    assertThat(node.parameters().constants()).containsKey("j");
  }
}
