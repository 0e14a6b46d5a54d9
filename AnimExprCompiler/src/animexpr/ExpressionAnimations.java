package animexpr;

import com.google.common.base.Preconditions;

/** Starts and stops expression animations on animatable objects. */
public final class ExpressionAnimations {

  /**
   * Drives {@code propertyName} of {@code target} with {@code expression}. The animation is
   * owned by the expression's root node and reused on later calls; it is released when that
   * node is closed.
   */
  public static void startAnimation(
      AnimatableObject target, String propertyName, ExpressionNode expression) {
    Preconditions.checkNotNull(target);
    Preconditions.checkNotNull(expression);
    ExpressionNode.checkName(propertyName);

    ExpressionAnimation animation = expression.ensureAnimation(target.compositor());
    animation.setExpression(expression.toExpressionString());
    expression.setAllParameters(animation);
    target.startAnimation(propertyName, animation);
  }

  public static void stopAnimation(AnimatableObject target, String propertyName) {
    Preconditions.checkNotNull(target);
    ExpressionNode.checkName(propertyName);
    target.stopAnimation(propertyName);
  }

  private ExpressionAnimations() {}
}
