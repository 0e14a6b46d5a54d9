package animexpr;

/** An object in the animation runtime whose properties can be driven by an expression. */
public interface AnimatableObject {
  Compositor compositor();

  void startAnimation(String propertyName, ExpressionAnimation animation);

  void stopAnimation(String propertyName);
}
