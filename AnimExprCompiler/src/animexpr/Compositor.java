package animexpr;

public interface Compositor {
  ExpressionAnimation createExpressionAnimation();
}
