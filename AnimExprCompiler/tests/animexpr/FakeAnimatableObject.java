package animexpr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class FakeAnimatableObject implements AnimatableObject {
  private final String name;
  private final FakeCompositor compositor;

  final Map<String, ExpressionAnimation> running = new LinkedHashMap<>();
  final List<String> stopped = new ArrayList<>();

  FakeAnimatableObject(String name) {
    this(name, new FakeCompositor());
  }

  FakeAnimatableObject(String name, FakeCompositor compositor) {
    this.name = name;
    this.compositor = compositor;
  }

  @Override
  public FakeCompositor compositor() {
    return compositor;
  }

  @Override
  public void startAnimation(String propertyName, ExpressionAnimation animation) {
    running.put(propertyName, animation);
  }

  @Override
  public void stopAnimation(String propertyName) {
    running.remove(propertyName);
    stopped.add(propertyName);
  }

  @Override
  public String toString() {
    return name;
  }
}
