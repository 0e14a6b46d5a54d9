package animexpr;

import java.lang.ref.WeakReference;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** The reference and constant parameters collected from one expression tree. */
@AutoValue
public abstract class ParameterSet {

  /** A reference parameter: a name and the object it resolves to, if any. */
  public static final class ReferenceParameter {
    private final String name;
    private final WeakReference<AnimatableObject> object;

    ReferenceParameter(String name, Optional<AnimatableObject> object) {
      this.name = name;
      this.object = new WeakReference<>(object.orElse(null));
    }

    public String name() {
      return name;
    }

    public Optional<AnimatableObject> object() {
      return Optional.ofNullable(object.get());
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** One entry per distinct parameter name, in first-encountered order. */
  public abstract ImmutableList<ReferenceParameter> references();

  /** Named constants; the first declaration in pre-order wins. */
  public abstract ImmutableMap<String, ConstantValue> constants();

  // The parameter name of every reference node in the tree, explicit or generated.
  abstract ImmutableMap<ReferenceNode, String> referenceNames();

  static ParameterSet create(
      ImmutableList<ReferenceParameter> references,
      ImmutableMap<String, ConstantValue> constants,
      ImmutableMap<ReferenceNode, String> referenceNames) {
    return new AutoValue_ParameterSet(references, constants, referenceNames);
  }

  /** The name {@code node} compiles to, if it belongs to this tree. */
  public final Optional<String> nameOf(ReferenceNode node) {
    return Optional.ofNullable(referenceNames().get(node));
  }

  public final Optional<ConstantValue> constant(String name) {
    return Optional.ofNullable(constantsByLowerName().get(Ascii.toLowerCase(name)));
  }

  @Memoized
  ImmutableMap<String, ConstantValue> constantsByLowerName() {
    ImmutableMap.Builder<String, ConstantValue> builder = ImmutableMap.builder();
    constants().forEach((k, v) -> builder.put(Ascii.toLowerCase(k), v));
    return builder.build();
  }
}
