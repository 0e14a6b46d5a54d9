package animexpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

// Walks a tree once, pre-order, to find its reference and constant parameters.
final class ParameterCollector {
  private static final Logger logger = LoggerFactory.getLogger(ParameterCollector.class);

  private final Set<ExpressionNode> visited = Sets.newIdentityHashSet();
  private final List<ReferenceNode> referenceNodes = new ArrayList<>();
  // Keyed by lower-cased name.
  private final Map<String, Map.Entry<String, ConstantValue>> constants = new LinkedHashMap<>();

  private ParameterCollector() {}

  static ParameterSet collect(ExpressionNode root) {
    ParameterCollector collector = new ParameterCollector();
    collector.walk(root);
    return collector.build();
  }

  private void walk(ExpressionNode root) {
    Deque<ExpressionNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      ExpressionNode node = stack.pop();
      if (!visited.add(node)) continue;

      visit(node);

      ImmutableList<ExpressionNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  private void visit(ExpressionNode node) {
    if (node.nodeType() == NodeType.REFERENCE) {
      referenceNodes.add((ReferenceNode) node);
    }

    if (node.nodeType() == NodeType.CONSTANT_VALUE && node.parameterName().isPresent()) {
      ValueNode value = (ValueNode) node;
      value.literal().ifPresent(v -> addConstant(node.parameterName().get(), v));
    }
    node.localConstants().forEach(this::addConstant);
  }

  private void addConstant(String name, ConstantValue value) {
    constants.putIfAbsent(Ascii.toLowerCase(name), Maps.immutableEntry(name, value));
  }

  private ParameterSet build() {
    Set<String> reserved = Sets.newHashSet();
    for (ReferenceNode node : referenceNodes) {
      node.parameterName().ifPresent(reserved::add);
    }
    constants.values().forEach(e -> reserved.add(e.getKey()));
    ParameterNames.Generator generator = new ParameterNames.Generator(reserved);

    // An unnamed reference to an object that is named elsewhere in the tree takes that name.
    Map<AnimatableObject, String> namesByObject = new IdentityHashMap<>();
    for (ReferenceNode node : referenceNodes) {
      if (node.parameterName().isPresent() && node.object().isPresent()) {
        namesByObject.putIfAbsent(node.object().get(), node.parameterName().get());
      }
    }

    ImmutableMap.Builder<ReferenceNode, String> referenceNames = ImmutableMap.builder();
    // Keyed by lower-cased name.
    Map<String, ResolvedReference> resolved = new LinkedHashMap<>();

    for (ReferenceNode node : referenceNodes) {
      Optional<AnimatableObject> object = node.object();
      String name;
      if (node.parameterName().isPresent()) {
        name = node.parameterName().get();
      } else if (object.isPresent()) {
        name = namesByObject.computeIfAbsent(object.get(), o -> generator.next());
      } else {
        throw ExpressionException.ambiguousReference(
            "reference has neither an object nor a parameter name");
      }

      referenceNames.put(node, name);
      resolve(resolved, name, object);
    }

    ImmutableList.Builder<ParameterSet.ReferenceParameter> references = ImmutableList.builder();
    resolved.values()
        .forEach(r -> references.add(new ParameterSet.ReferenceParameter(r.name, r.object)));

    ImmutableMap.Builder<String, ConstantValue> constantValues = ImmutableMap.builder();
    constants.values().forEach(e -> constantValues.put(e.getKey(), e.getValue()));

    ParameterSet parameters =
        ParameterSet.create(references.build(), constantValues.build(), referenceNames.build());
    logger.debug(
        "Collected {} reference parameter(s) {} and {} constant(s) from {} node(s)",
        parameters.references().size(),
        parameters.references(),
        parameters.constants().size(),
        visited.size());
    return parameters;
  }

  private static void resolve(
      Map<String, ResolvedReference> resolved, String name, Optional<AnimatableObject> object) {
    String key = Ascii.toLowerCase(name);
    ResolvedReference existing = resolved.get(key);
    if (existing == null) {
      resolved.put(key, new ResolvedReference(name, object));
      return;
    }

    if (!object.isPresent()) return;
    if (!existing.object.isPresent()) {
      existing.object = object;
    } else if (existing.object.get() != object.get()) {
      throw ExpressionException.ambiguousReference(
          "parameter name '%s' refers to two different objects", name);
    }
  }

  private static final class ResolvedReference {
    private final String name;
    private Optional<AnimatableObject> object;

    private ResolvedReference(String name, Optional<AnimatableObject> object) {
      this.name = name;
      this.object = object;
    }
  }
}
