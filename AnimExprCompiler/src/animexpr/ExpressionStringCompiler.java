package animexpr;

import com.google.common.collect.ImmutableList;

/**
 * Renders an expression tree to the animation runtime's expression grammar.
 *
 * <p>Every node is checked against the arity and fields its kind requires before it is
 * written; a violation fails with {@link ExpressionException.Kind#STRUCTURAL_ERROR}.
 */
final class ExpressionStringCompiler {
  private final ParameterSet parameters;
  private final StringBuilder out = new StringBuilder();

  private ExpressionStringCompiler(ParameterSet parameters) {
    this.parameters = parameters;
  }

  static String compile(ExpressionNode root, ParameterSet parameters) {
    ExpressionStringCompiler compiler = new ExpressionStringCompiler(parameters);
    compiler.write(root);
    return compiler.out.toString();
  }

  private void write(ExpressionNode node) {
    ImmutableList<ExpressionNode> children = node.children();
    switch (node.nodeType().operationType()) {
      case FUNCTION:
        checkArity(node, children.size() >= 1, "at least one child");
        out.append(node.nodeType().operation().get()).append('(');
        for (int i = 0; i < children.size(); i++) {
          if (i > 0) out.append(',');
          write(children.get(i));
        }
        out.append(')');
        break;
      case OPERATOR:
        checkArity(node, children.size() == 2, "exactly two children");
        out.append('(');
        write(children.get(0));
        out.append(' ').append(node.nodeType().operation().get()).append(' ');
        write(children.get(1));
        out.append(')');
        break;
      case UNARY_OPERATOR:
        checkArity(node, children.size() == 1, "exactly one child");
        out.append("( ").append(node.nodeType().operation().get()).append(' ');
        write(children.get(0));
        out.append(" )");
        break;
      case CONDITIONAL:
        checkArity(node, children.size() == 3, "exactly three children");
        out.append("((");
        write(children.get(0));
        out.append(") ? (");
        write(children.get(1));
        out.append(") : (");
        write(children.get(2));
        out.append("))");
        break;
      case SWIZZLE:
        checkArity(node, children.size() == 1, "exactly one child");
        if (node.subchannels().isEmpty())
          throw ExpressionException.structuralError("swizzle requires at least one channel");
        write(children.get(0));
        out.append('.');
        node.subchannels().forEach(out::append);
        break;
      case CONSTANT:
        checkArity(node, children.isEmpty(), "no children");
        writeConstant(node);
        break;
      case REFERENCE:
        writeReference(node);
        break;
      default:
        throw new AssertionError(node.nodeType());
    }
  }

  private void writeConstant(ExpressionNode node) {
    if (node.parameterName().isPresent()) {
      out.append(node.parameterName().get());
      return;
    }

    if (node.nodeType() == NodeType.CONSTANT_PARAMETER)
      throw ExpressionException.structuralError("constant parameter requires a parameter name");
    ConstantValue literal =
        ((ValueNode) node)
            .literal()
            .orElseThrow(() -> ExpressionException.structuralError("constant requires a literal"));
    Literals.appendTo(literal, out);
  }

  private void writeReference(ExpressionNode node) {
    ImmutableList<ExpressionNode> children = node.children();
    switch (node.nodeType()) {
      case REFERENCE:
        checkArity(node, children.isEmpty(), "no children");
        String name =
            parameters
                .nameOf((ReferenceNode) node)
                .orElseThrow(
                    () ->
                        ExpressionException.structuralError(
                            "reference was not collected from this tree"));
        out.append(name);
        break;
      case TARGET_REFERENCE:
        checkArity(node, children.isEmpty(), "no children");
        out.append(ReferenceNode.TARGET);
        break;
      case CURRENT_VALUE_PROPERTY:
        checkArity(node, children.isEmpty(), "no children");
        out.append("this.CurrentValue");
        break;
      case STARTING_VALUE_PROPERTY:
        checkArity(node, children.isEmpty(), "no children");
        out.append("this.StartingValue");
        break;
      case REFERENCE_PROPERTY:
        checkArity(node, children.size() == 1, "exactly one child");
        if (!node.propertyName().isPresent())
          throw ExpressionException.structuralError("reference property requires a property name");
        write(children.get(0));
        out.append('.').append(node.propertyName().get());
        break;
      default:
        throw new AssertionError(node.nodeType());
    }
  }

  private static void checkArity(ExpressionNode node, boolean valid, String expected) {
    if (!valid)
      throw ExpressionException.structuralError(
          "%s requires %s, got %d", node.nodeType(), expected, node.children().size());
  }
}
