package io.github.manjago.evoformula.expr;

/**
 * Renders expressions as infix text.
 * <p>
 * A child of a binary node is wrapped in parentheses exactly when it is not a
 * leaf and its priority is not strictly greater than the parent's. Unary nodes
 * and tables render as function calls and are never wrapped. The output is
 * accepted by {@link ExpressionParser}.
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {}

    public static String print(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitVariable(Variable variable) {
        return variable.name();
    }

    @Override
    public String visitConst(Const constant) {
        return Double.toString(constant.value());
    }

    @Override
    public String visitNamedConstant(NamedConstant constant) {
        return constant.getSymbol();
    }

    @Override
    public String visitUnary(UnaryOp op) {
        return op.kind().getSymbol() + "(" + op.child().accept(this) + ")";
    }

    @Override
    public String visitBinary(BinaryOp op) {
        return operand(op.left(), op) + " " + op.kind().getSymbol() + " " + operand(op.right(), op);
    }

    @Override
    public String visitTable(Table table) {
        return table.getName() + "(" + table.getArgument().accept(this) + ")";
    }

    @Override
    public String visitBound(Bound bound) {
        return bound.inner().accept(this);
    }

    private String operand(Expression child, Expression parent) {
        String text = child.accept(this);
        if (needsParentheses(child, parent)) {
            return "(" + text + ")";
        }
        return text;
    }

    static boolean needsParentheses(Expression child, Expression parent) {
        return !child.isLeaf() && child.priority() <= parent.priority();
    }
}
