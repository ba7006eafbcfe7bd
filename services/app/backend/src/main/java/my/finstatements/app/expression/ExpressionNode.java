package my.finstatements.app.expression;

public sealed interface ExpressionNode permits ExpressionNode.NumberLiteral, ExpressionNode.VariableRef,
		ExpressionNode.OrderRef, ExpressionNode.Negate, ExpressionNode.Binary {

	record NumberLiteral(double value) implements ExpressionNode {
	}

	record VariableRef(String name) implements ExpressionNode {
	}

	/**
	 * {@code @<order>}: the value of an already emitted layout row.
	 */
	record OrderRef(int order) implements ExpressionNode {
	}

	record Negate(ExpressionNode operand) implements ExpressionNode {
	}

	record Binary(char operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
	}
}
