package my.finstatements.app.expression;

import java.util.List;

public record ExpressionDependencies(List<String> variables, List<Integer> orderReferences) {
	public ExpressionDependencies {
		variables = List.copyOf(variables);
		orderReferences = List.copyOf(orderReferences);
	}
}
