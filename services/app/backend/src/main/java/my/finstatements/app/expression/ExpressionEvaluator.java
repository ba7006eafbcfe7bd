package my.finstatements.app.expression;

import my.finstatements.app.errors.ResolutionException;
import my.finstatements.app.errors.StatementException;
import my.finstatements.app.util.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates report arithmetic for one output column at a time.
 * <p>
 * A null operand or a division by zero makes the result null (rendered as N/A).
 * Parsed trees are cached per evaluator instance.
 */
public class ExpressionEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

	private final ExpressionParser parser = new ExpressionParser();
	private final Map<String, ExpressionNode> cache = new ConcurrentHashMap<>();

	public Double evaluate(String expression, Map<String, Double> variables, Map<Integer, Double> rows) {
		return evaluate(parse(expression), variables, rows, expression);
	}

	public ExpressionNode parse(String expression) {
		ExpressionNode cached = cache.get(expression);
		if (cached != null) {
			return cached;
		}
		ExpressionNode node = parser.parse(expression);
		cache.put(expression, node);
		return node;
	}

	public ValidationResult validate(String expression) {
		try {
			parse(expression);
			return ValidationResult.of(List.of());
		} catch (StatementException ex) {
			return ValidationResult.of(List.of(ex.getMessage()));
		}
	}

	public ExpressionDependencies getDependencies(String expression) {
		Set<String> variables = new LinkedHashSet<>();
		Set<Integer> orders = new LinkedHashSet<>();
		collect(parse(expression), variables, orders);
		return new ExpressionDependencies(new ArrayList<>(variables), new ArrayList<>(orders));
	}

	public void clearCache() {
		cache.clear();
	}

	public int cacheSize() {
		return cache.size();
	}

	private Double evaluate(ExpressionNode node, Map<String, Double> variables, Map<Integer, Double> rows,
							String source) {
		if (node instanceof ExpressionNode.NumberLiteral literal) {
			return literal.value();
		}
		if (node instanceof ExpressionNode.VariableRef ref) {
			if (variables == null || !variables.containsKey(ref.name())) {
				throw new ResolutionException("Undefined variable: " + ref.name(), ref.name());
			}
			return variables.get(ref.name());
		}
		if (node instanceof ExpressionNode.OrderRef ref) {
			if (rows == null || !rows.containsKey(ref.order())) {
				throw new ResolutionException("Undefined order reference: @" + ref.order(), "@" + ref.order());
			}
			return rows.get(ref.order());
		}
		if (node instanceof ExpressionNode.Negate negate) {
			Double value = evaluate(negate.operand(), variables, rows, source);
			return value == null ? null : -value;
		}
		ExpressionNode.Binary binary = (ExpressionNode.Binary) node;
		Double left = evaluate(binary.left(), variables, rows, source);
		Double right = evaluate(binary.right(), variables, rows, source);
		if (left == null || right == null) {
			return null;
		}
		return switch (binary.operator()) {
			case '+' -> left + right;
			case '-' -> left - right;
			case '*' -> left * right;
			case '/' -> divide(left, right, source);
			default -> throw new IllegalStateException("Unknown operator " + binary.operator());
		};
	}

	private Double divide(double left, double right, String source) {
		if (right == 0.0) {
			logger.warn("Division by zero in expression '{}', result is N/A", source);
			return null;
		}
		return left / right;
	}

	private void collect(ExpressionNode node, Set<String> variables, Set<Integer> orders) {
		if (node instanceof ExpressionNode.VariableRef ref) {
			variables.add(ref.name());
		} else if (node instanceof ExpressionNode.OrderRef ref) {
			orders.add(ref.order());
		} else if (node instanceof ExpressionNode.Negate negate) {
			collect(negate.operand(), variables, orders);
		} else if (node instanceof ExpressionNode.Binary binary) {
			collect(binary.left(), variables, orders);
			collect(binary.right(), variables, orders);
		}
	}
}
