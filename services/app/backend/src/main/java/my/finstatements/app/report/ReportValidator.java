package my.finstatements.app.report;

import my.finstatements.app.domain.StatementType;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.errors.StatementException;
import my.finstatements.app.expression.ExpressionDependencies;
import my.finstatements.app.expression.ExpressionEvaluator;
import my.finstatements.app.filter.FilterEngine;
import my.finstatements.app.variables.AggregateFunction;
import my.finstatements.app.variables.VariableDefinition;
import my.finstatements.app.variables.VariableResolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ReportValidator {
	private final FilterEngine filterEngine;
	private final VariableResolver variableResolver;
	private final ExpressionEvaluator expressionEvaluator;

	public ReportValidator() {
		this(new FilterEngine(), new ExpressionEvaluator());
	}

	public ReportValidator(FilterEngine filterEngine, ExpressionEvaluator expressionEvaluator) {
		this.filterEngine = filterEngine;
		this.variableResolver = new VariableResolver(filterEngine);
		this.expressionEvaluator = expressionEvaluator;
	}

	public List<String> validate(ReportDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Report definition is empty");
			return errors;
		}
		if (isBlank(definition.getReportId())) {
			errors.add("reportId is required");
		}
		if (isBlank(definition.getName())) {
			errors.add("name is required");
		}
		if (isBlank(definition.getVersion())) {
			errors.add("version is required");
		}
		if (isBlank(definition.getStatementType())) {
			errors.add("statementType is required");
		} else if (StatementType.from(definition.getStatementType()) == null) {
			errors.add("statementType must be one of balance, income, cashflow");
		}

		Map<String, VariableDefinition> variables = definition.getVariables() == null ? Map.of() : definition.getVariables();
		for (Map.Entry<String, VariableDefinition> entry : variables.entrySet()) {
			for (String error : variableResolver.validateVariable(entry.getValue())) {
				errors.add("variables." + entry.getKey() + ": " + error);
			}
		}

		List<LayoutItem> layout = definition.getLayout();
		if (layout == null || layout.isEmpty()) {
			errors.add("layout must be a non-empty array");
			return errors;
		}
		Set<Integer> orders = new HashSet<>();
		for (int i = 0; i < layout.size(); i++) {
			LayoutItem item = layout.get(i);
			if (item == null) {
				errors.add("layout[" + i + "] is empty");
			} else if (item.getOrder() == null) {
				errors.add("layout item '" + item.getLabel() + "' is missing order");
			} else if (!orders.add(item.getOrder())) {
				errors.add("layout order " + item.getOrder() + " is used more than once");
			}
		}
		for (LayoutItem item : layout) {
			if (item != null) {
				validateItem(item, variables, orders, errors);
			}
		}
		return errors;
	}

	private void validateItem(LayoutItem item, Map<String, VariableDefinition> variables, Set<Integer> orders,
							  List<String> errors) {
		String where = "layout[" + item.getOrder() + "]";
		LayoutType type = LayoutType.from(item.getType());
		if (type == null) {
			errors.add(where + ".type must be one of variable, calculated, category, subtotal, spacer");
			return;
		}
		if (item.getStyle() != null && RowStyle.from(item.getStyle()) == null) {
			errors.add(where + ".style must be one of normal, metric, subtotal, total, spacer");
		}
		if (item.getFormat() != null && FormatType.from(item.getFormat()) == null) {
			errors.add(where + ".format must be one of currency, percent, integer, decimal");
		}
		if (item.getIndent() != null && item.getIndent() < 0) {
			errors.add(where + ".indent must not be negative");
		}
		if (type != LayoutType.SPACER && isBlank(item.getLabel())) {
			errors.add(where + ".label is required");
		}
		switch (type) {
			case VARIABLE -> {
				if (isBlank(item.getVariable())) {
					errors.add(where + ".variable is required");
				} else if (!variables.containsKey(item.getVariable())) {
					errors.add(where + " references undefined variable '" + item.getVariable() + "'");
				}
			}
			case CALCULATED -> validateExpression(item, where, variables, orders, errors);
			case CATEGORY -> {
				if (item.getFilter() == null) {
					errors.add(where + ".filter is required");
				} else {
					filterEngine.validateFilter(item.getFilter()).forEach(e -> errors.add(where + ".filter: " + e));
				}
				if (item.getAggregate() != null && AggregateFunction.from(item.getAggregate()) == null) {
					errors.add(where + ".aggregate must be one of " + AggregateFunction.validFunctionList());
				}
			}
			case SUBTOTAL -> {
				if ((item.getFrom() == null) != (item.getTo() == null)) {
					errors.add(where + " must define both from and to, or neither");
				} else if (item.getFrom() != null && item.getFrom() > item.getTo()) {
					errors.add(where + ".from must not be greater than to");
				}
			}
			case SPACER -> {
			}
		}
	}

	private void validateExpression(LayoutItem item, String where, Map<String, VariableDefinition> variables,
									Set<Integer> orders, List<String> errors) {
		if (isBlank(item.getExpression())) {
			errors.add(where + ".expression is required");
			return;
		}
		ExpressionDependencies dependencies;
		try {
			dependencies = expressionEvaluator.getDependencies(item.getExpression());
		} catch (StatementException ex) {
			errors.add(where + ".expression is invalid: " + ex.getMessage());
			return;
		}
		for (String variable : dependencies.variables()) {
			if (!variables.containsKey(variable)) {
				errors.add(where + ".expression references undefined variable '" + variable + "'");
			}
		}
		for (Integer reference : dependencies.orderReferences()) {
			if (!orders.contains(reference)) {
				errors.add(where + ".expression references unknown row @" + reference);
			} else if (item.getOrder() != null && reference >= item.getOrder()) {
				errors.add(where + ".expression references @" + reference + " which is not an earlier row");
			}
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
