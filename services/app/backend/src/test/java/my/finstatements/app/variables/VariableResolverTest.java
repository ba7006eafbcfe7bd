package my.finstatements.app.variables;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.errors.ResolutionException;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.rollup.RollupSpecBuilder;
import my.finstatements.app.util.Result;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static my.finstatements.app.support.Movements.is;
import static org.assertj.core.api.Assertions.assertThat;

class VariableResolverTest {
	private final VariableResolver resolver = new VariableResolver();

	private final MovementTable table = MovementTable.of(List.of(
			is(2024, 2, "4000", "Rent", "40", "Huisvestingskosten", 2000),
			is(2024, 1, "4000", "Rent", "40", "Huisvestingskosten", 1000),
			is(2025, 1, "4000", "Rent", "40", "Huisvestingskosten", 1200),
			is(2025, 1, "8000", "Sales", "80", "Netto-omzet", -5000)
	));

	@Test
	void sumsPerYear() {
		Map<Integer, Double> values = resolve(Map.of("code1", "40"), "sum");
		assertThat(values).containsEntry(2024, 3000.0).containsEntry(2025, 1200.0);
	}

	@Test
	void averagesPerYear() {
		assertThat(resolve(Map.of("code1", "40"), "average")).containsEntry(2024, 1500.0);
		assertThat(resolve(Map.of("code1", "40"), "avg")).containsEntry(2024, 1500.0);
	}

	@Test
	void countMinAndMax() {
		assertThat(resolve(Map.of("code1", "40"), "count")).containsEntry(2024, 2.0);
		assertThat(resolve(Map.of("code1", "40"), "min")).containsEntry(2024, 1000.0);
		assertThat(resolve(Map.of("code1", "40"), "max")).containsEntry(2024, 2000.0);
	}

	@Test
	void firstAndLastFollowPeriodOrderNotRowOrder() {
		assertThat(resolve(Map.of("code1", "40"), "first")).containsEntry(2024, 1000.0);
		assertThat(resolve(Map.of("code1", "40"), "last")).containsEntry(2024, 2000.0);
	}

	@Test
	void yearsWithoutMatchesResolveToZero() {
		Map<Integer, Double> values = resolve(Map.of("code1", "999"), "sum");
		assertThat(values).containsExactly(Map.entry(2024, 0.0), Map.entry(2025, 0.0));
	}

	@Test
	void revenueOnlyExistsIn2025ButBothYearsAreReported() {
		assertThat(resolve(Map.of("code1", "80"), "sum"))
				.containsEntry(2024, 0.0)
				.containsEntry(2025, -5000.0);
	}

	@Test
	void curriedHelpersMatchExplicitAggregate() {
		Map<String, Object> filter = Map.of("code1", "40");
		assertThat(resolver.resolveSum(filter).apply(table).value()).containsEntry(2024, 3000.0);
		assertThat(resolver.resolveAverage(filter).apply(table).value()).containsEntry(2024, 1500.0);
		assertThat(resolver.resolveCount(filter).apply(table).value()).containsEntry(2025, 1.0);
	}

	@Test
	void validateVariableCollectsErrors() {
		VariableDefinition definition = new VariableDefinition(Map.of("colour", "red"), "median");
		List<String> errors = resolver.validateVariable(definition);

		assertThat(errors).anyMatch(e -> e.startsWith("Invalid aggregate function: median"));
		assertThat(errors).anyMatch(e -> e.startsWith("Invalid filter: Invalid filter field: colour"));
		assertThat(resolver.validateVariable(new VariableDefinition()))
				.contains("Missing required field: filter", "Missing required field: aggregate");
		assertThat(resolver.validateVariable("sum")).containsExactly("Variable definition must be an object");
	}

	@Test
	void invalidDefinitionIsReturnedAsError() {
		Result<Map<Integer, Double>> result =
				resolver.resolveVariable(new VariableDefinition(Map.of(), "median")).apply(table);
		assertThat(result.isOk()).isFalse();
		assertThat(result.error()).isInstanceOf(ValidationException.class);
	}

	@Test
	void resolveVariablesFailsAsWholeNamingTheVariable() {
		Map<String, VariableDefinition> definitions = new LinkedHashMap<>();
		definitions.put("rent", new VariableDefinition(Map.of("code1", "40"), "sum"));
		definitions.put("broken", new VariableDefinition(Map.of("code1", "40"), "median"));

		Result<Map<String, Map<Integer, Double>>> result = resolver.resolveVariables(definitions, table);

		assertThat(result.isOk()).isFalse();
		assertThat(result.error()).isInstanceOf(ResolutionException.class);
		assertThat(result.error().getMessage()).startsWith("Failed to resolve variable 'broken': ");
		assertThat(((ResolutionException) result.error()).getVariableName()).isEqualTo("broken");
	}

	@Test
	void resolveVariablesRejectsMissingInputs() {
		assertThat(resolver.resolveVariables(null, table).error().getMessage())
				.isEqualTo("Variables must be an object");
		assertThat(resolver.resolveVariables(Map.of(), null).error().getMessage())
				.isEqualTo("Movements data is required");
	}

	@Test
	void resolvesPerOutputColumn() {
		ColumnLayout layout = RollupSpecBuilder.normalLayout(2024, 2025);
		Map<String, VariableDefinition> definitions =
				Map.of("rent", new VariableDefinition(Map.of("code1", "40"), "sum"));

		Map<String, Map<String, Double>> values = resolver.resolveVariableColumns(definitions, table, layout).value();

		assertThat(values.get("rent")).containsExactly(Map.entry("amount_1", 3000.0), Map.entry("amount_2", 1200.0));
	}

	private Map<Integer, Double> resolve(Map<String, Object> filter, String aggregate) {
		Result<Map<Integer, Double>> result = resolver.resolveVariable(new VariableDefinition(filter, aggregate)).apply(table);
		assertThat(result.isOk()).isTrue();
		return result.value();
	}
}
