package my.finstatements.app.statement;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.config.AppProperties;
import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.StatementResult;
import my.finstatements.app.errors.DataException;
import my.finstatements.app.errors.ValidationException;
import my.finstatements.app.rollup.RollupSpecBuilder;
import my.finstatements.app.statement.specialrows.CashFlowSpecialRows;
import my.finstatements.app.support.BundledReports;
import my.finstatements.app.support.Movements;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static my.finstatements.app.support.Movements.is;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementGeneratorTest {
	private final StatementGenerator generator = new StatementGenerator(BundledReports.registry(),
			new CategoryClassifier(), new AppProperties(null, null, null));

	@Test
	void hierarchicalBalanceSheetBalancesWithResultForTheYear() {
		StatementResult result = generator.generateHierarchical(StatementType.BALANCE, Movements.balancedLedger(),
				GenerationOptions.compare("2025-all", null));

		assertThat(result.rows()).extracting(GridRow::label).containsExactly(
				"Activa (A)", "Liquide middelen (40)", "Bank (1000)",
				"Total Assets", "",
				"Passiva (P)", "Eigen vermogen (50)", "Share capital (0500)", "Result for the year",
				"", "Total Liabilities & Equity");
		assertThat(result.rows()).extracting(GridRow::order).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
		assertThat(label(result, "Total Assets").amount("amount_1")).isEqualTo(120000.0);
		assertThat(label(result, "Share capital (0500)").amount("amount_1")).isEqualTo(100000.0);
		assertThat(label(result, "Result for the year").amount("amount_1")).isEqualTo(20000.0);
		assertThat(label(result, "Result for the year").indent()).isEqualTo(2);
		assertThat(label(result, "Total Liabilities & Equity").amount("amount_1")).isEqualTo(120000.0);
		assertThat(result.balanced()).isTrue();
		assertThat(result.imbalance()).isEqualTo(0.0);
		assertThat(result.metadata()).containsEntry("mode", "hierarchical");
	}

	@Test
	void unbalancedLedgerIsFlagged() {
		List<MovementRecord> rows = new ArrayList<>(Movements.balancedLedger().rows());
		rows.add(Movements.bank(2025, 4, 250));
		StatementResult result = generator.generateHierarchical(StatementType.BALANCE, MovementTable.of(rows),
				GenerationOptions.compare("2025-all", null));

		assertThat(result.balanced()).isFalse();
		assertThat(result.imbalance()).isEqualTo(250.0);
	}

	@Test
	void balanceSheetColumnsAreYearToDate() {
		StatementResult result = generator.generateHierarchical(StatementType.BALANCE, Movements.balancedLedger(),
				new GenerationOptions("2025-P02", null, ViewType.PERIOD, 5));

		assertThat(label(result, "Total Assets").amount("amount_1")).isEqualTo(100000.0);
		assertThat(label(result, "Result for the year").amount("amount_1")).isEqualTo(0.0);
		assertThat(result.balanced()).isTrue();
	}

	@Test
	void hierarchicalIncomeStatementShowsCreditsPositive() {
		StatementResult result = generator.generateHierarchical(StatementType.INCOME, Movements.balancedLedger(),
				GenerationOptions.compare("2024-all", "2025-all"));

		assertThat(result.rows()).extracting(GridRow::label).containsExactly(
				"Winst en verlies (W)", "Kostprijs van de omzet (70)", "Purchases (7000)",
				"Netto-omzet (80)", "Sales (8000)", "", "Net Income");
		GridRow sales = label(result, "Sales (8000)");
		assertThat(sales.amount("amount_2")).isEqualTo(30000.0);
		assertThat(sales.varianceAmount()).isEqualTo(30000.0);
		assertThat(sales.formattedVariancePercent()).isEqualTo("N/A");
		assertThat(label(result, "Purchases (7000)").amount("amount_2")).isEqualTo(-10000.0);
		GridRow netIncome = label(result, "Net Income");
		assertThat(netIncome.style()).isEqualTo(RowStyle.TOTAL);
		assertThat(netIncome.amount("amount_2")).isEqualTo(20000.0);
		assertThat(netIncome.formatted()).containsEntry("amount_2", "€ 20,000");
		assertThat(result.metrics().get(StatementMetricsCalculator.GROSS_MARGIN, "amount_2")).isEqualTo(20000.0);
	}

	@Test
	void incomeStatementInjectsIntermediateResults() {
		MovementTable table = MovementTable.of(List.of(
				is(2025, 1, "8000", "Sales", "80", "Netto-omzet", -1000),
				is(2025, 1, "7000", "Purchases", "70", "Kostprijs van de omzet", 400),
				is(2025, 1, "4000", "Wages", "40", "Personeelskosten", 300),
				is(2025, 1, "9000", "Interest", "90", "Financiële baten en lasten", 50),
				is(2025, 1, "9500", "Corporate tax", "95", "Vennootschapsbelasting", 60)
		));

		StatementResult result = generator.generateHierarchical(StatementType.INCOME, table,
				GenerationOptions.compare("2025-all", null).withDetailLevel(1));

		assertThat(result.rows()).extracting(GridRow::label).containsExactly(
				"Winst en verlies (W)",
				"Personeelskosten (40)",
				"Kostprijs van de omzet (70)",
				"Netto-omzet (80)",
				"Gross Margin", "",
				"Operating Result", "",
				"Financiële baten en lasten (90)",
				"Result Before Tax", "",
				"Vennootschapsbelasting (95)",
				"", "Net Income");
		assertThat(label(result, "Gross Margin").amount("amount_1")).isEqualTo(600.0);
		assertThat(label(result, "Operating Result").amount("amount_1")).isEqualTo(300.0);
		assertThat(label(result, "Result Before Tax").amount("amount_1")).isEqualTo(250.0);
		assertThat(label(result, "Net Income").amount("amount_1")).isEqualTo(190.0);
	}

	@Test
	void cashFlowReconcilesToCashPosition() {
		StatementResult result = generator.generateHierarchical(StatementType.CASH_FLOW, Movements.balancedLedger(),
				GenerationOptions.compare("2025-all", null));

		assertThat(result.rows()).extracting(GridRow::label).containsExactly(
				"Net income", "Change in Eigen vermogen", "", "Starting Cash", "Net Change in Cash", "Ending Cash");
		assertThat(label(result, "Change in Eigen vermogen").amount("amount_1")).isEqualTo(100000.0);
		assertThat(label(result, "Ending Cash").amount("amount_1")).isEqualTo(120000.0);
		assertThat(result.metrics().get(CashFlowSpecialRows.ENDING_CASH, "amount_1"))
				.isEqualTo(result.metrics().get("cashPosition", "amount_1"));
	}

	@Test
	void ltmIncomeStatementHasMonthlyColumnsAndTotal() {
		StatementResult result = generator.generateHierarchical(StatementType.INCOME, monthlySales(2024, 7, 2025, 6),
				GenerationOptions.ltm("2025-ltm"));

		assertThat(result.columns()).hasSize(13);
		assertThat(result.ltmInfo()).isNotNull();
		assertThat(result.ltmInfo().label()).isEqualTo("LTM (2024 P7 - 2025 P6)");
		assertThat(result.warnings()).isEmpty();
		GridRow sales = label(result, "Sales (8000)");
		assertThat(sales.amount("month_1")).isEqualTo(100.0);
		assertThat(sales.amount(RollupSpecBuilder.LTM_TOTAL)).isEqualTo(1200.0);
		assertThat(sales.varianceAmount()).isNull();
	}

	@Test
	void incompleteLtmWindowProducesWarning() {
		StatementResult result = generator.generateHierarchical(StatementType.INCOME, monthlySales(2024, 9, 2025, 6),
				GenerationOptions.ltm("ltm"));

		assertThat(result.warnings()).hasSize(1);
		assertThat(result.warnings().get(0).missingSlots()).containsExactly("2024 P7", "2024 P8");
		assertThat(label(result, "Sales (8000)").amount(RollupSpecBuilder.LTM_TOTAL)).isEqualTo(1000.0);
	}

	@Test
	void definitionStatementCarriesMetrics() {
		StatementResult result = generator.generateFromDefinition(BundledReports.INCOME, Movements.balancedLedger(),
				GenerationOptions.compare("2024-all", "2025-all"));

		assertThat(result.reportId()).isEqualTo(BundledReports.INCOME);
		assertThat(result.rows()).hasSize(12);
		assertThat(result.metrics().get(StatementMetricsCalculator.NET_INCOME))
				.isEqualTo(Map.of("amount_1", 0.0, "amount_2", 20000.0));
		assertThat(result.metadata()).containsEntry("mode", "definition");
	}

	@Test
	void defaultBalanceReportIsBalanced() {
		StatementResult result = generator.generateDefault(StatementType.BALANCE, Movements.balancedLedger(),
				GenerationOptions.compare("2024-all", "2025-all"));

		assertThat(result.reportId()).isEqualTo(BundledReports.BALANCE);
		assertThat(result.balanced()).isTrue();
	}

	@Test
	void rejectsMissingDataAndUnknownReports() {
		GenerationOptions options = GenerationOptions.compare("2025-all", null);
		assertThatThrownBy(() -> generator.generateHierarchical(StatementType.INCOME, MovementTable.empty(), options))
				.isInstanceOf(DataException.class);
		assertThatThrownBy(() -> generator.generateHierarchical(StatementType.INCOME, null, options))
				.isInstanceOf(DataException.class);
		assertThatThrownBy(() -> generator.generateFromDefinition("nope", Movements.balancedLedger(), options))
				.isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> generator.generateHierarchical(StatementType.INCOME, Movements.balancedLedger(),
				GenerationOptions.compare("2025-13", null)))
				.isInstanceOf(ValidationException.class);
	}

	@Test
	void rowsOfUsesConfiguredStatementTypeCodes() {
		AppProperties properties = new AppProperties(
				new AppProperties.Statements(12, 0.01, Map.of("income", "PL")), null, null);
		StatementGenerator custom = new StatementGenerator(BundledReports.registry(), new CategoryClassifier(), properties);
		MovementTable table = MovementTable.of(List.of(
				new MovementRecord(2025, 1, "8000", "Sales", "", "", "80", "Omzet", "", "", "", "", "pl", -10.0),
				is(2025, 1, "8000", "Sales", "80", "Omzet", -10)
		));

		assertThat(custom.rowsOf(StatementType.INCOME, table).size()).isEqualTo(1);
		assertThat(custom.rowsOf(StatementType.INCOME, table).rows().get(0).statementType()).isEqualTo("pl");
	}

	private static GridRow label(StatementResult result, String label) {
		return result.rows().stream()
				.filter(r -> label.equals(r.label()))
				.findFirst()
				.orElseThrow();
	}

	private static MovementTable monthlySales(int fromYear, int fromPeriod, int toYear, int toPeriod) {
		List<MovementRecord> rows = new ArrayList<>();
		int year = fromYear;
		int period = fromPeriod;
		while (year < toYear || (year == toYear && period <= toPeriod)) {
			rows.add(is(year, period, "8000", "Sales", "80", "Netto-omzet", -100));
			period++;
			if (period > 12) {
				period = 1;
				year++;
			}
		}
		return MovementTable.of(rows);
	}
}
