package my.finstatements.app.rollup;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static my.finstatements.app.support.Movements.is;
import static org.assertj.core.api.Assertions.assertThat;

class RollupExecutorTest {
	private final RollupExecutor executor = new RollupExecutor();

	private final MovementTable table = MovementTable.of(List.of(
			is(2024, 1, "8000", "Sales", "80", "Netto-omzet", -1000),
			is(2025, 1, "8000", "Sales", "80", "Netto-omzet", -1500),
			is(2025, 2, "8100", "Services", "80", "Netto-omzet", -500),
			is(2025, MovementRecord.ALL_PERIODS, "4000", "Rent", "40", "Huisvestingskosten", 300)
	));

	@Test
	void groupsByAccountInFirstAppearanceOrder() {
		List<AggregatedRow> rows = executor.rollup(table, RollupSpecBuilder.buildNormalModeSpec(2024, 2025, -1.0));

		assertThat(rows).extracting(r -> r.key().accountCode()).containsExactly("8000", "8100", "4000");
		assertThat(rows.get(0).amounts()).containsEntry("amount_1", 1000.0).containsEntry("amount_2", 1500.0);
		assertThat(rows.get(2).amount("amount_2")).isEqualTo(-300.0);
	}

	@Test
	void categoryTotalsSumAccountsAndComputeVariance() {
		List<AggregatedRow> rows = executor.rollup(table, RollupSpecBuilder.buildCategoryTotalsSpec(2024, 2025, -1.0));

		AggregatedRow revenue = rows.get(0);
		assertThat(revenue.key().name1()).isEqualTo("Netto-omzet");
		assertThat(revenue.amount("amount_1")).isEqualTo(1000.0);
		assertThat(revenue.amount("amount_2")).isEqualTo(2000.0);
		assertThat(revenue.amount(RollupSpecBuilder.VARIANCE_AMOUNT)).isEqualTo(1000.0);
		assertThat(revenue.amount(RollupSpecBuilder.VARIANCE_PERCENT)).isEqualTo(100.0);

		AggregatedRow rent = rows.get(1);
		assertThat(rent.amount("amount_1")).isEqualTo(0.0);
		assertThat(rent.amount(RollupSpecBuilder.VARIANCE_PERCENT)).isNull();
	}

	@Test
	void conditionalSumsOnlyCountMatchingRows() {
		RollupSpec spec = new RollupSpecBuilder()
				.groupBy(GroupingLevel.CATEGORY)
				.addConditionalSum("first_half", row -> row.period() <= 6, 1.0)
				.addSum("all")
				.build();

		List<AggregatedRow> rows = executor.rollup(table, spec);

		assertThat(rows.get(0).amount("first_half")).isEqualTo(-3000.0);
		assertThat(rows.get(1).amount("first_half")).isEqualTo(0.0);
		assertThat(rows.get(1).amount("all")).isEqualTo(300.0);
	}
}
