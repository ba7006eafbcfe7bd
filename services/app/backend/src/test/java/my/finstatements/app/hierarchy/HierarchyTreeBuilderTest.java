package my.finstatements.app.hierarchy;

import my.finstatements.app.columns.ColumnLayout;
import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.dto.GridRow;
import my.finstatements.app.dto.RowStyle;
import my.finstatements.app.dto.RowType;
import my.finstatements.app.rollup.AccountKey;
import my.finstatements.app.rollup.AggregatedRow;
import my.finstatements.app.rollup.RollupSpecBuilder;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HierarchyTreeBuilderTest {
	private final HierarchyTreeBuilder builder = new HierarchyTreeBuilder();
	private final ColumnLayout layout = RollupSpecBuilder.normalLayout(2024, 2025);

	@Test
	void threeAccountsInOneGroupGiveGroupFirstThenSortedAccounts() {
		List<AggregatedRow> rows = List.of(
				account("", "", "10", "Vaste activa", "0300", "Machines", 300.0, 250.0),
				account("", "", "10", "Vaste activa", "0100", "Gebouwen", 100.0, 90.0),
				account("", "", "10", "Vaste activa", "0200", "Inventaris", 200.0, 150.0)
		);

		List<HierarchyNode> nodes = builder.buildTree(rows, layout.keys(), HierarchyNode.ACCOUNT_LEVEL);

		assertThat(nodes).hasSize(4);
		assertThat(nodes.get(0).isAccount()).isFalse();
		assertThat(nodes.get(0).label()).isEqualTo("Vaste activa (10)");
		assertThat(nodes.get(0).amounts()).containsEntry("amount_1", 600.0).containsEntry("amount_2", 490.0);
		assertThat(nodes.subList(1, 4)).extracting(HierarchyNode::accountCode).containsExactly("0100", "0200", "0300");
	}

	@Test
	void groupsOrderNumericallyAndSectionsAlphabetically() {
		List<AggregatedRow> rows = List.of(
				account("P", "Passiva", "50", "Eigen vermogen", "0500", "Kapitaal", -100.0, -100.0),
				account("A", "Activa", "100", "Liquide middelen", "1000", "Bank", 60.0, 60.0),
				account("A", "Activa", "20", "Voorraden", "3000", "Voorraad", 40.0, 40.0)
		);

		List<HierarchyNode> nodes = builder.buildTree(rows, layout.keys(), 1);

		assertThat(nodes).extracting(HierarchyNode::label).containsExactly(
				"Activa (A)", "Voorraden (20)", "Liquide middelen (100)", "Passiva (P)", "Eigen vermogen (50)");
		assertThat(nodes.get(0).amounts()).containsEntry("amount_1", 100.0);
	}

	@Test
	void detailLevelHidesDeeperNodesButKeepsTheirAmounts() {
		List<AggregatedRow> rows = List.of(
				account("A", "Activa", "10", "Vaste activa", "0100", "Gebouwen", 100.0, 0.0),
				account("A", "Activa", "20", "Voorraden", "3000", "Voorraad", 40.0, 0.0)
		);

		List<HierarchyNode> nodes = builder.buildTree(rows, layout.keys(), 0);

		assertThat(nodes).hasSize(1);
		assertThat(nodes.get(0).amounts()).containsEntry("amount_1", 140.0);
	}

	@Test
	void gridRowsCarryStyleIndentAndVariance() {
		List<AggregatedRow> rows = List.of(
				account("A", "Activa", "10", "Vaste activa", "0100", "Gebouwen", 100.0, 150.0));

		List<GridRow> grid = builder.toGridRows(builder.buildTree(rows, layout.keys(), HierarchyNode.ACCOUNT_LEVEL),
				layout);

		assertThat(grid).hasSize(3);
		GridRow top = grid.get(0);
		assertThat(top.style()).isEqualTo(RowStyle.TOTAL);
		assertThat(top.type()).isEqualTo(RowType.CATEGORY);
		assertThat(top.indent()).isZero();
		assertThat(top.metadata().category()).isNull();
		GridRow leaf = grid.get(2);
		assertThat(leaf.type()).isEqualTo(RowType.ACCOUNT);
		assertThat(leaf.label()).isEqualTo("Gebouwen (0100)");
		assertThat(leaf.indent()).isEqualTo(2);
		assertThat(leaf.metadata().hierarchyPath()).containsExactly("A", "10", "0100");
		assertThat(leaf.metadata().category()).isEqualTo("Vaste activa");
		assertThat(leaf.varianceAmount()).isEqualTo(50.0);
		assertThat(leaf.variancePercent()).isEqualTo(50.0);
		assertThat(grid).extracting(GridRow::order).containsExactly(1, 2, 3);
	}

	@Test
	void accountSharingItsCodeWithASiblingGroupStaysSeparate() {
		MovementRecord direct = new MovementRecord(2025, 1, "20", "Direct account", "A", "Activa", "10", "Vaste activa",
				"", "", "", "", "BS", 0.0);
		MovementRecord nested = new MovementRecord(2025, 1, "2001", "Nested account", "A", "Activa", "10", "Vaste activa",
				"20", "Sub", "", "", "BS", 0.0);
		List<AggregatedRow> rows = List.of(
				new AggregatedRow(AccountKey.of(direct), Map.of("amount_1", 100.0, "amount_2", 0.0)),
				new AggregatedRow(AccountKey.of(nested), Map.of("amount_1", 50.0, "amount_2", 0.0)));

		List<HierarchyNode> nodes = builder.buildTree(rows, layout.keys(), HierarchyNode.ACCOUNT_LEVEL);

		assertThat(nodes).hasSize(5);
		assertThat(nodes).extracting(HierarchyNode::label)
				.contains("Direct account (20)", "Sub (20)", "Nested account (2001)");
		HierarchyNode directLeaf = nodes.stream().filter(n -> n.label().equals("Direct account (20)")).findFirst().orElseThrow();
		HierarchyNode subGroup = nodes.stream().filter(n -> n.label().equals("Sub (20)")).findFirst().orElseThrow();
		HierarchyNode parent = nodes.stream().filter(n -> n.label().equals("Vaste activa (10)")).findFirst().orElseThrow();
		assertThat(directLeaf.isAccount()).isTrue();
		assertThat(directLeaf.amounts()).containsEntry("amount_1", 100.0);
		assertThat(subGroup.isAccount()).isFalse();
		assertThat(subGroup.amounts()).containsEntry("amount_1", 50.0);
		assertThat(parent.amounts()).containsEntry("amount_1", 150.0);
	}

	static AggregatedRow account(String code0, String name0, String code1, String name1, String accountCode,
								 String description, double first, double second) {
		MovementRecord row = new MovementRecord(2025, 1, accountCode, description, code0, name0, code1, name1,
				"", "", "", "", "BS", 0.0);
		Map<String, Double> amounts = new LinkedHashMap<>();
		amounts.put("amount_1", first);
		amounts.put("amount_2", second);
		return new AggregatedRow(AccountKey.of(row), amounts);
	}
}
