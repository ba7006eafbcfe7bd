package my.finstatements.app;

import my.finstatements.app.config.AppProperties;
import my.finstatements.app.domain.StatementType;
import my.finstatements.app.dto.StatementResult;
import my.finstatements.app.report.ReportRegistry;
import my.finstatements.app.statement.GenerationOptions;
import my.finstatements.app.statement.StatementGenerator;
import my.finstatements.app.support.Movements;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class FinStatementsApplicationTests {
	@Autowired
	private ReportRegistry reportRegistry;

	@Autowired
	private StatementGenerator statementGenerator;

	@Autowired
	private AppProperties properties;

	@Test
	void contextLoadsAndSeedsBundledReports() {
		assertThat(reportRegistry.count()).isEqualTo(3);
		assertThat(reportRegistry.getStatementTypes())
				.containsExactlyInAnyOrder(StatementType.BALANCE, StatementType.INCOME, StatementType.CASH_FLOW);
		assertThat(properties.statements().ltmMonths()).isEqualTo(12);
		assertThat(properties.statements().statementTypeCodes()).containsEntry("cashflow", "CF");
	}

	@Test
	void generatesDefaultIncomeStatement() {
		StatementResult result = statementGenerator.generateDefault(StatementType.INCOME, Movements.balancedLedger(),
				GenerationOptions.compare("2025-all", null));

		assertThat(result.reportId()).isEqualTo("income_statement_default");
		assertThat(result.metrics().get("netIncome", "amount_1")).isEqualTo(20000.0);
	}
}
