package my.finstatements.app.importer;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class MovementCsvParserTest {
	private final MovementCsvParser parser = new MovementCsvParser();

	@Test
	void parsesSemicolonExportWithMovementAmount() {
		String csv = "\uFEFFYear;Period;Account_Code;Account_Description;Code0;Name0;Code1;Name1;Statement_Type;Movement_Amount\n"
				+ "2025;P03;8000;Sales;W;Winst en verlies;80;Netto-omzet;IS;-1.500,00\n"
				+ "2025;all;1000;Bank;A;Activa;40;Liquide middelen;BS;1500\n";

		MovementTable table = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "movements.csv");

		assertThat(table.size()).isEqualTo(2);
		MovementRecord sale = table.rows().get(0);
		assertThat(sale.year()).isEqualTo(2025);
		assertThat(sale.period()).isEqualTo(3);
		assertThat(sale.accountCode()).isEqualTo("8000");
		assertThat(sale.statementType()).isEqualTo("IS");
		assertThat(sale.amount()).isEqualTo(-1500.0);
		assertThat(table.rows().get(1).isAllPeriods()).isTrue();
	}

	@Test
	void derivesAmountFromDebitAndCredit() {
		String csv = "year,period,account_code,debit,credit\n"
				+ "2024,1,4000,250.00,\n"
				+ "2024,2,4000,,100.00\n";

		MovementTable table = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "journal.csv");

		assertThat(table.rows()).extracting(MovementRecord::movementAmount).containsExactly(250.0, -100.0);
	}

	@Test
	void skipsRowsWithoutValidYearOrPeriod() {
		String csv = "year,period,account_code,movement_amount\n"
				+ "2024,1,4000,10\n"
				+ "total,,4000,10\n"
				+ "2024,Q1,4000,10\n";

		MovementTable table = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "journal.csv");

		assertThat(table.size()).isEqualTo(1);
	}

	@Test
	void emptyPayloadGivesEmptyTable() {
		assertThat(parser.parse(new byte[0], "empty.csv").isEmpty()).isTrue();
	}
}
