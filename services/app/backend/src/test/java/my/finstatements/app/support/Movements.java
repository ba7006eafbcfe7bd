package my.finstatements.app.support;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;

import java.util.List;

/**
 * Small double-entry ledgers for statement tests.
 */
public final class Movements {
	private Movements() {
	}

	public static MovementRecord bs(int year, int period, String account, String description, String code0,
									String name0, String code1, String name1, double amount) {
		return new MovementRecord(year, period, account, description, code0, name0, code1, name1, "", "", "", "",
				"BS", amount);
	}

	public static MovementRecord is(int year, int period, String account, String description, String code1,
									String name1, double amount) {
		return new MovementRecord(year, period, account, description, "W", "Winst en verlies", code1, name1, "", "",
				"", "", "IS", amount);
	}

	public static MovementRecord bank(int year, int period, double amount) {
		return bs(year, period, "1000", "Bank", "A", "Activa", "40", "Liquide middelen", amount);
	}

	public static MovementRecord capital(int year, int period, double amount) {
		return bs(year, period, "0500", "Share capital", "P", "Passiva", "50", "Eigen vermogen", amount);
	}

	/**
	 * Capital paid in, one sale and one purchase, all settled through the bank in 2025.
	 * Assets 120000, equity 100000, net income 20000.
	 */
	public static MovementTable balancedLedger() {
		return MovementTable.of(List.of(
				capital(2025, 1, -100000),
				bank(2025, 1, 100000),
				is(2025, 3, "8000", "Sales", "80", "Netto-omzet", -30000),
				bank(2025, 3, 30000),
				is(2025, 3, "7000", "Purchases", "70", "Kostprijs van de omzet", 10000),
				bank(2025, 3, -10000)
		));
	}
}
