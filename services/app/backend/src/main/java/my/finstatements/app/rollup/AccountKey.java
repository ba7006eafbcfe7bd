package my.finstatements.app.rollup;

import my.finstatements.app.domain.MovementRecord;

/**
 * Hierarchy path of an account. Category-level keys only carry {@code name1} and the first {@code code1} seen.
 */
public record AccountKey(
		String code0,
		String name0,
		String code1,
		String name1,
		String code2,
		String name2,
		String code3,
		String name3,
		String accountCode,
		String accountDescription
) {
	public static AccountKey of(MovementRecord row) {
		return new AccountKey(row.code0(), row.name0(), row.code1(), row.name1(), row.code2(), row.name2(),
				row.code3(), row.name3(), row.accountCode(), row.accountDescription());
	}

	public static AccountKey category(MovementRecord row) {
		return new AccountKey(null, row.name0(), row.code1(), row.name1(), null, null, null, null, null, null);
	}
}
