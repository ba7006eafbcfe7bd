package my.finstatements.app.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable, ordered set of movements. Row order is the order the loader produced.
 */
public final class MovementTable {
	private static final MovementTable EMPTY = new MovementTable(List.of());

	private final List<MovementRecord> rows;

	private MovementTable(List<MovementRecord> rows) {
		this.rows = rows;
	}

	public static MovementTable of(List<MovementRecord> rows) {
		if (rows == null || rows.isEmpty()) {
			return EMPTY;
		}
		return new MovementTable(List.copyOf(rows));
	}

	public static MovementTable empty() {
		return EMPTY;
	}

	public List<MovementRecord> rows() {
		return rows;
	}

	public Stream<MovementRecord> stream() {
		return rows.stream();
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	/**
	 * Fiscal years in first-appearance order.
	 */
	public List<Integer> years() {
		Set<Integer> years = new LinkedHashSet<>();
		for (MovementRecord row : rows) {
			years.add(row.year());
		}
		return new ArrayList<>(years);
	}

	public List<Integer> sortedYears() {
		List<Integer> years = years();
		years.sort(Comparator.naturalOrder());
		return years;
	}

	public MovementTable filter(Predicate<MovementRecord> predicate) {
		List<MovementRecord> kept = new ArrayList<>();
		for (MovementRecord row : rows) {
			if (predicate.test(row)) {
				kept.add(row);
			}
		}
		if (kept.size() == rows.size()) {
			return this;
		}
		return of(kept);
	}
}
