package my.finstatements.app.ltm;

import my.finstatements.app.domain.MovementRecord;
import my.finstatements.app.domain.MovementTable;
import my.finstatements.app.errors.LtmAvailabilityWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rolling window arithmetic for "latest twelve months" statements.
 * <p>
 * Never throws on thin data: incomplete history yields {@code availability.complete == false}.
 */
public class LtmCalculator {
	public static final int DEFAULT_MONTHS = 12;
	private static final Logger logger = LoggerFactory.getLogger(LtmCalculator.class);

	public LtmInfo calculateLTMInfo(MovementTable table, Collection<Integer> availableYears, int monthsCount) {
		MovementTable data = table == null ? MovementTable.empty() : table;
		LatestPeriod latest = findLatestPeriod(data);
		if (latest == null) {
			DataAvailability none = new DataAvailability(false, 0, monthsCount, "No data available", List.of());
			return new LtmInfo(List.of(), null, generateLabel(List.of()), "LTM (No Data)", MovementTable.empty(), none);
		}
		List<LtmRange> ranges = calculateLTMRange(latest.year(), latest.period(), monthsCount);
		MovementTable filtered = filterToRanges(data, ranges);
		Collection<Integer> years = availableYears == null ? data.years() : availableYears;
		DataAvailability availability = checkAvailability(data, ranges, years, monthsCount);
		if (!availability.complete()) {
			logger.warn("LTM window ending {} P{} is incomplete: {}", latest.year(), latest.period(),
					availability.message());
		}
		return new LtmInfo(ranges, latest, generateLabel(ranges), generateShortLabel(latest), filtered, availability);
	}

	public LtmInfo calculateLTMInfo(MovementTable table) {
		return calculateLTMInfo(table, null, DEFAULT_MONTHS);
	}

	/**
	 * Highest year, then highest month inside it. Full-year aggregate rows are ignored.
	 */
	public LatestPeriod findLatestPeriod(MovementTable table) {
		LatestPeriod latest = null;
		for (MovementRecord row : table.rows()) {
			if (row.isAllPeriods() || row.period() < 1 || row.period() > 12) {
				continue;
			}
			if (latest == null || row.year() > latest.year()
					|| (row.year() == latest.year() && row.period() > latest.period())) {
				latest = new LatestPeriod(row.year(), row.period());
			}
		}
		return latest;
	}

	/**
	 * Contiguous ranges ending at (year, period), oldest first. Invalid input gives an empty list.
	 */
	public List<LtmRange> calculateLTMRange(int year, int period, int monthsBack) {
		if (year <= 0 || period < 1 || period > 12 || monthsBack < 1) {
			return List.of();
		}
		LinkedList<LtmRange> ranges = new LinkedList<>();
		int remaining = monthsBack;
		int currentYear = year;
		int currentPeriod = period;
		while (remaining > 0) {
			int start = Math.max(1, currentPeriod - remaining + 1);
			ranges.addFirst(new LtmRange(currentYear, start, currentPeriod));
			remaining -= currentPeriod - start + 1;
			currentYear--;
			currentPeriod = 12;
		}
		return new ArrayList<>(ranges);
	}

	public MovementTable filterToRanges(MovementTable table, List<LtmRange> ranges) {
		if (ranges.isEmpty()) {
			return MovementTable.empty();
		}
		return table.filter(row -> inRanges(row, ranges));
	}

	public String generateLabel(List<LtmRange> ranges) {
		if (ranges == null || ranges.isEmpty()) {
			return "LTM (No Data)";
		}
		LtmRange first = ranges.get(0);
		LtmRange last = ranges.get(ranges.size() - 1);
		return "LTM (" + first.year() + " P" + first.startPeriod() + " - " + last.year() + " P" + last.endPeriod() + ")";
	}

	public String generateShortLabel(LatestPeriod latest) {
		return "LTM " + latest.year() + " P" + latest.period();
	}

	/**
	 * Complete only when every (year, period) slot of the window has at least one row.
	 */
	public DataAvailability checkAvailability(MovementTable table, List<LtmRange> ranges,
											  Collection<Integer> availableYears, int monthsCount) {
		if (ranges.isEmpty()) {
			return new DataAvailability(false, 0, monthsCount, "No data available", List.of());
		}
		Set<Integer> missingYears = new TreeSet<>();
		for (LtmRange range : ranges) {
			if (availableYears != null && !availableYears.contains(range.year())) {
				missingYears.add(range.year());
			}
		}
		Set<Long> present = new HashSet<>();
		for (MovementRecord row : table.rows()) {
			present.add(slot(row.year(), row.period()));
		}
		List<String> missingSlots = new ArrayList<>();
		for (LtmRange range : ranges) {
			for (int period = range.startPeriod(); period <= range.endPeriod(); period++) {
				if (!present.contains(slot(range.year(), period))) {
					missingSlots.add(range.year() + " P" + period);
				}
			}
		}
		int expected = ranges.stream().mapToInt(LtmRange::periodCount).sum();
		int actual = expected - missingSlots.size();
		if (!missingYears.isEmpty()) {
			String years = missingYears.stream().map(String::valueOf).collect(Collectors.joining(", "));
			return new DataAvailability(false, actual, monthsCount, "Missing data for year(s): " + years, missingSlots);
		}
		if (!missingSlots.isEmpty()) {
			String message = "Only " + actual + " month(s) available (need " + monthsCount + "). Missing periods: "
					+ String.join(", ", missingSlots);
			return new DataAvailability(false, actual, monthsCount, message, missingSlots);
		}
		return new DataAvailability(true, actual, monthsCount, "Complete LTM data available", List.of());
	}

	public Optional<LtmAvailabilityWarning> toWarning(LtmInfo info) {
		if (info == null || info.availability().complete()) {
			return Optional.empty();
		}
		return Optional.of(new LtmAvailabilityWarning(info.availability().message(),
				info.availability().missingSlots()));
	}

	private static boolean inRanges(MovementRecord row, List<LtmRange> ranges) {
		for (LtmRange range : ranges) {
			if (row.year() == range.year() && row.period() >= range.startPeriod() && row.period() <= range.endPeriod()) {
				return true;
			}
		}
		return false;
	}

	private static long slot(int year, int period) {
		return year * 1000L + period;
	}
}
