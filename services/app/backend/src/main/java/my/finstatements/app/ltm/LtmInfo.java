package my.finstatements.app.ltm;

import my.finstatements.app.domain.MovementTable;

import java.util.List;

public record LtmInfo(
		List<LtmRange> ranges,
		LatestPeriod latest,
		String label,
		String shortLabel,
		MovementTable filteredData,
		DataAvailability availability
) {
	public LtmInfo {
		ranges = List.copyOf(ranges);
	}

	public int monthCount() {
		return ranges.stream().mapToInt(LtmRange::periodCount).sum();
	}
}
