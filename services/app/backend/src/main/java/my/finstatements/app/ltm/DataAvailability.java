package my.finstatements.app.ltm;

import java.util.List;

public record DataAvailability(
		boolean complete,
		int actualMonths,
		int expectedMonths,
		String message,
		List<String> missingSlots
) {
	public DataAvailability {
		missingSlots = missingSlots == null ? List.of() : List.copyOf(missingSlots);
	}
}
