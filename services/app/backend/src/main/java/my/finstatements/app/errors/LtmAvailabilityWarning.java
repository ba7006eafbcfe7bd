package my.finstatements.app.errors;

import java.util.List;

/**
 * Non-fatal: the rolling window was computed over partial data.
 */
public record LtmAvailabilityWarning(String message, List<String> missingSlots) {
	public LtmAvailabilityWarning {
		missingSlots = missingSlots == null ? List.of() : List.copyOf(missingSlots);
	}
}
