package my.finstatements.app.category;

import java.util.List;

/**
 * Lower-case substrings that identify category names. Dutch and English defaults.
 */
public record CategoryPatterns(
		List<String> assets,
		List<String> liabilities,
		List<String> equity,
		List<String> cash,
		List<String> revenue,
		List<String> revenueExclusions,
		List<String> cogs,
		List<String> operatingExpenses,
		List<String> otherResults,
		List<String> tax
) {
	public CategoryPatterns {
		assets = orDefault(assets, List.of("activa", "assets", "immateriële vaste activa", "materiële vaste activa",
				"financiële vaste activa", "voorraden", "vorderingen", "liquide middelen", "inventory", "receivables"));
		liabilities = orDefault(liabilities, List.of("passiva", "liabilit", "schuld", "voorziening", "provision",
				"payable"));
		equity = orDefault(equity, List.of("eigen vermogen", "vermogen", "equity"));
		cash = orDefault(cash, List.of("liquide middelen", "cash", "bank"));
		revenue = orDefault(revenue, List.of("omzet", "revenue", "sales", "netto-omzet"));
		revenueExclusions = orDefault(revenueExclusions, List.of("kostprijs", "cost of"));
		cogs = orDefault(cogs, List.of("kostprijs", "cost of sales", "cost of goods", "inkoopwaarde"));
		operatingExpenses = orDefault(operatingExpenses, List.of("bedrijfslasten", "bedrijfskosten", "personeel",
				"afschrijving", "huisvesting", "operating expense", "depreciation", "overige kosten", "algemene kosten"));
		otherResults = orDefault(otherResults, List.of("financiële baten", "financiële lasten", "financial",
				"rente", "interest", "buitengewone", "extraordinary", "resultaat deelneming"));
		tax = orDefault(tax, List.of("belasting", "tax"));
	}

	public static CategoryPatterns defaults() {
		return new CategoryPatterns(null, null, null, null, null, null, null, null, null, null);
	}

	private static List<String> orDefault(List<String> configured, List<String> fallback) {
		return configured == null || configured.isEmpty() ? fallback : List.copyOf(configured);
	}
}
