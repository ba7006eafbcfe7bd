package my.finstatements.app.category;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryClassifierTest {
	private final CategoryClassifier classifier = new CategoryClassifier();

	@Test
	void classifiesDutchAndEnglishIncomeCategories() {
		assertThat(classifier.classifyIncomeCategory("Netto-omzet")).isEqualTo(IncomeCategory.REVENUE);
		assertThat(classifier.classifyIncomeCategory("Revenue")).isEqualTo(IncomeCategory.REVENUE);
		assertThat(classifier.classifyIncomeCategory("Kostprijs van de omzet")).isEqualTo(IncomeCategory.COGS);
		assertThat(classifier.classifyIncomeCategory("Personeelskosten")).isEqualTo(IncomeCategory.OPERATING_EXPENSE);
		assertThat(classifier.classifyIncomeCategory("Financiële baten en lasten")).isEqualTo(IncomeCategory.OTHER_RESULT);
		assertThat(classifier.classifyIncomeCategory("Vennootschapsbelasting")).isEqualTo(IncomeCategory.TAX);
		assertThat(classifier.classifyIncomeCategory("Diversen")).isEqualTo(IncomeCategory.UNCLASSIFIED);
	}

	@Test
	void topLevelDecidesBalanceSide() {
		assertThat(classifier.isLiabilityOrEquityRow("Passiva", "Kortlopende schulden")).isTrue();
		assertThat(classifier.isLiabilityOrEquityRow("Activa", "Vorderingen")).isFalse();
		assertThat(classifier.isLiabilityOrEquityRow("", "Eigen vermogen")).isTrue();
		assertThat(classifier.isLiabilityOrEquityRow(null, "Voorraden")).isFalse();
	}

	@Test
	void cashIsFoundOnEitherLevel() {
		assertThat(classifier.isCashRow("Liquide middelen", null)).isTrue();
		assertThat(classifier.isCashRow("Vlottende activa", "Bank")).isTrue();
		assertThat(classifier.isCashRow("Vorderingen", "Debiteuren")).isFalse();
	}

	@Test
	void configuredPatternsReplaceDefaults() {
		CategoryPatterns patterns = new CategoryPatterns(null, null, null, List.of("kas"), null, null, null, null,
				null, null);
		CategoryClassifier custom = new CategoryClassifier(patterns);

		assertThat(custom.isCash("Kas en bank")).isTrue();
		assertThat(custom.isCash("Bank")).isFalse();
		assertThat(custom.isRevenue("Omzet")).isTrue();
	}
}
