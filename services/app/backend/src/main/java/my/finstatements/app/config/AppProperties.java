package my.finstatements.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import my.finstatements.app.category.CategoryPatterns;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Statements statements,
		Categories categories,
		@Valid Reports reports
) {
	public AppProperties {
		statements = statements == null ? new Statements(null, null, null) : statements;
		categories = categories == null ? new Categories(null, null, null, null, null, null, null, null, null, null) : categories;
		reports = reports == null ? new Reports(null, null) : reports;
	}

	public record Statements(
			@Min(1) @Max(36) Integer ltmMonths,
			@PositiveOrZero Double balanceTolerance,
			Map<String, String> statementTypeCodes
	) {
		public Statements {
			ltmMonths = ltmMonths == null ? 12 : ltmMonths;
			balanceTolerance = balanceTolerance == null ? 0.01 : balanceTolerance;
			statementTypeCodes = statementTypeCodes == null ? Map.of() : Map.copyOf(statementTypeCodes);
		}
	}

	public record Categories(
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
		public CategoryPatterns toPatterns() {
			return new CategoryPatterns(assets, liabilities, equity, cash, revenue, revenueExclusions, cogs,
					operatingExpenses, otherResults, tax);
		}
	}

	public record Reports(
			Boolean seedEnabled,
			List<String> resources
	) {
		public Reports {
			seedEnabled = seedEnabled == null ? Boolean.TRUE : seedEnabled;
			resources = resources == null ? List.of() : List.copyOf(resources);
		}
	}
}
