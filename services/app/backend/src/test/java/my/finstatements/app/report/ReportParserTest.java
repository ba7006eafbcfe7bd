package my.finstatements.app.report;

import org.assertj.core.api.InstanceOfAssertFactories;
import my.finstatements.app.errors.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportParserTest {
	private final ReportParser parser = new ReportParser();

	@Test
	void parsesJsonDefinition() {
		String json = """
				{
				  "reportId": "is_simple",
				  "name": "Simple income",
				  "version": "1.0",
				  "statementType": "income",
				  "unknownField": true,
				  "variables": {
				    "revenue": { "filter": { "code1": { "gte": "80", "lte": "89" } }, "aggregate": "sum" }
				  },
				  "layout": [
				    { "order": 10, "type": "variable", "label": "Revenue", "variable": "revenue", "indent": 1 },
				    { "order": 20, "type": "subtotal", "label": "Total", "from": 10, "to": 10, "decimals": 2 }
				  ],
				  "formatting": { "currencySymbol": "$", "negativeParentheses": true }
				}
				""";

		ReportDefinition definition = parser.parse(json);

		assertThat(definition.getReportId()).isEqualTo("is_simple");
		assertThat(definition.getVariables().get("revenue").getFilter())
				.containsEntry("code1", Map.of("gte", "80", "lte", "89"));
		assertThat(definition.getLayout()).hasSize(2);
		assertThat(definition.getLayout().get(0).getIndent()).isEqualTo(1);
		assertThat(definition.getLayout().get(1).getFrom()).isEqualTo(10);
		assertThat(definition.getLayout().get(1).getDecimals()).isEqualTo(2);
		assertThat(definition.getFormatting().getCurrencySymbol()).isEqualTo("$");
		assertThat(definition.getFormatting().getNegativeParentheses()).isTrue();
	}

	@Test
	void fallsBackToYaml() {
		String yaml = """
				reportId: bs_yaml
				name: Balance from YAML
				version: "2"
				statementType: balance
				variables:
				  cash:
				    filter:
				      name1: [Liquide middelen, Bank]
				    aggregate: sum
				layout:
				  - order: 10
				    type: variable
				    label: Cash
				    variable: cash
				""";

		ReportDefinition definition = parser.parse(yaml);

		assertThat(definition.getReportId()).isEqualTo("bs_yaml");
		assertThat(definition.getStatementType()).isEqualTo("balance");
		assertThat(definition.getVariables().get("cash").getFilter().get("name1"))
				.asInstanceOf(InstanceOfAssertFactories.LIST)
				.containsExactly("Liquide middelen", "Bank");
		assertThat(definition.getLayout().get(0).getVariable()).isEqualTo("cash");
	}

	@Test
	void brokenJsonReportsTheJsonError() {
		assertThatThrownBy(() -> parser.parse("{ \"reportId\": "))
				.isInstanceOf(ValidationException.class)
				.hasMessageStartingWith("Report definition is not valid JSON: ");
	}

	@Test
	void rejectsBlankContentAndBrokenYaml() {
		assertThatThrownBy(() -> parser.parse("  "))
				.isInstanceOf(ValidationException.class)
				.hasMessage("Report definition content is empty");
		assertThatThrownBy(() -> parser.parse("reportId: ["))
				.isInstanceOf(ValidationException.class)
				.hasMessageStartingWith("Report definition is not valid YAML: ");
	}
}
