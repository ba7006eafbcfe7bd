package my.finstatements.app.report;

import my.finstatements.app.variables.VariableDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ReportDefinition {
	private String reportId;
	private String name;
	private String version;
	private String statementType;
	private String description;
	private Map<String, VariableDefinition> variables = new LinkedHashMap<>();
	private List<LayoutItem> layout;
	private FormattingRules formatting;

	public String getReportId() {
		return reportId;
	}

	public void setReportId(String reportId) {
		this.reportId = reportId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getStatementType() {
		return statementType;
	}

	public void setStatementType(String statementType) {
		this.statementType = statementType;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public Map<String, VariableDefinition> getVariables() {
		return variables;
	}

	public void setVariables(Map<String, VariableDefinition> variables) {
		this.variables = variables;
	}

	public List<LayoutItem> getLayout() {
		return layout;
	}

	public void setLayout(List<LayoutItem> layout) {
		this.layout = layout;
	}

	public FormattingRules getFormatting() {
		return formatting;
	}

	public void setFormatting(FormattingRules formatting) {
		this.formatting = formatting;
	}
}
