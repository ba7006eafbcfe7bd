package my.finstatements.app.variables;

import java.util.LinkedHashMap;
import java.util.Map;

public class VariableDefinition {
	private Map<String, Object> filter;
	private String aggregate;
	private String description;

	public VariableDefinition() {
	}

	public VariableDefinition(Map<String, Object> filter, String aggregate) {
		this.filter = filter == null ? null : new LinkedHashMap<>(filter);
		this.aggregate = aggregate;
	}

	public Map<String, Object> getFilter() {
		return filter;
	}

	public void setFilter(Map<String, Object> filter) {
		this.filter = filter;
	}

	public String getAggregate() {
		return aggregate;
	}

	public void setAggregate(String aggregate) {
		this.aggregate = aggregate;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}
}
