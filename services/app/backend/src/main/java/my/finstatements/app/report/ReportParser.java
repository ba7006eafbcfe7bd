package my.finstatements.app.report;

import my.finstatements.app.errors.ValidationException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads report definitions. Content opening with <code>{</code> is read as JSON only, anything else
 * as YAML, so a broken JSON file reports the JSON error rather than a YAML one.
 */
public class ReportParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public ReportParser() {
		this.jsonMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.yamlMapper = YAMLMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	/**
	 * @throws ValidationException when the content is blank, unreadable or holds no definition
	 */
	public ReportDefinition parse(String content) {
		if (content == null || content.isBlank()) {
			throw new ValidationException("Report definition content is empty");
		}
		boolean json = content.stripLeading().startsWith("{");
		ReportDefinition definition;
		try {
			definition = (json ? jsonMapper : yamlMapper).readValue(content, ReportDefinition.class);
		} catch (JacksonException ex) {
			String format = json ? "JSON" : "YAML";
			throw new ValidationException("Report definition is not valid " + format + ": " + ex.getOriginalMessage());
		}
		if (definition == null) {
			throw new ValidationException("Report definition content holds no definition");
		}
		return definition;
	}
}
