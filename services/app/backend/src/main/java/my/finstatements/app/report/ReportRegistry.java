package my.finstatements.app.report;

import my.finstatements.app.domain.StatementType;
import my.finstatements.app.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the report definitions available to a generator. The first report registered for a
 * statement type becomes that type's default until another is chosen.
 */
public class ReportRegistry {
	private static final Logger logger = LoggerFactory.getLogger(ReportRegistry.class);

	private final ReportParser parser;
	private final ReportValidator validator;
	private final Map<String, ReportDefinition> reports = new LinkedHashMap<>();
	private final Map<StatementType, String> defaults = new EnumMap<>(StatementType.class);

	public ReportRegistry() {
		this(new ReportParser(), new ReportValidator());
	}

	public ReportRegistry(ReportParser parser, ReportValidator validator) {
		this.parser = parser;
		this.validator = validator;
	}

	/**
	 * Parses, validates and registers a definition.
	 *
	 * @throws ValidationException when the content cannot be parsed or is invalid
	 */
	public ReportDefinition load(String content) {
		ReportDefinition definition = parser.parse(content);
		register(definition);
		return definition;
	}

	public synchronized void register(ReportDefinition definition) {
		List<String> errors = validator.validate(definition);
		if (!errors.isEmpty()) {
			String id = definition == null ? null : definition.getReportId();
			throw ValidationException.of("Invalid report definition '" + id + "'", errors);
		}
		if (reports.containsKey(definition.getReportId())) {
			throw new ValidationException("Report with ID '" + definition.getReportId() + "' is already registered");
		}
		reports.put(definition.getReportId(), definition);
		StatementType type = StatementType.from(definition.getStatementType());
		defaults.putIfAbsent(type, definition.getReportId());
		logger.debug("Registered report {} ({})", definition.getReportId(), type.id());
	}

	public synchronized Optional<ReportDefinition> getReport(String reportId) {
		return Optional.ofNullable(reports.get(reportId));
	}

	public synchronized boolean hasReport(String reportId) {
		return reports.containsKey(reportId);
	}

	public synchronized List<ReportDefinition> getReportsByType(StatementType type) {
		List<ReportDefinition> matches = new ArrayList<>();
		for (ReportDefinition definition : reports.values()) {
			if (StatementType.from(definition.getStatementType()) == type) {
				matches.add(definition);
			}
		}
		return matches;
	}

	public synchronized List<ReportDefinition> getAllReports() {
		return new ArrayList<>(reports.values());
	}

	public synchronized boolean unregister(String reportId) {
		ReportDefinition removed = reports.remove(reportId);
		if (removed == null) {
			return false;
		}
		StatementType type = StatementType.from(removed.getStatementType());
		if (reportId.equals(defaults.get(type))) {
			defaults.remove(type);
			List<ReportDefinition> remaining = getReportsByType(type);
			if (!remaining.isEmpty()) {
				defaults.put(type, remaining.get(0).getReportId());
			}
		}
		return true;
	}

	public synchronized Optional<ReportDefinition> getDefaultReport(StatementType type) {
		String id = defaults.get(type);
		return id == null ? Optional.empty() : Optional.ofNullable(reports.get(id));
	}

	public synchronized void setDefaultReport(StatementType type, String reportId) {
		ReportDefinition definition = reports.get(reportId);
		if (definition == null) {
			throw new ValidationException("Report with ID '" + reportId + "' is not registered");
		}
		if (StatementType.from(definition.getStatementType()) != type) {
			throw new ValidationException("Report '" + reportId + "' is not a " + type.id() + " report");
		}
		defaults.put(type, reportId);
	}

	public synchronized List<StatementType> getStatementTypes() {
		List<StatementType> types = new ArrayList<>();
		for (ReportDefinition definition : reports.values()) {
			StatementType type = StatementType.from(definition.getStatementType());
			if (!types.contains(type)) {
				types.add(type);
			}
		}
		return types;
	}

	public synchronized int count() {
		return reports.size();
	}

	public synchronized void clear() {
		reports.clear();
		defaults.clear();
	}
}
