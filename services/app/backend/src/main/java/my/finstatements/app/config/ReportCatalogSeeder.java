package my.finstatements.app.config;

import my.finstatements.app.errors.StatementException;
import my.finstatements.app.report.ReportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Registers the bundled report definitions at startup. A broken resource is logged and skipped.
 */
@Component
public class ReportCatalogSeeder implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(ReportCatalogSeeder.class);

	private final ReportRegistry reportRegistry;
	private final ResourceLoader resourceLoader;
	private final AppProperties properties;

	public ReportCatalogSeeder(ReportRegistry reportRegistry,
							   ResourceLoader resourceLoader,
							   AppProperties properties) {
		this.reportRegistry = reportRegistry;
		this.resourceLoader = resourceLoader;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!properties.reports().seedEnabled()) {
			logger.info("Report seeding disabled (app.reports.seed-enabled=false)");
			return;
		}
		int loaded = 0;
		for (String location : properties.reports().resources()) {
			if (seed(location)) {
				loaded++;
			}
		}
		logger.info("Seeded {} report definition(s) into the registry", loaded);
	}

	boolean seed(String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Report definition resource not found: {}", location);
			return false;
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			String reportId = reportRegistry.load(content).getReportId();
			logger.info("Registered report definition {} from {}", reportId, location);
			return true;
		} catch (IOException | StatementException ex) {
			logger.error("Failed to register report definition from {}: {}", location, ex.getMessage());
			return false;
		}
	}
}
