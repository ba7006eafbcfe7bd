package my.finstatements.app.config;

import my.finstatements.app.category.CategoryClassifier;
import my.finstatements.app.report.ReportRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatementEngineConfig {

	@Bean
	@ConditionalOnMissingBean
	public CategoryClassifier categoryClassifier(AppProperties properties) {
		return new CategoryClassifier(properties.categories().toPatterns());
	}

	@Bean
	@ConditionalOnMissingBean
	public ReportRegistry reportRegistry() {
		return new ReportRegistry();
	}
}
