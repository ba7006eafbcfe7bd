package my.finstatements.app.config;

import my.finstatements.app.report.ReportRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.ResourceLoader;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class ReportCatalogSeederTest {
	private static final String INCOME = "classpath:reports/income_statement_default.json";
	private static final String MISSING = "classpath:reports/missing.json";
	private static final String BROKEN = "classpath:reports/broken.json";

	@Test
	void registersBundledReportsAndSkipsBrokenOnes() {
		ReportRegistry registry = new ReportRegistry();
		ResourceLoader resourceLoader = mock(ResourceLoader.class);
		when(resourceLoader.getResource(INCOME)).thenReturn(new ClassPathResource("reports/income_statement_default.json"));
		when(resourceLoader.getResource(MISSING)).thenReturn(new ClassPathResource("reports/missing.json"));
		when(resourceLoader.getResource(BROKEN))
				.thenReturn(new ByteArrayResource("{ \"reportId\": ".getBytes(StandardCharsets.UTF_8)));
		AppProperties properties = properties(true, List.of(INCOME, MISSING, BROKEN));

		ReportCatalogSeeder seeder = new ReportCatalogSeeder(registry, resourceLoader, properties);
		seeder.run(null);

		assertThat(registry.count()).isEqualTo(1);
		assertThat(registry.hasReport("income_statement_default")).isTrue();
		verify(resourceLoader, times(3)).getResource(anyString());
	}

	@Test
	void seedingTwiceDoesNotRegisterDuplicates() {
		ReportRegistry registry = new ReportRegistry();
		ResourceLoader resourceLoader = mock(ResourceLoader.class);
		when(resourceLoader.getResource(INCOME)).thenReturn(new ClassPathResource("reports/income_statement_default.json"));
		ReportCatalogSeeder seeder = new ReportCatalogSeeder(registry, resourceLoader, properties(true, List.of(INCOME)));

		assertThat(seeder.seed(INCOME)).isTrue();
		assertThat(seeder.seed(INCOME)).isFalse();
		assertThat(registry.count()).isEqualTo(1);
	}

	@Test
	void skipsSeedingWhenDisabled() {
		ReportRegistry registry = new ReportRegistry();
		ResourceLoader resourceLoader = mock(ResourceLoader.class);

		ReportCatalogSeeder seeder = new ReportCatalogSeeder(registry, resourceLoader, properties(false, List.of(INCOME)));
		seeder.run(null);

		assertThat(registry.count()).isZero();
		verifyNoInteractions(resourceLoader);
	}

	private static AppProperties properties(boolean enabled, List<String> resources) {
		return new AppProperties(null, null, new AppProperties.Reports(enabled, resources));
	}
}
