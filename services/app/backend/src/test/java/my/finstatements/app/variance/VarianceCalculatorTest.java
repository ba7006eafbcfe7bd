package my.finstatements.app.variance;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VarianceCalculatorTest {
	@Test
	void percentIsRelativeToAbsoluteBaseline() {
		assertThat(VarianceCalculator.amount(1000.0, 1250.0)).isEqualTo(250.0);
		assertThat(VarianceCalculator.percent(1000.0, 1250.0)).isEqualTo(25.0);
		assertThat(VarianceCalculator.percent(-200.0, -100.0)).isCloseTo(50.0, within(1e-9));
	}

	@Test
	void zeroBaseline() {
		assertThat(VarianceCalculator.percent(0.0, 0.0)).isEqualTo(0.0);
		assertThat(VarianceCalculator.percent(0.0, 10.0)).isNull();
	}

	@Test
	void missingValuesCountAsZeroUnlessBothAreMissing() {
		assertThat(VarianceCalculator.amount(null, 10.0)).isEqualTo(10.0);
		assertThat(VarianceCalculator.amount(null, null)).isNull();
		assertThat(VarianceCalculator.percent(null, null)).isNull();
	}
}
