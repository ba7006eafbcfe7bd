package my.finstatements.app.util;

import my.finstatements.app.errors.DataException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {
	@Test
	void mapTransformsOkValues() {
		Result<Integer> result = Result.ok(2).map(v -> v * 21);
		assertThat(result.isOk()).isTrue();
		assertThat(result.value()).isEqualTo(42);
	}

	@Test
	void errorsPassThroughMapAndThrowOnDemand() {
		Result<Integer> failed = Result.<Integer>err(new DataException("no rows")).map(v -> v + 1);
		assertThat(failed.isOk()).isFalse();
		assertThat(failed.value()).isNull();
		assertThatThrownBy(failed::orElseThrow)
				.isInstanceOf(DataException.class)
				.hasMessage("no rows");
	}
}
