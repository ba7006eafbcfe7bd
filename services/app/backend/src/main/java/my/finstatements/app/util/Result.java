package my.finstatements.app.util;

import my.finstatements.app.errors.StatementException;

import java.util.function.Function;

/**
 * Outcome of a pure computation that reports failures as values.
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

	static <T> Result<T> ok(T value) {
		return new Ok<>(value);
	}

	static <T> Result<T> err(StatementException error) {
		return new Err<>(error);
	}

	boolean isOk();

	T value();

	StatementException error();

	default <R> Result<R> map(Function<T, R> mapper) {
		if (this instanceof Ok<T> ok) {
			return new Ok<>(mapper.apply(ok.value()));
		}
		return new Err<>(error());
	}

	default <R> Result<R> flatMap(Function<T, Result<R>> mapper) {
		if (this instanceof Ok<T> ok) {
			return mapper.apply(ok.value());
		}
		return new Err<>(error());
	}

	/**
	 * Returns the value or throws the carried exception.
	 */
	default T orElseThrow() {
		if (this instanceof Ok<T> ok) {
			return ok.value();
		}
		throw error();
	}

	record Ok<T>(T value) implements Result<T> {
		@Override
		public boolean isOk() {
			return true;
		}

		@Override
		public StatementException error() {
			return null;
		}
	}

	record Err<T>(StatementException error) implements Result<T> {
		@Override
		public boolean isOk() {
			return false;
		}

		@Override
		public T value() {
			return null;
		}
	}
}
