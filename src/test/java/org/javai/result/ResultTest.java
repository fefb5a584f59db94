package org.javai.result;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    @Test
    void success_withoutValue_holdsNull() {
        Result<Void, String> result = Result.success();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result).isInstanceOf(Result.Success.class);
        assertThat(result.value()).isNull();
    }

    @Test
    void success_containsValue() {
        Result<String, String> result = Result.success("hello");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo("hello");
    }

    @Test
    void success_nullValueIsAllowed() {
        Result<String, String> result = Result.success(null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isNull();
    }

    @Test
    void success_error_throwsInvalidResultAccess() {
        Result<String, String> result = Result.success("hello");

        assertThatThrownBy(result::error)
                .isInstanceOf(InvalidResultAccessException.class)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Result is successful");
    }

    @Test
    void failure_containsError() {
        Result<String, String> result = Result.failure("boom");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isFailure()).isTrue();
        assertThat(result).isInstanceOf(Result.Failure.class);
        assertThat(result.error()).isEqualTo("boom");
    }

    @Test
    void failure_value_throwsInvalidResultAccess() {
        Result<String, String> result = Result.failure("boom");

        assertThatThrownBy(result::value)
                .isInstanceOf(InvalidResultAccessException.class)
                .hasMessage("Result is not successful")
                .satisfies(e -> assertThat(((InvalidResultAccessException) e).result()).isSameAs(result));
    }

    @Test
    void failure_nullErrorIsRejected() {
        assertThatThrownBy(() -> Result.failure(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("error must not be null");
    }

    @Test
    void getOrElse_returnsValueOrDefault() {
        assertThat(Result.<String, String>success("hello").getOrElse("default")).isEqualTo("hello");
        assertThat(Result.<String, String>failure("boom").getOrElse("default")).isEqualTo("default");
    }

    @Test
    void getOrElseGet_onlyInvokesSupplierForFailure() {
        List<String> calls = new ArrayList<>();

        String fromSuccess = Result.<String, String>success("hello").getOrElseGet(() -> {
            calls.add("supplier");
            return "default";
        });
        String fromFailure = Result.<String, String>failure("boom").getOrElseGet(() -> {
            calls.add("supplier");
            return "default";
        });

        assertThat(fromSuccess).isEqualTo("hello");
        assertThat(fromFailure).isEqualTo("default");
        assertThat(calls).containsExactly("supplier");
    }

    @Test
    void patternMatching_exhaustiveOverSealedVariants() {
        Result<Integer, String> result = Result.success(42);

        String description;
        if (result instanceof Result.Success<Integer, String> success) {
            description = "value " + success.value();
        } else if (result instanceof Result.Failure<Integer, String> failure) {
            description = "error " + failure.error();
        } else {
            throw new AssertionError("unreachable");
        }

        assertThat(description).isEqualTo("value 42");
    }

    @Test
    void equality_isStructural() {
        assertThat(Result.<String, String>success("a")).isEqualTo(Result.<String, String>success("a"));
        assertThat(Result.<String, String>failure("x")).isEqualTo(Result.<String, String>failure("x"));
        assertThat(Result.<String, String>success("a")).isNotEqualTo(Result.<String, String>failure("a"));
    }

    // map

    @Test
    void map_success_transformsValue() {
        Result<Integer, String> result = Result.<Integer, String>success(5).map(x -> x * 2);

        assertThat(result.value()).isEqualTo(10);
    }

    @Test
    void map_failure_returnsSameInstanceWithoutInvokingMapper() {
        Result<Integer, String> failure = Result.failure("boom");
        List<Integer> seen = new ArrayList<>();

        Result<String, String> mapped = failure.map(x -> {
            seen.add(x);
            return "never";
        });

        assertThat(seen).isEmpty();
        assertThat((Object) mapped).isSameAs(failure);
        assertThat(mapped.error()).isEqualTo("boom");
    }

    @Test
    void map_canChangeType() {
        Result<String, String> result = Result.<Integer, String>success(42).map(String::valueOf);

        assertThat(result.value()).isEqualTo("42");
    }

    @Test
    void map_nullMapper_isRejected() {
        Result<Integer, String> result = Result.success(1);

        assertThatThrownBy(() -> result.map(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("mapper must not be null");
    }

    @Test
    void map_exceptionFromMapper_propagates() {
        Result<Integer, String> result = Result.success(1);

        assertThatThrownBy(() -> result.map(x -> {
            throw new IllegalStateException("mapper failed");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("mapper failed");
    }

    // bind

    @Test
    void bind_success_chainsToNextResult() {
        Result<String, String> result = Result.<Integer, String>success(5)
                .map(x -> x * 2)
                .bind(x -> x > 5 ? Result.<String, String>success(x.toString()) : Result.<String, String>failure("too small"));

        assertThat(result.value()).isEqualTo("10");
    }

    @Test
    void bind_success_canProduceFailure() {
        Result<String, String> result = Result.<Integer, String>success(3)
                .bind(x -> x > 5 ? Result.<String, String>success(x.toString()) : Result.<String, String>failure("too small"));

        assertThat(result.error()).isEqualTo("too small");
    }

    @Test
    void bind_failure_shortCircuits() {
        Result<Integer, String> failure = Result.failure("first");
        List<Integer> seen = new ArrayList<>();

        Result<Integer, String> result = failure
                .bind(x -> {
                    seen.add(x);
                    return Result.success(x + 1);
                })
                .bind(x -> {
                    seen.add(x);
                    return Result.failure("second");
                });

        assertThat(seen).isEmpty();
        assertThat(result).isSameAs(failure);
    }

    @Test
    void bind_continuationReturningNull_isRejected() {
        Result<Integer, String> result = Result.success(1);

        assertThatThrownBy(() -> result.bind(x -> null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("must not return null");
    }

    // mapError

    @Test
    void mapError_failure_transformsError() {
        Result<Integer, Integer> result = Result.<Integer, String>failure("boom").mapError(String::length);

        assertThat(result.error()).isEqualTo(4);
    }

    @Test
    void mapError_success_returnsSameInstanceWithoutInvokingMapper() {
        Result<Integer, String> success = Result.success(7);
        List<String> seen = new ArrayList<>();

        Result<Integer, Integer> mapped = success.mapError(e -> {
            seen.add(e);
            return e.length();
        });

        assertThat(seen).isEmpty();
        assertThat((Object) mapped).isSameAs(success);
        assertThat(mapped.value()).isEqualTo(7);
    }

    // match

    @Test
    void match_invokesExactlyOneBranch() {
        List<String> calls = new ArrayList<>();

        String fromSuccess = Result.<Integer, String>success(3).match(
                v -> {
                    calls.add("success");
                    return "v" + v;
                },
                e -> {
                    calls.add("failure");
                    return "e" + e;
                });
        String fromFailure = Result.<Integer, String>failure("x").match(
                v -> {
                    calls.add("success");
                    return "v" + v;
                },
                e -> {
                    calls.add("failure");
                    return "e" + e;
                });

        assertThat(fromSuccess).isEqualTo("v3");
        assertThat(fromFailure).isEqualTo("ex");
        assertThat(calls).containsExactly("success", "failure");
    }

    // ensure

    @Test
    void ensure_predicateHolds_keepsSuccess() {
        Result<String, String> data = Result.success("payload");

        assertThat(data.ensure(s -> !s.isEmpty(), "No data returned")).isSameAs(data);
    }

    @Test
    void ensure_predicateFails_becomesFailure() {
        Result<String, String> result = Result.<String, String>success("")
                .ensure(s -> !s.isEmpty(), "No data returned");

        assertThat(result.error()).isEqualTo("No data returned");
    }

    @Test
    void ensure_failure_isUnchangedAndPredicateNotInvoked() {
        Result<String, String> failure = Result.failure("earlier");
        List<String> seen = new ArrayList<>();

        Result<String, String> result = failure.ensure(s -> seen.add(s), "No data returned");

        assertThat(seen).isEmpty();
        assertThat(result).isSameAs(failure);
    }

    // recover

    @Test
    void recover_failure_becomesSuccess() {
        Result<Integer, String> result = Result.<Integer, String>failure("boom").recover(String::length);

        assertThat(result.value()).isEqualTo(4);
    }

    @Test
    void recover_success_isUnchanged() {
        Result<Integer, String> success = Result.success(1);

        assertThat(success.recover(e -> 0)).isSameAs(success);
    }
}
