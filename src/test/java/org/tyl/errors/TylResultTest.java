package org.tyl.errors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TylResultTest {

    @Test
    void ok_holdsValue() {
        TylResult<String> result = TylResult.ok("hello");

        assertThat(result.isOk()).isTrue();
        assertThat(result.isErr()).isFalse();
        assertThat(result.getOrThrow()).isEqualTo("hello");
        assertThat(result.error()).isEmpty();
    }

    @Test
    void err_holdsError() {
        TylError error = TylError.notFound("user", "42");
        TylResult<String> result = TylResult.err(error);

        assertThat(result.isErr()).isTrue();
        assertThat(result.error()).hasValue(error);
        assertThat(result.getOrElse("fallback")).isEqualTo("fallback");
        assertThat(result.getOrElseGet(() -> "computed")).isEqualTo("computed");
    }

    @Test
    void err_rejectsNullError() {
        assertThatThrownBy(() -> TylResult.err(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("cause must not be null");
    }

    @Test
    void getOrThrow_onErr_throwsTylExceptionCarryingError() {
        TylError error = TylError.database("connection lost");
        TylResult<String> result = TylResult.err(error);

        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(TylException.class)
                .hasMessage("Database error: connection lost")
                .satisfies(e -> assertThat(((TylException) e).error()).isEqualTo(error));
    }

    @Test
    void map_transformsOkOnly() {
        assertThat(TylResult.ok(2).map(x -> x * 21).getOrThrow()).isEqualTo(42);

        TylResult<Integer> failed = TylResult.<Integer>err(TylError.internal("x")).map(x -> x * 21);
        assertThat(failed.isErr()).isTrue();
    }

    @Test
    void flatMap_chainsFailures() {
        TylResult<Integer> result = TylResult.ok("abc")
                .flatMap(s -> TylResult.<Integer>err(TylError.parsing("not a number: " + s)));

        assertThat(result.error()).hasValue(TylError.parsing("not a number: abc"));
    }

    @Test
    void mapErr_rewritesError() {
        TylResult<String> result = TylResult.<String>err(TylError.network("reset"))
                .mapErr(e -> TylError.internal("wrapped " + e));

        assertThat(result.error()).hasValue(TylError.internal("wrapped Network error: reset"));
    }

    @Test
    void recover_turnsErrIntoOk() {
        TylResult<String> result = TylResult.<String>err(TylError.conflict("dup"))
                .recover(TylError::toString);

        assertThat(result.getOrThrow()).isEqualTo("Conflict: dup");
        assertThat(TylResult.ok("kept").recover(e -> "other").getOrThrow()).isEqualTo("kept");
    }
}
