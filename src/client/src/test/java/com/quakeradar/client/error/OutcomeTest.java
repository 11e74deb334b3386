package com.quakeradar.client.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OutcomeTest {

  @Test
  void mapAndFlatMapShortCircuitOnFailure() {
    Outcome<Integer> failed = Outcome.failure(ErrorKind.TIME_RANGE, "start after end");

    Outcome<String> mapped = failed.map(value -> "never").flatMap(value -> Outcome.success("never"));

    assertThat(mapped.isSuccess()).isFalse();
    assertThat(mapped.error().kind()).isEqualTo(ErrorKind.TIME_RANGE);
  }

  @Test
  void flatMapChainsSuccesses() {
    Outcome<Integer> result = Outcome.success(2).map(value -> value * 3).flatMap(value -> Outcome.success(value + 1));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isEqualTo(7);
  }

  @Test
  void orElseThrowCarriesTheError() {
    Outcome<String> failed = Outcome.failure(QueryError.httpStatus(503));

    assertThatThrownBy(failed::orElseThrow)
        .isInstanceOf(QueryFailedException.class)
        .hasMessageContaining("TRANSPORT")
        .satisfies(ex -> assertThat(((QueryFailedException) ex).getError().httpStatus()).isEqualTo(503));
  }

  @Test
  void accessingTheWrongSideFails() {
    assertThatThrownBy(() -> Outcome.success("ok").error()).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> Outcome.failure(ErrorKind.DECODE, "bad").value()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void validationKindsAreFlagged() {
    assertThat(ErrorKind.MAGNITUDE_RANGE.isValidation()).isTrue();
    assertThat(ErrorKind.UNKNOWN_COUNTRY.isValidation()).isTrue();
    assertThat(ErrorKind.TIMEOUT.isValidation()).isFalse();
    assertThat(ErrorKind.DECODE.isValidation()).isFalse();
  }
}
