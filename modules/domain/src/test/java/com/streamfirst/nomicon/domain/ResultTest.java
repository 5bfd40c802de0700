package com.streamfirst.nomicon.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultTest {

    @Test
    void failureKeepsExceptionMessageAndCode() {
        Result<String> result = Result.failure(new UnsupportedCloudException("gcp"));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getErrorMessage()).contains("unsupported cloud \"gcp\"");
        assertThat(result.getErrorCode()).contains("UNSUPPORTED_CLOUD");
        assertThat(result.getData()).isEmpty();
        assertThatThrownBy(result::orElseThrow)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("UNSUPPORTED_CLOUD");
    }

    @Test
    void mapPreservesFailure() {
        Result<Integer> mapped = Result.<String>failure("boom", "X").map(String::length);
        assertThat(mapped.getErrorMessage()).contains("boom");
        assertThat(Result.success("abc").map(String::length).orElseThrow()).isEqualTo(3);
    }

    @Test
    void constraintViolationCarriesDetails() {
        ConstraintViolationException e = new ConstraintViolationException(
            "s3", "ab", ConstraintViolationException.Rule.MIN_LENGTH, "is shorter than 3 characters");

        assertThat(e.getMessage()).isEqualTo("resource \"s3\" name \"ab\" is shorter than 3 characters");
        assertThat(e.getResourceKey()).isEqualTo("s3");
        assertThat(e.getCandidateName()).isEqualTo("ab");
        assertThat(e.getRule()).isEqualTo(ConstraintViolationException.Rule.MIN_LENGTH);
        assertThat(e.errorCode()).isEqualTo("CONSTRAINT_VIOLATION");
    }
}
