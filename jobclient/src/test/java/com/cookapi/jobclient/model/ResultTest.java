package com.cookapi.jobclient.model;

import com.cookapi.jobclient.client.JobClientException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    void ok_exposesValueAndNoError() {
        Result<String> result = Result.ok("a");

        assertThat(result.status()).isEqualTo(Result.Status.OK);
        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).contains("a");
        assertThat(result.error()).isEmpty();
        assertThat(result.map(String::length).orElseThrow()).isEqualTo(1);
    }

    @Test
    void err_exposesReasonAndThrowsOnUnwrap() {
        Result<String> result = Result.err(ErrorKind.SCHEDULER, "UUID x didn't correspond to a job");

        assertThat(result.status()).isEqualTo(Result.Status.ERROR);
        assertThat(result.value()).isEmpty();
        assertThat(result.map(String::length).error()).contains("UUID x didn't correspond to a job");
        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(JobClientException.class)
                .hasMessage("UUID x didn't correspond to a job")
                .extracting(e -> ((JobClientException) e).getKind())
                .isEqualTo(ErrorKind.SCHEDULER);
    }

    @Test
    void err_blankReason_fallsBackToKindName() {
        assertThat(Result.err(ErrorKind.TRANSPORT, " ").error()).contains("TRANSPORT");
    }

    @Test
    void ok_nullPayload_isRejected() {
        assertThatThrownBy(() -> Result.ok(null)).isInstanceOf(NullPointerException.class);
    }
}
