package com.phillippitts.modelorchestrator.service.retry;

import com.phillippitts.modelorchestrator.config.properties.RetryProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = BackoffPolicy.from(new RetryProperties(1000, 8000));

    @Test
    void firstAttemptNeverWaits() {
        assertThat(policy.delayBeforeAttempt(0)).isZero();
    }

    @Test
    void doublesUntilCap() {
        assertThat(policy.delayBeforeAttempt(1)).isEqualTo(1000);
        assertThat(policy.delayBeforeAttempt(2)).isEqualTo(2000);
        assertThat(policy.delayBeforeAttempt(3)).isEqualTo(4000);
        assertThat(policy.delayBeforeAttempt(4)).isEqualTo(8000);
    }

    @Test
    void staysAtCapForLargeIndices() {
        assertThat(policy.delayBeforeAttempt(5)).isEqualTo(8000);
        assertThat(policy.delayBeforeAttempt(63)).isEqualTo(8000);
        assertThat(policy.delayBeforeAttempt(Integer.MAX_VALUE)).isEqualTo(8000);
    }

    @Test
    void rejectsCapBelowBase() {
        assertThatThrownBy(() -> new BackoffPolicy(1000, 500)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(0, 500)).isInstanceOf(IllegalArgumentException.class);
    }
}
