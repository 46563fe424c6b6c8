package com.resumeparse.llm.orchestrator;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LinearBackoffPolicyTest {

    @Test
    void defaultsGrowLinearlyPerKind() {
        LinearBackoffPolicy policy = LinearBackoffPolicy.defaults();

        assertThat(policy.delayFor(FailureKind.RATE_LIMITED, 1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(FailureKind.RATE_LIMITED, 2)).isEqualTo(Duration.ofSeconds(15));
        assertThat(policy.delayFor(FailureKind.TIMEOUT, 1)).isEqualTo(Duration.ofSeconds(3));
        assertThat(policy.delayFor(FailureKind.UNKNOWN, 1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(FailureKind.NETWORK, 3)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void unmappedKindsUseDefaultRule() {
        BackoffRule fallback = new BackoffRule(Duration.ofMillis(10), Duration.ofMillis(5));
        LinearBackoffPolicy policy = new LinearBackoffPolicy(Map.of(), fallback);

        assertThat(policy.delayFor(FailureKind.RATE_LIMITED, 2)).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.delayFor(null, 0)).isEqualTo(Duration.ofMillis(10));
    }
}
