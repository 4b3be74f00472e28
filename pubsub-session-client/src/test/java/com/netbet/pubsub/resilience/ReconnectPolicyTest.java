package com.netbet.pubsub.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectPolicyTest {

    @Test
    void delayGrowsByHalfUntilCapped() {
        ReconnectPolicy policy = new ReconnectPolicy(1000, 3000);

        assertThat(policy.nextDelayMs()).isEqualTo(1000);
        assertThat(policy.nextDelayMs()).isEqualTo(1500);
        assertThat(policy.nextDelayMs()).isEqualTo(2250);
        assertThat(policy.nextDelayMs()).isEqualTo(3000);
        assertThat(policy.nextDelayMs()).isEqualTo(3000);
    }

    @Test
    void resetReturnsToInitialDelay() {
        ReconnectPolicy policy = new ReconnectPolicy(100, 10_000);
        policy.nextDelayMs();
        policy.nextDelayMs();
        assertThat(policy.currentDelayMs()).isEqualTo(225);

        policy.reset();

        assertThat(policy.currentDelayMs()).isEqualTo(100);
        assertThat(policy.nextDelayMs()).isEqualTo(100);
    }

    @Test
    void maximumBelowInitialIsRaisedToInitial() {
        ReconnectPolicy policy = new ReconnectPolicy(500, 100);

        assertThat(policy.nextDelayMs()).isEqualTo(500);
        assertThat(policy.nextDelayMs()).isEqualTo(500);
    }
}
