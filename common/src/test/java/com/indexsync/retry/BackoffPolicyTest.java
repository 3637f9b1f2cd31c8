package com.indexsync.retry;

import com.indexsync.config.SyncConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    @Test
    @DisplayName("Delays grow by the factor without jitter")
    void exponentialGrowth() {
        BackoffPolicy policy = new BackoffPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, () -> 1.0);

        assertThat(policy.delay(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    @DisplayName("Every delay is capped at the maximum")
    void delaysNeverExceedMax() {
        BackoffPolicy policy = new BackoffPolicy(40, Duration.ofSeconds(5), Duration.ofHours(1), 2.0);

        for (int attempt = 0; attempt < 40; attempt++) {
            assertThat(policy.delay(attempt))
                    .isLessThanOrEqualTo(Duration.ofHours(1))
                    .isGreaterThanOrEqualTo(Duration.ZERO);
        }
    }

    @Test
    @DisplayName("Jitter stays within 80% and 120% of the nominal delay")
    void jitterBounds() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(1000), Duration.ofHours(1), 2.0);

        for (int i = 0; i < 200; i++) {
            assertThat(policy.delay(1).toMillis()).isBetween(1600L, 2400L);
        }
    }

    @Test
    @DisplayName("Built from the custom sync section")
    void fromConfig() {
        SyncConfig.CustomSection custom = new SyncConfig.CustomSection();
        custom.setMaxRetries(4);
        custom.setRetryDelayMs(250);
        custom.setMaxRetryDelayMs(2000);
        custom.setBackoffFactor(3.0);

        BackoffPolicy policy = BackoffPolicy.fromConfig(custom);

        assertThat(policy.getMaxAttempts()).isEqualTo(4);
        assertThat(policy.getBaseDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(policy.getMaxDelay()).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.getFactor()).isEqualTo(3.0);
    }
}
