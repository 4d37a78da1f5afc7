package com.sessionretry.core.policy;

import com.sessionretry.config.SessionRetryProperties;
import com.sessionretry.core.backoff.BackoffRegistry;
import com.sessionretry.exception.BackendException;
import com.sessionretry.core.failure.ErrorClassifier;
import com.sessionretry.model.Classification;
import com.sessionretry.model.RetryDecision;
import com.sessionretry.model.enums.StatusCode;
import com.sessionretry.model.enums.StopReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    private BackoffRegistry backoff;

    private Classification retryable;

    @BeforeEach
    void setUp() {
        SessionRetryProperties props = new SessionRetryProperties();
        props.getBackoff().setBase(Duration.ofMillis(100));
        props.getBackoff().setMax(Duration.ofMillis(400));
        backoff = new BackoffRegistry(props);
        retryable = classifier.classify(new BackendException(StatusCode.UNAVAILABLE, "down"));
    }

    @Test
    @DisplayName("retryable error within limits yields a bounded backoff")
    void proceeds() {
        RetryPolicy policy = new RetryPolicy(3, null, backoff);

        RetryDecision d = policy.shouldContinue(retryable, false, 1, Duration.ZERO, false);

        assertThat(d.isProceed()).isTrue();
        assertThat(d.getBackoff()).isBetween(Duration.ofMillis(50), Duration.ofMillis(100));
    }

    @Test
    @DisplayName("cancellation wins over everything else")
    void cancelled() {
        RetryPolicy policy = new RetryPolicy(3, null, backoff);

        RetryDecision d = policy.shouldContinue(retryable, true, 1, Duration.ZERO, true);

        assertThat(d.isProceed()).isFalse();
        assertThat(d.getStopReason()).isEqualTo(StopReason.CANCELLED);
    }

    @Test
    @DisplayName("non-retryable classification stops immediately")
    void notRetryable() {
        RetryPolicy policy = new RetryPolicy(3, null, backoff);
        Classification timeout = classifier.classify(new BackendException(StatusCode.TIMEOUT, "slow"));

        assertThat(policy.shouldContinue(timeout, false, 1, Duration.ZERO, false).getStopReason())
                .isEqualTo(StopReason.NOT_RETRYABLE);
        assertThat(policy.shouldContinue(timeout, true, 1, Duration.ZERO, false).isProceed()).isTrue();
    }

    @Test
    @DisplayName("attempt limit includes the first attempt")
    void maxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, null, backoff);

        assertThat(policy.shouldContinue(retryable, true, 2, Duration.ZERO, false).isProceed()).isTrue();
        assertThat(policy.shouldContinue(retryable, true, 3, Duration.ZERO, false).getStopReason())
                .isEqualTo(StopReason.MAX_ATTEMPTS);
    }

    @Test
    @DisplayName("stops when the next backoff would exceed the time budget")
    void timeBudget() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), backoff);

        assertThat(policy.shouldContinue(retryable, true, 1, Duration.ofMillis(100), false).isProceed()).isTrue();
        assertThat(policy.shouldContinue(retryable, true, 1, Duration.ofMillis(990), false).getStopReason())
                .isEqualTo(StopReason.TIME_BUDGET);
    }

    @Test
    @DisplayName("rejects invalid limits")
    void validation() {
        assertThatThrownBy(() -> new RetryPolicy(0, null, backoff)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(-1), backoff))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
