package fr.lapetina.inference.mesh.infrastructure.executor;

import fr.lapetina.inference.mesh.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        // 3 failures to open, 100ms recovery, 2 trial successes to close
        circuitBreaker = new CircuitBreaker("http://backend", 3, Duration.ofMillis(100), 2, clock);
    }

    private void openCircuit() {
        circuitBreaker.onFailure();
        circuitBreaker.onFailure();
        circuitBreaker.onFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.tryAcquire()).isTrue();
    }

    @Test
    @DisplayName("should open after threshold consecutive failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.onFailure();
        circuitBreaker.onFailure();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.onFailure();

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.onFailure();
        circuitBreaker.onFailure();
        assertThat(circuitBreaker.getConsecutiveFailures()).isEqualTo(2);

        circuitBreaker.onSuccess();

        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should stay OPEN before the recovery timeout")
    void shouldStayOpenBeforeRecoveryTimeout() {
        openCircuit();
        clock.advance(Duration.ofMillis(99));

        assertThat(circuitBreaker.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("should move to HALF_OPEN after the recovery timeout")
    void shouldTransitionToHalfOpenAfterTimeout() {
        openCircuit();
        clock.advance(Duration.ofMillis(100));

        assertThat(circuitBreaker.tryAcquire()).isTrue();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    }

    @Test
    @DisplayName("should close after enough trial successes")
    void shouldCloseAfterTrialSuccesses() {
        openCircuit();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.currentState();

        circuitBreaker.onSuccess();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        circuitBreaker.onSuccess();
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should reopen on a trial failure")
    void shouldReopenOnTrialFailure() {
        openCircuit();
        clock.advance(Duration.ofMillis(150));
        circuitBreaker.currentState();

        circuitBreaker.onFailure();

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("should reject thresholds below one")
    void shouldRejectInvalidThresholds() {
        assertThatThrownBy(() -> new CircuitBreaker("b", 0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
