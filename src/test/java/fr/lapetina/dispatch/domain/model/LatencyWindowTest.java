package fr.lapetina.dispatch.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatencyWindowTest {

    @Test
    @DisplayName("should report a zero mean when empty")
    void shouldHaveZeroMeanWhenEmpty() {
        assertThat(LatencyWindow.empty().mean()).isZero();
        assertThat(LatencyWindow.empty().size()).isZero();
    }

    @Test
    @DisplayName("should not mutate the window it was appended to")
    void shouldBeImmutable() {
        LatencyWindow first = LatencyWindow.empty().append(10, 3);
        LatencyWindow second = first.append(20, 3);

        assertThat(first.samples()).containsExactly(10);
        assertThat(second.samples()).containsExactly(10, 20);
    }

    @Test
    @DisplayName("should evict oldest samples first")
    void shouldEvictOldest() {
        LatencyWindow window = LatencyWindow.empty();
        for (int i = 1; i <= 5; i++) {
            window = window.append(i * 10L, 3);
        }

        assertThat(window.samples()).containsExactly(30, 40, 50);
        assertThat(window.mean()).isEqualTo(40.0);
    }

    @Test
    @DisplayName("should shrink to a smaller maximum size")
    void shouldShrink() {
        LatencyWindow window = LatencyWindow.empty().append(1, 5).append(2, 5).append(3, 5);

        assertThat(window.append(4, 2).samples()).containsExactly(3, 4);
    }

    @Test
    @DisplayName("should clamp negative latencies to zero")
    void shouldClampNegative() {
        assertThat(LatencyWindow.empty().append(-5, 2).samples()).containsExactly(0);
    }

    @Test
    @DisplayName("should reject a non-positive size")
    void shouldRejectBadSize() {
        assertThatThrownBy(() -> LatencyWindow.empty().append(1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
