package eti.domain.print;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PrintState
 */
class PrintStateTest {

    @Test
    @DisplayName("Should produce a new instance on every change")
    void shouldProduceNewInstance() {
        // Given
        PrintState started = PrintState.started(3);

        // When
        PrintState sending = started.withAttempt(1).withStep(EPrintStep.SENDING);

        // Then
        assertThat(sending).isNotSameAs(started);
        assertThat(started.getStep()).isEqualTo(EPrintStep.INITIALIZING);
        assertThat(sending.getProgress()).isEqualTo(0.6);
        assertThat(sending.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should keep last progress when failing or cancelling")
    void shouldKeepProgressOnTerminalFailure() {
        PrintState waiting = PrintState.started(3).withStep(EPrintStep.WAITING_FOR_COMPLETION).withProgress(0.9);

        PrintState failed = waiting.withStep(EPrintStep.FAILED);
        PrintState cancelled = waiting.withStep(EPrintStep.CANCELLED);

        assertThat(failed.getProgress()).isEqualTo(0.9);
        assertThat(failed.isRunning()).isFalse();
        assertThat(failed.isFailed()).isTrue();
        assertThat(cancelled.isCancelled()).isTrue();
        assertThat(cancelled.getProgress()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should never move progress backwards within a step")
    void shouldNotMoveProgressBackwards() {
        PrintState state = PrintState.started(1).withStep(EPrintStep.WAITING_FOR_COMPLETION).withProgress(0.5);

        assertThat(state.getProgress()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should keep its own copy of the issue list")
    void shouldCopyIssues() {
        PrintState state = PrintState.idle().withIssues(List.of("Head Open"));

        assertThat(state.getIssues()).containsExactly("Head Open");
        assertThat(state.isRunning()).isFalse();
    }
}
