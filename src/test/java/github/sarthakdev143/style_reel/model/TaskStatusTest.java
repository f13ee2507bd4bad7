package github.sarthakdev143.style_reel.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStatusTest {

    @Test
    void happyPathTransitionsAreAllowed() {
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.GENERATING)).isTrue();
        assertThat(TaskStatus.GENERATING.canTransitionTo(TaskStatus.AWAITING_SELECTION)).isTrue();
        assertThat(TaskStatus.AWAITING_SELECTION.canTransitionTo(TaskStatus.COMPOSING)).isTrue();
        assertThat(TaskStatus.COMPOSING.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
    }

    @Test
    void composingCannotBeCancelled() {
        assertThat(TaskStatus.COMPOSING.canTransitionTo(TaskStatus.CANCELLED)).isFalse();
        assertThat(TaskStatus.COMPOSING.canTransitionTo(TaskStatus.FAILED)).isTrue();
    }

    @Test
    void skippingSelectionIsRejected() {
        assertThat(TaskStatus.GENERATING.canTransitionTo(TaskStatus.COMPOSING)).isFalse();
        assertThat(TaskStatus.QUEUED.canTransitionTo(TaskStatus.AWAITING_SELECTION)).isFalse();
    }

    @Test
    void terminalStatusesAreAbsorbing() {
        for (TaskStatus terminal : new TaskStatus[] {TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TaskStatus target : TaskStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isFalse();
            }
        }
        assertThat(TaskStatus.AWAITING_SELECTION.isTerminal()).isFalse();
    }
}
