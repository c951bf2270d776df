package club.ppmc.testrunner.service.scheduler;

import static club.ppmc.testrunner.SampleItems.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.testrunner.exception.InvalidRequestException;
import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.RunRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunRequestQueueTest {

    private final RunRequestQueue queue = new RunRequestQueue();

    @Test
    void dequeuesInArrivalOrder() {
        RunRequest first = RunRequest.of(List.of(testCase("T1")), RunMode.RUN, null);
        RunRequest second = RunRequest.of(List.of(testCase("T2")), RunMode.DEBUG, null);
        queue.enqueue(first);
        queue.enqueue(second);

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.dequeueNext()).containsSame(first);
        assertThat(queue.dequeueNext()).containsSame(second);
        assertThat(queue.dequeueNext()).isEmpty();
    }

    @Test
    void rejectsRequestWithoutTargets() {
        assertThatThrownBy(() -> queue.enqueue(RunRequest.of(List.of(), RunMode.RUN, null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> queue.enqueue(null)).isInstanceOf(InvalidRequestException.class);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void drainRemovesEverythingInOrder() {
        RunRequest first = RunRequest.of(List.of(testCase("T1")), RunMode.RUN, null);
        RunRequest second = RunRequest.of(List.of(testCase("T2")), RunMode.RUN, null);
        queue.enqueue(first);
        queue.enqueue(second);

        assertThat(queue.drain()).containsExactly(first, second);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.drain()).isEmpty();
    }

    @Test
    void targetsAreCopiedWhenTheRequestIsCreated() {
        var targets = new java.util.ArrayList<>(List.of(testCase("T1")));
        RunRequest request = RunRequest.of(targets, RunMode.RUN, null);
        targets.add(testCase("T2"));

        assertThat(request.targets()).hasSize(1);
        assertThat(request.copyForRelaunch().targets()).isEqualTo(request.targets());
    }
}
