package club.ppmc.testrunner.service;

import static club.ppmc.testrunner.SampleItems.caseIn;
import static club.ppmc.testrunner.SampleItems.suite;
import static club.ppmc.testrunner.SampleItems.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.testrunner.exception.EnvironmentConfigurationException;
import club.ppmc.testrunner.exception.InvalidRequestException;
import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.exception.UnknownTestItemException;
import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.SessionState;
import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.scheduler.SessionHandle;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TestRunServiceTest {

    private static final Path DEMO = Path.of("/workspace/demo/src/test/java/com/example/DemoTest.java");
    private static final Path HELPERS = Path.of("/workspace/demo/src/test/java/com/example/Helpers.java");

    @Mock
    private RunnerScheduler scheduler;

    @Mock
    private TestExplorerNotifier explorerNotifier;

    @Captor
    private ArgumentCaptor<RunRequest> requestCaptor;

    private final TestItemRegistry itemRegistry = new TestItemRegistry();
    private TestRunService service;

    @BeforeEach
    void setUp() {
        service = new TestRunService(itemRegistry, scheduler, explorerNotifier);
    }

    private static SessionHandle started(RunRequest request) {
        var session = new RunSession(request);
        session.markStarting();
        return new SessionHandle(session, new CompletableFuture<>());
    }

    private static SessionHandle failedToLaunch(RuntimeException cause) {
        var session = new RunSession(RunRequest.of(List.of(testCase("T1")), RunMode.RUN, null));
        session.markStarting();
        var failure = new LaunchFailedException("启动测试后端失败: " + cause.getMessage(), cause);
        session.finish(SessionState.FAILED, failure);
        var completion = new CompletableFuture<RunSession>();
        completion.completeExceptionally(failure);
        return new SessionHandle(session, completion);
    }

    @Test
    void runFileRunsTheSuitesOfThatFile() {
        itemRegistry.register(List.of(suite("DemoTest", DEMO), caseIn("first", DEMO), caseIn("helper", HELPERS)));
        when(scheduler.submit(any())).thenAnswer(invocation -> started(invocation.getArgument(0)));

        service.runFile(DEMO.toUri(), RunMode.DEBUG);

        verify(scheduler).submit(requestCaptor.capture());
        assertThat(requestCaptor.getValue().targets()).extracting(TestItem::id).containsExactly("DemoTest");
        assertThat(requestCaptor.getValue().mode()).isEqualTo(RunMode.DEBUG);
    }

    @Test
    void runFileWithoutSuitesRunsEveryItemOfTheFile() {
        itemRegistry.register(List.of(caseIn("first", DEMO), caseIn("second", DEMO)));
        when(scheduler.submit(any())).thenAnswer(invocation -> started(invocation.getArgument(0)));

        service.runFile(DEMO.toUri(), RunMode.RUN);

        verify(scheduler).submit(requestCaptor.capture());
        assertThat(requestCaptor.getValue().targets()).extracting(TestItem::id).containsExactly("first", "second");
    }

    @Test
    void runFileWithoutTestsIsRejected() {
        assertThatThrownBy(() -> service.runFile(HELPERS.toUri(), RunMode.RUN))
                .isInstanceOf(InvalidRequestException.class);
        verify(scheduler, never()).submit(any());
    }

    @Test
    void environmentErrorDuringSubmitIsThrownToTheCaller() {
        itemRegistry.register(List.of(caseIn("first", DEMO)));
        var missingRunner = new EnvironmentConfigurationException("未配置测试运行器的类路径", "runner");
        when(scheduler.submit(any())).thenReturn(failedToLaunch(missingRunner));

        assertThatThrownBy(() -> service.runOne("first", RunMode.RUN)).isSameAs(missingRunner);
    }

    @Test
    void launchFailureDuringRelaunchIsThrownToTheCaller() {
        when(scheduler.relaunch()).thenReturn(failedToLaunch(new IllegalStateException("端口被占用")));

        assertThatThrownBy(() -> service.relaunch())
                .isInstanceOf(LaunchFailedException.class)
                .hasMessageContaining("端口被占用");
    }

    @Test
    void sessionStillStartingIsReturned() {
        when(scheduler.submit(any())).thenAnswer(invocation -> started(invocation.getArgument(0)));
        itemRegistry.register(List.of(caseIn("first", DEMO)));

        SessionHandle handle = service.runSelection(List.of("first"), RunMode.RUN, null);

        assertThat(handle.session().getState()).isEqualTo(SessionState.STARTING);
    }

    @Test
    void refreshOfOneItemNamesThatItem() {
        TestItem first = caseIn("first", DEMO);
        itemRegistry.register(List.of(first));

        service.refreshExplorer("first");
        service.refreshExplorer(null);

        verify(explorerNotifier).refresh(eq(first), any());
        verify(explorerNotifier).refresh(any(String.class));
        assertThatThrownBy(() -> service.refreshExplorer("missing")).isInstanceOf(UnknownTestItemException.class);
    }
}
