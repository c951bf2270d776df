package club.ppmc.testrunner.controller;

import static club.ppmc.testrunner.SampleItems.testCase;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.testrunner.exception.CancelTimeoutException;
import club.ppmc.testrunner.exception.EnvironmentConfigurationException;
import club.ppmc.testrunner.exception.InvalidRequestException;
import club.ppmc.testrunner.exception.NoPriorRequestException;
import club.ppmc.testrunner.exception.SchedulerBusyException;
import club.ppmc.testrunner.exception.UnknownTestItemException;
import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.SchedulerState;
import club.ppmc.testrunner.service.TestItemRegistry;
import club.ppmc.testrunner.service.TestRunService;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.scheduler.SessionHandle;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TestRunController.class)
class TestRunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TestRunService testRunService;

    @MockBean
    private TestItemRegistry itemRegistry;

    @MockBean
    private RunnerScheduler scheduler;

    private static SessionHandle handle(String sessionId) {
        var session = new RunSession(sessionId, RunRequest.of(List.of(testCase("T1")), RunMode.RUN, null));
        session.markStarting();
        session.markRunning();
        return new SessionHandle(session, new CompletableFuture<>());
    }

    @Test
    void runOneReturnsAcceptedWithSessionId() throws Exception {
        when(testRunService.runOne("T1", RunMode.RUN)).thenReturn(handle("s-1"));

        mockMvc.perform(post("/api/tests/run/T1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.targets").value(1));
    }

    @Test
    void debugSelectionPassesIdsAndMode() throws Exception {
        when(testRunService.runSelection(eq(List.of("T1", "T2")), eq(RunMode.DEBUG), any())).thenReturn(handle("s-2"));

        mockMvc.perform(post("/api/tests/debug")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"testIds\":[\"T1\",\"T2\"],\"launchConfiguration\":{\"vmArgs\":[\"-Xmx256m\"]}}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-2"));
    }

    @Test
    void busySchedulerMapsToConflict() throws Exception {
        when(testRunService.runAll(RunMode.RUN)).thenThrow(new SchedulerBusyException("s-1"));

        mockMvc.perform(post("/api/tests/run-all"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("BUSY"))
                .andExpect(jsonPath("$.activeSessionId").value("s-1"));
    }

    @Test
    void relaunchWithoutHistoryMapsToConflict() throws Exception {
        when(testRunService.relaunch()).thenThrow(new NoPriorRequestException());

        mockMvc.perform(post("/api/tests/relaunch"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("NO_PRIOR_REQUEST"));
    }

    @Test
    void unknownTestItemMapsToNotFound() throws Exception {
        when(testRunService.runOne("missing", RunMode.DEBUG)).thenThrow(new UnknownTestItemException("missing"));

        mockMvc.perform(post("/api/tests/debug/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("UNKNOWN_TEST_ITEM"));
    }

    @Test
    void emptySelectionMapsToBadRequest() throws Exception {
        when(testRunService.runSelection(anyList(), eq(RunMode.RUN), any()))
                .thenThrow(new InvalidRequestException("运行请求至少需要包含一个测试项。"));

        mockMvc.perform(post("/api/tests/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"testIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
    }

    @Test
    void unconfirmedCancelMapsToServerError() throws Exception {
        doThrow(new CancelTimeoutException("s-1", 5000)).when(testRunService).cancel();

        mockMvc.perform(post("/api/tests/cancel"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("CANCEL_TIMEOUT"))
                .andExpect(jsonPath("$.timeoutMillis").value(5000));
    }

    @Test
    void invalidItemsAreRejected() throws Exception {
        mockMvc.perform(put("/api/tests/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"id\":\"\",\"kind\":\"CASE\",\"projectName\":\"demo\","
                                + "\"fullName\":\"com.example.DemoTest#t\",\"uri\":\"file:///w/DemoTest.java\"}]}"))
                .andExpect(status().isBadRequest());

        verify(itemRegistry, never()).register(anyList());
    }

    @Test
    void runFilePassesTheDocumentUri() throws Exception {
        URI uri = URI.create("file:///workspace/demo/src/test/java/com/example/DemoTest.java");
        when(testRunService.runFile(uri, RunMode.RUN)).thenReturn(handle("s-3"));

        mockMvc.perform(post("/api/tests/run-file").param("uri", uri.toString()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("s-3"));
    }

    @Test
    void fileWithoutTestsMapsToBadRequest() throws Exception {
        when(testRunService.runFile(any(), eq(RunMode.DEBUG)))
                .thenThrow(new InvalidRequestException("文件中没有已登记的测试。"));

        mockMvc.perform(post("/api/tests/debug-file").param("uri", "file:///workspace/demo/README.md"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_REQUEST"));
    }

    @Test
    void missingRunnerMapsToServerError() throws Exception {
        when(testRunService.runAll(RunMode.RUN))
                .thenThrow(new EnvironmentConfigurationException("未配置测试运行器的类路径", "runner"));

        mockMvc.perform(post("/api/tests/run-all"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("ENVIRONMENT_ERROR"));
    }

    @Test
    void refreshWithoutIdRefreshesEverything() throws Exception {
        mockMvc.perform(post("/api/tests/refresh")).andExpect(status().isOk());

        verify(testRunService).refreshExplorer(null);
    }

    @Test
    void refreshOfUnknownItemMapsToNotFound() throws Exception {
        doThrow(new UnknownTestItemException("missing")).when(testRunService).refreshExplorer("missing");

        mockMvc.perform(post("/api/tests/refresh/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("UNKNOWN_TEST_ITEM"));
    }

    @Test
    void sessionReportsSchedulerState() throws Exception {
        when(scheduler.getState()).thenReturn(SchedulerState.IDLE);
        when(scheduler.getCurrentSession()).thenReturn(Optional.empty());
        when(scheduler.getLastCompletedRequest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tests/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.canRelaunch").value(false));
    }
}
