/**
 * TestResultManager.java
 *
 * 测试结果的接收端。调度器按后端产生的顺序把结果交给它；
 * 它保存每个测试项的最新结果，推送到前端，并为"打开报告"命令提供数据。
 * 会话开始和结束时向状态栏推送会话状态。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.SessionState;
import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.model.dto.SessionStatusEvent;
import club.ppmc.testrunner.service.scheduler.TestResultSink;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestResultManager implements TestResultSink {

    private final WebSocketNotificationService notificationService;
    private final Map<String, TestResult> latestResults = new ConcurrentHashMap<>();

    public TestResultManager(WebSocketNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public void sessionStarted(RunSession session) {
        notificationService.sendSessionStatus(SessionStatusEvent.of(session, null));
    }

    @Override
    public void accept(RunSession session, TestResult result) {
        latestResults.put(result.testId(), result);
        notificationService.sendTestResult(result);
    }

    @Override
    public void sessionFinished(RunSession session) {
        String message = session.getFailure() != null ? session.getFailure().getMessage() : null;
        if (session.getState() == SessionState.CANCELLED && !session.isCleanupConfirmed()) {
            message = "会话已取消，但后端进程的退出未得到确认。";
        }
        notificationService.sendSessionStatus(SessionStatusEvent.of(session, message));
    }

    @Override
    public void requestDropped(RunRequest request, String reason) {
        notificationService.sendSessionStatus(new SessionStatusEvent(
                null, SessionState.CANCELLED, request.mode(), request.targets().size(), reason));
    }

    public Optional<TestResult> getResult(String testId) {
        return Optional.ofNullable(latestResults.get(testId));
    }

    /**
     * 报告数据：按请求的顺序返回已有结果的测试项，没有结果的 id 被跳过。
     */
    public Map<String, TestResult> getResults(Collection<String> testIds) {
        var report = new LinkedHashMap<String, TestResult>();
        for (String id : testIds) {
            TestResult result = latestResults.get(id);
            if (result != null) {
                report.put(id, result);
            }
        }
        return report;
    }

    public Map<String, TestResult> getAllResults() {
        return Map.copyOf(latestResults);
    }

    public void removeResults(Collection<String> testIds) {
        testIds.forEach(latestResults::remove);
        log.debug("已移除 {} 个测试项的结果。", testIds.size());
    }
}
