package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.model.TestStatus;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

class RecordingResultSink implements TestResultSink {

    final List<RunSession> started = new CopyOnWriteArrayList<>();
    final List<RunSession> finished = new CopyOnWriteArrayList<>();
    final List<RunRequest> dropped = new CopyOnWriteArrayList<>();
    final Map<String, TestStatus> statuses = new ConcurrentHashMap<>();
    final List<TestResult> results = new CopyOnWriteArrayList<>();

    @Override
    public void sessionStarted(RunSession session) {
        started.add(session);
    }

    @Override
    public void accept(RunSession session, TestResult result) {
        results.add(result);
        statuses.put(result.testId(), result.status());
    }

    @Override
    public void sessionFinished(RunSession session) {
        finished.add(session);
    }

    @Override
    public void requestDropped(RunRequest request, String reason) {
        dropped.add(request);
    }
}
