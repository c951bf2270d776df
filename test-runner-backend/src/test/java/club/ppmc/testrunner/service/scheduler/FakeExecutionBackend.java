package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.TestResult;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 不派生进程的执行后端。每次 launch 产生一个 FakeHandle，由测试决定何时报告结果和退出。
 */
class FakeExecutionBackend implements TestExecutionBackend {

    final List<FakeHandle> handles = new CopyOnWriteArrayList<>();
    final AtomicInteger launchCount = new AtomicInteger();
    volatile RuntimeException launchFailure;
    volatile RuntimeException validationFailure;
    volatile boolean ignoreTerminate;
    /** 不为 null 时 launch 停在启动阶段（模拟运行前构建），直到闸门打开或会话被请求终止。 */
    volatile CountDownLatch launchGate;
    final CountDownLatch launchEntered = new CountDownLatch(1);

    @Override
    public void validate(RunRequest request) {
        if (validationFailure != null) {
            throw validationFailure;
        }
    }

    @Override
    public ExecutionHandle launch(RunSession session, Consumer<TestResult> results) {
        launchCount.incrementAndGet();
        if (launchFailure != null) {
            throw launchFailure;
        }
        CountDownLatch gate = launchGate;
        if (gate != null) {
            session.onTerminationRequested(gate::countDown);
            launchEntered.countDown();
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (session.isTerminationRequested()) {
                throw new LaunchCancelledException(session.getId(), "构建");
            }
        }
        var handle = new FakeHandle(session, results, ignoreTerminate);
        handles.add(handle);
        return handle;
    }

    FakeHandle last() {
        return handles.get(handles.size() - 1);
    }

    static LaunchFailedException launchFailed(String message) {
        return new LaunchFailedException(message, new java.io.IOException("java: not found"));
    }

    static final class FakeHandle implements ExecutionHandle {

        final RunSession session;
        final Consumer<TestResult> results;
        final boolean ignoreTerminate;
        final CompletableFuture<BackendExit> completion = new CompletableFuture<>();
        final AtomicBoolean terminated = new AtomicBoolean();
        final AtomicInteger releaseCount = new AtomicInteger();

        FakeHandle(RunSession session, Consumer<TestResult> results, boolean ignoreTerminate) {
            this.session = session;
            this.results = results;
            this.ignoreTerminate = ignoreTerminate;
        }

        void report(TestResult result) {
            results.accept(result);
        }

        void exit(int exitCode, boolean runFinished) {
            completion.complete(new BackendExit(exitCode, runFinished));
        }

        @Override
        public CompletableFuture<BackendExit> completion() {
            return completion;
        }

        @Override
        public void terminate() {
            terminated.set(true);
            if (!ignoreTerminate) {
                exit(137, false);
            }
        }

        @Override
        public void release() {
            releaseCount.incrementAndGet();
        }
    }
}
