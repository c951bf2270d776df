/**
 * RunnerScheduler.java
 *
 * 测试运行/调试的调度中心。它把请求变成执行中的会话，跟踪当前会话，提供取消和重新运行，
 * 并在关闭时驱动清理。任何时刻最多只有一个非终态的会话。
 *
 * 状态机: IDLE → BUSY(session) → IDLE，以及只能通过 cleanUp(false) 到达的终态 SHUTTING_DOWN。
 * 忙闲判断和状态切换都在同一把锁内同步完成，任何阻塞操作（派生进程、附加调试器、等待退出）
 * 都在锁外进行，因此两个请求不可能同时观察到 IDLE。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.exception.BackendCrashedException;
import club.ppmc.testrunner.exception.CancelTimeoutException;
import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.exception.NoPriorRequestException;
import club.ppmc.testrunner.exception.SchedulerBusyException;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.SchedulerState;
import club.ppmc.testrunner.model.SessionState;
import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.service.SettingsService;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RunnerScheduler {

    private final TestExecutionBackend backend;
    private final TestResultSink resultSink;
    private final RunRequestQueue requestQueue;
    private final SettingsService settingsService;
    private final Executor launchExecutor;
    private final ExecutorService dispatchExecutor =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("test-dispatch-"));

    private final Object lock = new Object();

    // 以下字段只在 lock 内读写
    private SchedulerState state = SchedulerState.IDLE;
    private RunSession currentSession;
    private ExecutionHandle currentHandle;
    private CompletableFuture<RunSession> currentCompletion;
    private RunRequest lastCompletedRequest;

    public RunnerScheduler(
            TestExecutionBackend backend,
            TestResultSink resultSink,
            RunRequestQueue requestQueue,
            SettingsService settingsService,
            @Qualifier("testLaunchExecutor") Executor launchExecutor) {
        this.backend = backend;
        this.resultSink = resultSink;
        this.requestQueue = requestQueue;
        this.settingsService = settingsService;
        this.launchExecutor = launchExecutor;
    }

    /**
     * 进入 IDLE，并丢弃上一次激活遗留的会话引用。
     */
    public void initialize() {
        synchronized (lock) {
            if (currentSession != null) {
                log.warn("丢弃上一次激活遗留的测试会话 {}", currentSession.getId());
            }
            currentSession = null;
            currentHandle = null;
            currentCompletion = null;
            state = SchedulerState.IDLE;
        }
        log.info("测试调度器已初始化。");
    }

    /**
     * 立即启动一个会话。会话在调用线程上占位并校验启动条件，之后的构建、派生进程和附加调试器在启动线程池中进行，
     * 返回时会话通常仍处于 STARTING。启动条件不满足时返回的 completion 已经以 LaunchFailedException 异常完成。
     *
     * @throws club.ppmc.testrunner.exception.InvalidRequestException 请求没有目标测试项。
     * @throws SchedulerBusyException 已有会话在运行，或调度器正在关闭。
     */
    public SessionHandle submit(RunRequest request) {
        RunRequestQueue.validate(request);
        SessionHandle handle;
        synchronized (lock) {
            handle = reserve(request);
        }
        if (prepare(handle)) {
            launchExecutor.execute(() -> launch(handle));
        }
        return handle;
    }

    /**
     * 将请求放入队列，在调度器空闲时按到达顺序依次执行。
     *
     * @return 入队后队列中等待的请求数。
     */
    public int enqueue(RunRequest request) {
        int pending;
        // 与 cleanUp 的状态切换在同一把锁内，关闭时的 drain 不会漏掉刚入队的请求
        synchronized (lock) {
            if (state == SchedulerState.SHUTTING_DOWN) {
                throw SchedulerBusyException.shuttingDown();
            }
            requestQueue.enqueue(request);
            pending = requestQueue.size();
        }
        log.info("测试请求已入队 ({})，当前等待 {} 个。", request.describeTargets(), pending);
        dispatchExecutor.execute(this::dispatchNext);
        return pending;
    }

    /**
     * 以最近一次完成的会话的目标、模式和启动配置重新运行。
     *
     * @throws NoPriorRequestException 还没有任何会话完成过。
     */
    public SessionHandle relaunch() {
        RunRequest last;
        synchronized (lock) {
            last = lastCompletedRequest;
        }
        if (last == null) {
            throw new NoPriorRequestException();
        }
        log.info("重新运行上一次的测试: {}", last.describeTargets());
        return submit(last.copyForRelaunch());
    }

    /**
     * 终止当前会话。
     *
     * @param isCancel true 表示用户取消：会话标记为 CANCELLED，调度器继续接受新任务；
     *                 false 表示进程关闭：会话标记为 COMPLETED（已拆除），释放资源并进入 SHUTTING_DOWN。
     * @throws CancelTimeoutException 在限定时间内没有确认后端已退出。调度器仍会回到 IDLE（或 SHUTTING_DOWN）。
     */
    public void cleanUp(boolean isCancel) {
        RunSession session;
        ExecutionHandle handle;
        CompletableFuture<RunSession> completion;
        synchronized (lock) {
            if (!isCancel) {
                state = SchedulerState.SHUTTING_DOWN;
            }
            session = currentSession;
            handle = currentHandle;
            completion = currentCompletion;
            if (session != null) {
                session.requestTermination(isCancel ? SessionState.CANCELLED : SessionState.COMPLETED, !isCancel);
            }
        }
        if (session != null || !isCancel) {
            dropQueuedRequests(isCancel ? "测试会话已被取消" : "测试运行器正在关闭");
        }
        if (session == null) {
            return;
        }

        log.info("正在{}测试会话 {}", isCancel ? "取消" : "拆除", session.getId());
        // handle 为 null 说明仍在启动中：终止请求已通过会话的钩子销毁构建或进程，launch 随后以取消结束
        if (handle != null) {
            handle.terminate();
        }

        long timeoutMillis = settingsService.getSettings().getCancelTimeoutMillis();
        try {
            completion.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // 会话以失败结束同样说明后端已经退出
            log.debug("会话 {} 在终止过程中以失败结束: {}", session.getId(), e.getCause().getMessage());
        } catch (TimeoutException e) {
            forceTerminal(session, handle, completion, timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceTerminal(session, handle, completion, timeoutMillis);
        }
        if (!isCancel && handle != null) {
            handle.release();
        }
    }

    public SchedulerState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public Optional<RunSession> getCurrentSession() {
        synchronized (lock) {
            return Optional.ofNullable(currentSession);
        }
    }

    public Optional<RunRequest> getLastCompletedRequest() {
        synchronized (lock) {
            return Optional.ofNullable(lastCompletedRequest);
        }
    }

    public int getPendingCount() {
        return requestQueue.size();
    }

    @PreDestroy
    public void shutdownDispatcher() {
        dispatchExecutor.shutdownNow();
    }

    private SessionHandle reserve(RunRequest request) {
        if (state == SchedulerState.SHUTTING_DOWN) {
            throw SchedulerBusyException.shuttingDown();
        }
        if (state == SchedulerState.BUSY) {
            throw new SchedulerBusyException(currentSession.getId());
        }
        var session = new RunSession(request);
        session.markStarting();
        state = SchedulerState.BUSY;
        currentSession = session;
        currentHandle = null;
        currentCompletion = new CompletableFuture<>();
        return new SessionHandle(session, currentCompletion);
    }

    /**
     * 通知结果接收方会话已开始，并让后端校验启动条件。
     *
     * @return false 表示会话已经以启动失败结束。
     */
    private boolean prepare(SessionHandle reserved) {
        RunSession session = reserved.session();
        log.info("启动测试会话 {} ({}): {}", session.getId(), session.getRequest().mode(),
                session.getRequest().describeTargets());
        resultSink.sessionStarted(session);
        try {
            backend.validate(session.getRequest());
            return true;
        } catch (RuntimeException e) {
            failLaunch(session, reserved.completion(), e);
            return false;
        }
    }

    private void launch(SessionHandle reserved) {
        RunSession session = reserved.session();
        CompletableFuture<RunSession> completion = reserved.completion();
        ExecutionHandle handle;
        try {
            handle = backend.launch(session, result -> deliver(session, result));
        } catch (LaunchCancelledException e) {
            log.info(e.getMessage());
            finish(session, completion, session.getRequestedTerminalState(), null);
            return;
        } catch (RuntimeException e) {
            if (session.isTerminationRequested()) {
                // 终止请求销毁了构建或进程，由此导致的启动错误不算故障
                log.info("测试会话 {} 在启动期间被终止: {}", session.getId(), e.getMessage());
                finish(session, completion, session.getRequestedTerminalState(), null);
                return;
            }
            failLaunch(session, completion, e);
            return;
        }

        boolean terminateNow;
        synchronized (lock) {
            if (currentSession == session) {
                currentHandle = handle;
                terminateNow = session.isTerminationRequested();
                if (!session.isTerminal()) {
                    session.markRunning();
                }
            } else {
                // 启动期间 cleanUp 已超时并强制回到空闲
                terminateNow = true;
            }
        }
        if (terminateNow) {
            handle.terminate();
        }
        handle.completion().whenComplete((exit, error) -> onBackendExit(session, completion, handle, exit, error));
    }

    private void failLaunch(RunSession session, CompletableFuture<RunSession> completion, RuntimeException e) {
        LaunchFailedException failure = e instanceof LaunchFailedException launchFailed
                ? launchFailed
                : new LaunchFailedException("启动测试后端失败: " + e.getMessage(), e);
        log.error("测试会话 {} 启动失败", session.getId(), failure);
        finish(session, completion, SessionState.FAILED, failure);
    }

    private void deliver(RunSession session, TestResult result) {
        if (session.isTerminal()) {
            log.debug("会话 {} 已结束，忽略迟到的结果 {}", session.getId(), result.testId());
            return;
        }
        resultSink.accept(session, result);
    }

    private void onBackendExit(
            RunSession session,
            CompletableFuture<RunSession> completion,
            ExecutionHandle handle,
            BackendExit exit,
            Throwable error) {
        handle.release();

        if (session.isTerminationRequested()) {
            finish(session, completion, session.getRequestedTerminalState(), null);
        } else if (error != null || exit.isAbnormal()) {
            int exitCode = exit != null ? exit.exitCode() : -1;
            var crash = new BackendCrashedException(session.getId(), exitCode);
            if (error != null) {
                crash.initCause(error);
            }
            log.error("测试会话 {} 的后端中途崩溃，已收到的结果将被保留。", session.getId(), crash);
            finish(session, completion, SessionState.FAILED, crash);
        } else {
            log.info("测试会话 {} 已完成，退出码: {}", session.getId(), exit.exitCode());
            finish(session, completion, SessionState.COMPLETED, null);
        }
    }

    private void forceTerminal(
            RunSession session, ExecutionHandle handle, CompletableFuture<RunSession> completion, long timeoutMillis) {
        session.markCleanupUnconfirmed();
        if (handle != null) {
            handle.release();
        }
        finish(session, completion, session.getRequestedTerminalState(), null);
        var timeout = new CancelTimeoutException(session.getId(), timeoutMillis);
        log.error(timeout.getMessage());
        throw timeout;
    }

    private void finish(
            RunSession session,
            CompletableFuture<RunSession> completion,
            SessionState terminalState,
            RuntimeException failure) {
        boolean dispatch;
        synchronized (lock) {
            if (!session.finish(terminalState, failure)) {
                return;
            }
            if (terminalState == SessionState.COMPLETED && !session.isTornDown()) {
                lastCompletedRequest = session.getRequest();
            }
            if (currentSession == session) {
                currentSession = null;
                currentHandle = null;
                currentCompletion = null;
                if (state == SchedulerState.BUSY) {
                    state = SchedulerState.IDLE;
                }
            }
            dispatch = state == SchedulerState.IDLE && !requestQueue.isEmpty();
        }

        resultSink.sessionFinished(session);
        if (failure != null) {
            completion.completeExceptionally(failure);
        } else {
            completion.complete(session);
        }
        if (dispatch) {
            dispatchExecutor.execute(this::dispatchNext);
        }
    }

    private void dispatchNext() {
        SessionHandle reserved;
        synchronized (lock) {
            if (state != SchedulerState.IDLE) {
                // 当前会话结束后会再次触发派发
                return;
            }
            Optional<RunRequest> next = requestQueue.dequeueNext();
            if (next.isEmpty()) {
                return;
            }
            reserved = reserve(next.get());
        }
        // 派发线程本身就是后台线程，直接在这里启动
        if (prepare(reserved)) {
            launch(reserved);
        }
        reserved.completion().whenComplete((session, error) -> {
            if (error != null) {
                log.warn("队列中的测试会话 {} 以失败结束: {}", reserved.sessionId(), error.getMessage());
            }
        });
    }

    private void dropQueuedRequests(String reason) {
        List<RunRequest> dropped = requestQueue.drain();
        for (RunRequest request : dropped) {
            log.info("{}，丢弃排队中的测试请求: {}", reason, request.describeTargets());
            resultSink.requestDropped(request, reason);
        }
    }
}
