/**
 * RunSession.java
 *
 * 该文件定义了一次测试执行（运行或调试）从开始到终态的会话。
 * 会话在整个生命周期内只由 RunnerScheduler 持有和修改；其他组件只能读取它的快照。
 * 状态只能单向前进，进入终态后不再变化。
 */
package club.ppmc.testrunner.model;

import club.ppmc.testrunner.util.Disposable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.AccessLevel;
import lombok.Getter;

@Getter
public class RunSession {

    private final String id;
    private final RunRequest request;
    private volatile SessionState state = SessionState.PENDING;
    private volatile Instant startedAt;
    private volatile Instant endedAt;

    /** 会话失败时的运行时错误（LaunchFailed / BackendCrashed），否则为 null。 */
    private volatile RuntimeException failure;

    /** cleanUp 已请求终止时的目标终态。 */
    private volatile SessionState requestedTerminalState;

    /** 是否因进程关闭而被拆除（cleanUp(false)）。 */
    private volatile boolean tornDown;

    /** 拆除是否在超时内得到了确认。 */
    private volatile boolean cleanupConfirmed = true;

    @Getter(AccessLevel.NONE)
    private final List<Runnable> terminationHooks = new CopyOnWriteArrayList<>();

    public RunSession(RunRequest request) {
        this(UUID.randomUUID().toString(), request);
    }

    public RunSession(String id, RunRequest request) {
        this.id = id;
        this.request = request;
    }

    public synchronized void markStarting() {
        advance(SessionState.STARTING);
        this.startedAt = Instant.now();
    }

    public synchronized void markRunning() {
        advance(SessionState.RUNNING);
    }

    /**
     * 将会话推进到终态。已处于终态时返回 false 且不做任何修改。
     */
    public synchronized boolean finish(SessionState terminalState, RuntimeException failure) {
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("不是终态: " + terminalState);
        }
        if (state.isTerminal()) {
            return false;
        }
        this.state = terminalState;
        this.failure = failure;
        this.endedAt = Instant.now();
        return true;
    }

    /**
     * 记录终止请求，并依次执行已登记的终止钩子（例如销毁启动阶段的构建进程）。
     * 钩子在调用线程上、锁外执行。
     */
    public void requestTermination(SessionState terminalState, boolean tornDown) {
        List<Runnable> hooks;
        synchronized (this) {
            this.requestedTerminalState = terminalState;
            this.tornDown = tornDown;
            hooks = List.copyOf(terminationHooks);
            terminationHooks.clear();
        }
        hooks.forEach(Runnable::run);
    }

    /**
     * 登记一个在终止被请求时执行的钩子。终止已被请求时钩子立即在当前线程执行。
     *
     * @return 用于在钩子不再需要时撤销登记。
     */
    public Disposable onTerminationRequested(Runnable hook) {
        synchronized (this) {
            if (requestedTerminalState == null) {
                terminationHooks.add(hook);
                return () -> terminationHooks.remove(hook);
            }
        }
        hook.run();
        return () -> { };
    }

    public boolean isTerminationRequested() {
        return requestedTerminalState != null;
    }

    public void markCleanupUnconfirmed() {
        this.cleanupConfirmed = false;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    private void advance(SessionState next) {
        if (state.isTerminal() || next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException(String.format("会话 %s 不能从 %s 进入 %s", id, state, next));
        }
        this.state = next;
    }

    @Override
    public String toString() {
        return "RunSession{id=" + id + ", state=" + state + ", mode=" + request.mode() + "}";
    }
}
