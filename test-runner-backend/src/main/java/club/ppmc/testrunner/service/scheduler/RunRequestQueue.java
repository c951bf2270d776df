/**
 * RunRequestQueue.java
 *
 * 按到达顺序保存待执行的运行请求。队列本身不限制并发，单飞由 RunnerScheduler 保证。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.exception.InvalidRequestException;
import club.ppmc.testrunner.model.RunRequest;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class RunRequestQueue {

    private final Deque<RunRequest> pending = new ArrayDeque<>();

    /**
     * @throws InvalidRequestException 请求没有任何目标测试项。
     */
    public synchronized void enqueue(RunRequest request) {
        validate(request);
        pending.addLast(request);
    }

    public synchronized Optional<RunRequest> dequeueNext() {
        return Optional.ofNullable(pending.pollFirst());
    }

    /**
     * 移除并返回所有待执行的请求，保持到达顺序。
     */
    public synchronized List<RunRequest> drain() {
        List<RunRequest> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    static void validate(RunRequest request) {
        if (request == null || request.targets().isEmpty()) {
            throw new InvalidRequestException("运行请求至少需要包含一个测试项。");
        }
    }
}
