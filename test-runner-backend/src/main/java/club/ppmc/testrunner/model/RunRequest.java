/**
 * RunRequest.java
 *
 * 该文件定义了一次运行/调试请求。它由调用方的动作创建，被调度器恰好消费一次，然后丢弃。
 * 目标列表在构造时被复制，之后不可变。
 */
package club.ppmc.testrunner.model;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * @param targets 有序的测试项列表。空列表由 RunRequestQueue / RunnerScheduler 拒绝，这里不做校验。
 * @param mode 运行或调试。
 * @param launchConfiguration 可选的启动配置，可以为 null。
 * @param requestedAt 请求创建时间。
 */
public record RunRequest(
        List<TestItem> targets, RunMode mode, LaunchConfiguration launchConfiguration, Instant requestedAt) {

    public RunRequest {
        targets = targets == null ? List.of() : List.copyOf(targets);
        mode = mode == null ? RunMode.RUN : mode;
        requestedAt = requestedAt == null ? Instant.now() : requestedAt;
    }

    public static RunRequest of(List<TestItem> targets, RunMode mode, LaunchConfiguration launchConfiguration) {
        return new RunRequest(targets, mode, launchConfiguration, Instant.now());
    }

    /**
     * 基于当前请求创建一个新的请求（相同目标、模式和启动配置），用于"重新运行"。
     */
    public RunRequest copyForRelaunch() {
        return new RunRequest(targets, mode, launchConfiguration, Instant.now());
    }

    public boolean isDebug() {
        return mode == RunMode.DEBUG;
    }

    public String describeTargets() {
        return targets.stream().map(TestItem::fullName).collect(Collectors.joining(", "));
    }
}
