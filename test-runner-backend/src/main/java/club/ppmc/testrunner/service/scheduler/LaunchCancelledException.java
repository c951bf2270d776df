/**
 * LaunchCancelledException.java
 *
 * 会话在启动阶段（运行前构建、等待调试端口、附加调试器）就被取消或拆除。
 * 它不是故障：调度器收到后以会话请求的终态结束会话，不记录错误。
 */
package club.ppmc.testrunner.service.scheduler;

public class LaunchCancelledException extends RuntimeException {

    public LaunchCancelledException(String sessionId, String stage) {
        super(String.format("测试会话 %s 在%s时已被请求终止，停止启动。", sessionId, stage));
    }
}
