/**
 * SchedulerBusyException.java
 *
 * 已有一个活动的测试会话（或调度器正在关闭），新的提交被拒绝。
 * 由调用方决定是排队还是提示用户。
 */
package club.ppmc.testrunner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class SchedulerBusyException extends TestRunnerException {

    /** 占用调度器的会话 id；调度器正在关闭时为 null。 */
    private final String activeSessionId;

    public SchedulerBusyException(String activeSessionId) {
        super(ErrorCode.BUSY, "已有一个测试会话正在运行，请等待其结束后再试。");
        this.activeSessionId = activeSessionId;
    }

    private SchedulerBusyException(String message, String activeSessionId) {
        super(ErrorCode.BUSY, message);
        this.activeSessionId = activeSessionId;
    }

    public static SchedulerBusyException shuttingDown() {
        return new SchedulerBusyException("测试运行器正在关闭，不再接受新的会话。", null);
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        if (activeSessionId != null) {
            data.put("activeSessionId", activeSessionId);
        }
        return data;
    }
}
