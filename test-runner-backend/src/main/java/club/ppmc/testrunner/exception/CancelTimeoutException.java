/**
 * CancelTimeoutException.java
 *
 * 在限定时间内没有确认后端已被拆除。调度器仍会强制回到空闲状态，
 * 但该会话的资源清理被标记为"未确认"。
 */
package club.ppmc.testrunner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class CancelTimeoutException extends TestRunnerException {

    private final String sessionId;
    private final long timeoutMillis;

    public CancelTimeoutException(String sessionId, long timeoutMillis) {
        super(ErrorCode.CANCEL_TIMEOUT,
                String.format("在 %d 毫秒内未能确认测试会话 %s 已终止，资源清理未确认。", timeoutMillis, sessionId));
        this.sessionId = sessionId;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        data.put("sessionId", sessionId);
        data.put("timeoutMillis", timeoutMillis);
        return data;
    }
}
