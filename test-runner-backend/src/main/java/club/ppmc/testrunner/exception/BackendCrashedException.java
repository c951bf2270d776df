/**
 * BackendCrashedException.java
 *
 * 测试进程在运行中途异常终止。已收到的部分结果仍保留在结果管理器中。
 */
package club.ppmc.testrunner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class BackendCrashedException extends TestRunnerException {

    private final int exitCode;

    public BackendCrashedException(String sessionId, int exitCode) {
        super(ErrorCode.BACKEND_CRASHED, String.format("测试会话 %s 的进程异常退出，退出码: %d", sessionId, exitCode));
        this.exitCode = exitCode;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        data.put("exitCode", exitCode);
        return data;
    }
}
