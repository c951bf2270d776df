/**
 * TestRunnerException.java
 *
 * 测试运行器所有业务异常的基类。它携带一个 ErrorCode，
 * 以便 Controller 层把它转换为对前端友好的结构化响应。
 */
package club.ppmc.testrunner.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public abstract class TestRunnerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected TestRunnerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TestRunnerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", errorCode.name());
        data.put("message", getMessage());
        if (getCause() != null && getCause().getMessage() != null) {
            data.put("cause", getCause().getMessage());
        }
        return data;
    }
}
