/**
 * InvalidRequestException.java
 *
 * 请求在任何状态变更之前就被拒绝，例如目标测试项为空。
 */
package club.ppmc.testrunner.exception;

public class InvalidRequestException extends TestRunnerException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
