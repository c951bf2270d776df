/**
 * LaunchFailedException.java
 *
 * 执行后端（测试进程或调试器附加）无法启动。携带底层原因，不会自动重试。
 */
package club.ppmc.testrunner.exception;

public class LaunchFailedException extends TestRunnerException {

    public LaunchFailedException(String message, Throwable cause) {
        super(ErrorCode.LAUNCH_FAILED, message, cause);
    }
}
