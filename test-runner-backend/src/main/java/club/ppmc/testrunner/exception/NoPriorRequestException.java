/**
 * NoPriorRequestException.java
 *
 * 在没有任何已完成会话的情况下请求"重新运行"。
 */
package club.ppmc.testrunner.exception;

public class NoPriorRequestException extends TestRunnerException {

    public NoPriorRequestException() {
        super(ErrorCode.NO_PRIOR_REQUEST, "没有可以重新运行的测试会话。");
    }
}
