/**
 * ErrorCode.java
 *
 * 测试运行器对外暴露的错误分类。
 * 结构性错误（调用方误用）同步返回给调用方，不作为系统故障记录；
 * 运行时错误（环境异常）既返回给调用方，也会以 ERROR 级别记录日志。
 */
package club.ppmc.testrunner.exception;

public enum ErrorCode {
    INVALID_REQUEST(false),
    BUSY(false),
    NO_PRIOR_REQUEST(false),
    UNKNOWN_TEST_ITEM(false),
    LAUNCH_FAILED(true),
    BACKEND_CRASHED(true),
    CANCEL_TIMEOUT(true),
    ENVIRONMENT_ERROR(true);

    private final boolean runtimeFailure;

    ErrorCode(boolean runtimeFailure) {
        this.runtimeFailure = runtimeFailure;
    }

    public boolean isRuntimeFailure() {
        return runtimeFailure;
    }
}
