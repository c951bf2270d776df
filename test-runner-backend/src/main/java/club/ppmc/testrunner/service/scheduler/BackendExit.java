/**
 * BackendExit.java
 *
 * 执行后端进程的退出信息。
 */
package club.ppmc.testrunner.service.scheduler;

/**
 * @param exitCode 进程退出码。
 * @param runFinished 运行器是否输出了"运行结束"标记。
 */
public record BackendExit(int exitCode, boolean runFinished) {

    /**
     * 进程以非零码退出且运行器没有宣告运行结束，视为中途崩溃。
     * 有失败用例时运行器通常以非零码退出，但会先输出结束标记。
     */
    public boolean isAbnormal() {
        return exitCode != 0 && !runFinished;
    }
}
