/**
 * TestExecutionBackend.java
 *
 * 进程外的测试执行后端。调度器通过它派生测试进程，并在调试模式下附加调试器。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.TestResult;
import java.util.function.Consumer;

public interface TestExecutionBackend {

    /**
     * 在调用方线程上快速检查启动条件（运行器是否配置等），不做任何阻塞操作。
     *
     * @throws club.ppmc.testrunner.exception.EnvironmentConfigurationException 运行环境缺少必要组件。
     */
    default void validate(RunRequest request) {
    }

    /**
     * 启动会话对应的后端。
     *
     * @param session 正在启动的会话。
     * @param results 结果回调，必须按后端产生的顺序、在同一个读取线程上调用。
     * @return 已启动后端的控制句柄。
     * @throws LaunchFailedException 进程无法启动或调试器无法附加。
     * @throws LaunchCancelledException 会话在启动完成前被请求终止。
     */
    ExecutionHandle launch(RunSession session, Consumer<TestResult> results) throws LaunchFailedException;
}
