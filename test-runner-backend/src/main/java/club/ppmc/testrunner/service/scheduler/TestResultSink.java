/**
 * TestResultSink.java
 *
 * 接收一个会话在执行过程中产生的结果。对同一个会话，accept 的调用顺序与后端产生结果的顺序一致。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.TestResult;

public interface TestResultSink {

    void sessionStarted(RunSession session);

    void accept(RunSession session, TestResult result);

    /**
     * 会话进入终态后调用一次。
     */
    void sessionFinished(RunSession session);

    /**
     * 排队中的请求因取消或关闭而被丢弃，没有产生会话。
     */
    void requestDropped(RunRequest request, String reason);
}
