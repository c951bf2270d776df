/**
 * SessionHandle.java
 *
 * submit 返回给调用方的句柄。completion 在会话进入终态时完成：
 * COMPLETED / CANCELLED 时正常完成，FAILED 时以 LaunchFailedException 或 BackendCrashedException 异常完成。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.RunSession;
import java.util.concurrent.CompletableFuture;

public record SessionHandle(RunSession session, CompletableFuture<RunSession> completion) {

    public String sessionId() {
        return session.getId();
    }
}
