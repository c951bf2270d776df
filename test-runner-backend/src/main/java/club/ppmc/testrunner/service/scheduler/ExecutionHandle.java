/**
 * ExecutionHandle.java
 *
 * 一个已启动的执行后端（测试进程，调试模式下还包括调试器附加）的控制句柄。
 */
package club.ppmc.testrunner.service.scheduler;

import java.util.concurrent.CompletableFuture;

public interface ExecutionHandle {

    /**
     * 在进程退出且其输出被完全读取后完成。
     */
    CompletableFuture<BackendExit> completion();

    /**
     * 向进程（及调试会话）发送终止信号，不等待其退出。
     */
    void terminate();

    /**
     * 释放持有的操作系统资源（临时文件、调试连接）。必须是幂等的。
     */
    void release();
}
