/**
 * ProcessExecutionHandle.java
 *
 * 一个已派生的测试进程。输出读取在独立的线程中进行，
 * completion 组合了"进程退出"和"输出流读完"两个 Future，确保进程即使很快结束，它的所有输出也已被处理。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.service.WebSocketNotificationService;
import club.ppmc.testrunner.util.Disposable;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

@Slf4j
class ProcessExecutionHandle implements ExecutionHandle {

    static final String JDWP_LISTENING_MARKER = "Listening for transport dt_socket";

    private final String sessionId;
    private final Process process;
    private final List<File> tempFiles;
    private final TestOutputParser parser;
    private final Consumer<TestResult> results;
    private final WebSocketNotificationService notificationService;

    private final AtomicBoolean runFinished = new AtomicBoolean(false);
    private final AtomicBoolean terminating = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final AtomicReference<Disposable> debugAttachment = new AtomicReference<>();
    private final CompletableFuture<String> jdwpReady = new CompletableFuture<>();
    private CompletableFuture<BackendExit> completion;

    ProcessExecutionHandle(
            String sessionId,
            Process process,
            List<File> tempFiles,
            TestOutputParser parser,
            Consumer<TestResult> results,
            WebSocketNotificationService notificationService) {
        this.sessionId = sessionId;
        this.process = process;
        this.tempFiles = tempFiles;
        this.parser = parser;
        this.results = results;
        this.notificationService = notificationService;
    }

    /**
     * 启动输出读取线程，并建立 completion。只调用一次。
     */
    void start(Executor readerExecutor) {
        CompletableFuture<Void> reader = CompletableFuture.runAsync(this::readOutput, readerExecutor);
        this.completion = process.onExit()
                .thenCombine(reader, (p, ignored) -> new BackendExit(p.exitValue(), runFinished.get()));
    }

    /**
     * 在进程输出 JDWP 监听日志后以该行完成；进程在此之前结束则异常完成。
     */
    CompletableFuture<String> jdwpReady() {
        return jdwpReady;
    }

    void attachDebugger(Disposable attachment) {
        debugAttachment.set(attachment);
    }

    long pid() {
        return process.pid();
    }

    @Override
    public CompletableFuture<BackendExit> completion() {
        return completion;
    }

    @Override
    public void terminate() {
        if (!terminating.compareAndSet(false, true)) {
            return;
        }
        log.info("正在终止测试会话 {} 的进程，PID: {}", sessionId, process.pid());
        disposeDebugAttachment();
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        disposeDebugAttachment();
        for (File file : tempFiles) {
            if (!FileUtils.deleteQuietly(file)) {
                log.warn("无法删除测试会话 {} 的临时文件 {}", sessionId, file);
            }
        }
        if (process.isAlive()) {
            log.warn("释放资源时测试进程 PID {} 仍在运行，将强制终止。", process.pid());
            process.destroyForcibly();
        }
    }

    private void disposeDebugAttachment() {
        Disposable attachment = debugAttachment.getAndSet(null);
        if (attachment != null) {
            attachment.dispose();
        }
    }

    private void readOutput() {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            // 读取直到流结束，而不是直到进程退出，保证缓冲中的输出全部被处理
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            if (!terminating.get()) {
                log.warn("读取测试会话 {} 的输出时出错: {}", sessionId, e.getMessage());
            }
        } finally {
            if (!jdwpReady.isDone()) {
                jdwpReady.completeExceptionally(new IOException("进程在调试端口就绪前已结束。"));
            }
        }
    }

    private void handleLine(String line) {
        if (!jdwpReady.isDone() && line.contains(JDWP_LISTENING_MARKER)) {
            jdwpReady.complete(line);
        }
        TestOutputParser.ParsedLine parsed = parser.parse(line);
        switch (parsed.kind()) {
            case RESULT -> results.accept(parsed.result());
            case RUN_FINISHED -> runFinished.set(true);
            case OUTPUT -> notificationService.sendRunLog(line);
        }
    }
}
