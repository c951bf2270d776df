/**
 * ProcessTestExecutionBackend.java
 *
 * 默认的执行后端：在独立的 JVM 中派生测试运行器进程。
 * 调试模式下进程带 JDWP 代理启动，在其输出监听日志后通过 JDI 附加。
 * 一个请求的所有目标在同一个进程中运行，类路径由涉及的各个项目拼接而成。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.exception.EnvironmentConfigurationException;
import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.model.LaunchConfiguration;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.Settings;
import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.service.TestItemRegistry;
import club.ppmc.testrunner.service.WebSocketNotificationService;
import club.ppmc.testrunner.util.Disposable;
import club.ppmc.testrunner.util.MavenProjectHelper;
import jakarta.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@Slf4j
public class ProcessTestExecutionBackend implements TestExecutionBackend {

    private static final List<String> BUILD_GOALS = List.of("test-compile", "dependency:copy-dependencies");
    private static final long JDWP_READY_TIMEOUT_SECONDS = 90;
    static final String TARGETS_SEPARATOR = "--";

    private final SettingsService settingsService;
    private final MavenProjectHelper mavenHelper;
    private final TestOutputParser outputParser;
    private final DebugSessionAttacher debugAttacher;
    private final WebSocketNotificationService notificationService;
    private final TestItemRegistry itemRegistry;
    private final ExecutorService readerExecutor =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("test-output-"));

    public ProcessTestExecutionBackend(
            SettingsService settingsService,
            MavenProjectHelper mavenHelper,
            TestOutputParser outputParser,
            DebugSessionAttacher debugAttacher,
            WebSocketNotificationService notificationService,
            TestItemRegistry itemRegistry) {
        this.settingsService = settingsService;
        this.mavenHelper = mavenHelper;
        this.outputParser = outputParser;
        this.debugAttacher = debugAttacher;
        this.notificationService = notificationService;
        this.itemRegistry = itemRegistry;
    }

    @Override
    public void validate(RunRequest request) {
        Settings settings = settingsService.getSettings();
        if (!StringUtils.hasText(settings.getRunnerClasspath())) {
            throw new EnvironmentConfigurationException(
                    "未配置测试运行器的类路径 (app.test-runner.runner-classpath)。", "runner");
        }
        if (!StringUtils.hasText(settings.getRunnerMainClass())) {
            throw new EnvironmentConfigurationException(
                    "未配置测试运行器的主类 (app.test-runner.main-class)。", "runner");
        }
        for (String entry : runnerClasspath(settings)) {
            if (!Files.exists(Path.of(entry))) {
                throw new EnvironmentConfigurationException(
                        "测试运行器的类路径中的 '" + entry + "' 不存在，请先构建 test-runner-junit 模块。", "runner");
            }
        }
    }

    private static List<String> runnerClasspath(Settings settings) {
        List<String> entries = new ArrayList<>();
        for (String entry : settings.getRunnerClasspath().split(File.pathSeparator)) {
            if (StringUtils.hasText(entry)) {
                entries.add(entry.trim());
            }
        }
        return entries;
    }

    /**
     * 启动测试进程。构建、派生进程和等待调试端口之前都会检查会话是否已被请求终止；
     * 启动期间到达的终止请求会立即销毁正在运行的 Maven 构建或测试进程。
     *
     * @throws LaunchCancelledException 会话在启动完成前被取消或拆除。
     */
    @Override
    public ExecutionHandle launch(RunSession session, Consumer<TestResult> results) {
        RunRequest request = session.getRequest();
        validate(request);
        Settings settings = settingsService.getSettings();

        List<String> projects = request.targets().stream().map(TestItem::projectName).distinct().toList();
        Path primaryProjectDir = mavenHelper.resolveProjectDir(projects.get(0));
        if (settings.isBuildBeforeRun()) {
            for (String project : projects) {
                buildProject(session, settings, project);
            }
        }

        List<File> tempFiles = new ArrayList<>();
        try {
            String jdkVersion = mavenHelper.getJavaVersionFromPom(primaryProjectDir.toFile(), notificationService::sendRunLog);
            String javaExecutable = mavenHelper.selectJdkExecutable(settings, jdkVersion, notificationService::sendRunLog);

            File argFile = writeArgFile(session, settings, projects);
            tempFiles.add(argFile);

            List<String> command = buildCommand(javaExecutable, request, settings, argFile);
            ProcessBuilder pb = new ProcessBuilder(command)
                    .directory(resolveWorkingDirectory(request.launchConfiguration(), primaryProjectDir))
                    .redirectErrorStream(true);
            if (request.launchConfiguration() != null) {
                pb.environment().putAll(request.launchConfiguration().env());
            }

            ensureNotTerminated(session, "派生测试进程前");
            log.info("为会话 {} 执行测试命令: {}", session.getId(), String.join(" ", pb.command()));
            Process process = pb.start();
            var handle = new ProcessExecutionHandle(
                    session.getId(), process, tempFiles, outputParser, toItemIds(request, results), notificationService);
            handle.start(readerExecutor);

            // 句柄交给调度器之前，终止请求由这里负责销毁进程
            Disposable killOnTermination = session.onTerminationRequested(handle::terminate);
            try {
                if (request.isDebug()) {
                    attachDebugger(session, settings, handle);
                }
            } finally {
                killOnTermination.dispose();
            }
            return handle;
        } catch (IOException e) {
            tempFiles.forEach(FileUtils::deleteQuietly);
            throw new LaunchFailedException("无法启动测试进程: " + e.getMessage(), e);
        } catch (LaunchCancelledException e) {
            tempFiles.forEach(FileUtils::deleteQuietly);
            throw e;
        }
    }

    private void buildProject(RunSession session, Settings settings, String project) {
        ensureNotTerminated(session, "构建项目 '" + project + "' 前");
        List<Disposable> buildHooks = new ArrayList<>();
        int exitCode;
        try {
            exitCode = mavenHelper.executeMavenBuild(project, settings, BUILD_GOALS,
                    build -> buildHooks.add(session.onTerminationRequested(() -> destroyBuild(session, build))));
        } finally {
            Disposable.disposeAll(buildHooks);
        }
        ensureNotTerminated(session, "构建项目 '" + project + "' 时");
        if (exitCode != 0) {
            throw new LaunchFailedException("项目 '" + project + "' 的 Maven 构建失败，退出码: " + exitCode, null);
        }
    }

    private static void destroyBuild(RunSession session, Process build) {
        log.info("会话 {} 已被请求终止，销毁正在进行的 Maven 构建，PID: {}", session.getId(), build.pid());
        build.descendants().forEach(ProcessHandle::destroyForcibly);
        build.destroyForcibly();
    }

    private static void ensureNotTerminated(RunSession session, String stage) {
        if (session.isTerminationRequested()) {
            throw new LaunchCancelledException(session.getId(), stage);
        }
    }

    private void attachDebugger(RunSession session, Settings settings, ProcessExecutionHandle handle) {
        try {
            String listeningLine = handle.jdwpReady().get(JDWP_READY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ensureNotTerminated(session, "附加调试器前");
            int port = DebugSessionAttacher.resolvePort(listeningLine, settings.getDebugPort());
            handle.attachDebugger(debugAttacher.attach(session.getId(), port, session::isTerminationRequested));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(handle);
            throw new LaunchFailedException("等待调试端口时被中断。", e);
        } catch (LaunchCancelledException e) {
            abandon(handle);
            throw e;
        } catch (ExecutionException | TimeoutException | IOException e) {
            abandon(handle);
            // 终止请求销毁了进程，调试端口自然无法就绪
            ensureNotTerminated(session, "等待调试端口时");
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            throw new LaunchFailedException("附加调试器失败: " + cause.getMessage(), cause);
        }
    }

    private void abandon(ProcessExecutionHandle handle) {
        handle.terminate();
        handle.release();
    }

    private List<String> buildCommand(String javaExecutable, RunRequest request, Settings settings, File argFile) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        if (request.launchConfiguration() != null) {
            command.addAll(request.launchConfiguration().vmArgs());
        }
        if (request.isDebug()) {
            command.add(String.format(
                    "-agentlib:jdwp=transport=dt_socket,server=y,suspend=y,address=%d", settings.getDebugPort()));
        }
        command.add("-Dfile.encoding=UTF-8");
        command.add("@" + argFile.getAbsolutePath());
        return command;
    }

    /**
     * 运行器按完全限定名报告结果，这里换回测试项的 id。
     * 优先匹配请求中的目标，其次是同名的已注册测试项（例如类目标下的方法），都找不到时保留原名。
     */
    Consumer<TestResult> toItemIds(RunRequest request, Consumer<TestResult> results) {
        Set<String> projects = new LinkedHashSet<>();
        request.targets().forEach(target -> projects.add(target.projectName()));
        return result -> {
            String testId = request.targets().stream()
                    .filter(target -> target.fullName().equals(result.testId()))
                    .map(TestItem::id)
                    .findFirst()
                    .or(() -> itemRegistry.findByFullName(projects, result.testId()).map(TestItem::id))
                    .orElse(result.testId());
            results.accept(testId.equals(result.testId())
                    ? result
                    : new TestResult(testId, result.status(), result.message(), result.durationMillis()));
        };
    }

    private File writeArgFile(RunSession session, Settings settings, List<String> projects) throws IOException {
        Set<String> classpath = new LinkedHashSet<>();
        for (String project : projects) {
            classpath.addAll(mavenHelper.buildTestClasspath(mavenHelper.resolveProjectDir(project)));
        }
        classpath.addAll(runnerClasspath(settings));

        Path argFile = Files.createTempFile("test-run-" + session.getId(), ".args");
        Files.write(argFile, argFileLines(session.getRequest(), settings, classpath), StandardCharsets.UTF_8);
        return argFile.toFile();
    }

    /**
     * 类路径和测试名都写入 @argfile，避免命令行过长。
     * 启动配置的参数作为运行器选项写在 "--" 之前，测试目标写在之后。
     */
    static List<String> argFileLines(RunRequest request, Settings settings, Set<String> classpath) {
        List<String> lines = new ArrayList<>();
        lines.add("-cp");
        lines.add(quote(String.join(File.pathSeparator, classpath)));
        lines.add(settings.getRunnerMainClass());
        LaunchConfiguration launchConfiguration = request.launchConfiguration();
        if (launchConfiguration != null) {
            launchConfiguration.args().stream().map(ProcessTestExecutionBackend::quote).forEach(lines::add);
        }
        lines.add(TARGETS_SEPARATOR);
        request.targets().stream().map(TestItem::fullName).map(ProcessTestExecutionBackend::quote).forEach(lines::add);
        return lines;
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private File resolveWorkingDirectory(LaunchConfiguration launchConfiguration, Path primaryProjectDir) {
        if (launchConfiguration != null && StringUtils.hasText(launchConfiguration.workingDirectory())) {
            return primaryProjectDir.resolve(launchConfiguration.workingDirectory()).normalize().toFile();
        }
        return primaryProjectDir.toFile();
    }

    @PreDestroy
    public void shutdown() {
        readerExecutor.shutdownNow();
    }
}
