/**
 * JUnitRunnerMain.java
 *
 * 后端在测试 JVM 中启动的主类。它用 JUnit Platform Launcher 运行参数中指定的类或方法，
 * 并通过 ProtocolReportingListener 把结果按行输出到标准输出。
 *
 * 退出码：0 全部通过，1 有失败，2 参数错误，3 运行器自身出错。
 * 只有正常跑完（退出码 0 或 1）才会输出 @@testRunFinished，
 * 后端据此区分"有失败的测试"和"运行器中途崩溃"。
 */
package club.ppmc.testrunner.runner;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import org.junit.platform.launcher.Launcher;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder;
import org.junit.platform.launcher.core.LauncherFactory;

public final class JUnitRunnerMain {

    static final int EXIT_OK = 0;
    static final int EXIT_TESTS_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_RUNNER_ERROR = 3;

    private final PrintStream out;
    private final PrintStream err;

    JUnitRunnerMain(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new JUnitRunnerMain(System.out, System.err).run(Arrays.asList(args));
        System.exit(exitCode);
    }

    int run(List<String> args) {
        RunnerArguments arguments;
        try {
            arguments = RunnerArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("[test-runner] " + e.getMessage());
            return EXIT_USAGE;
        }

        LauncherDiscoveryRequest request = LauncherDiscoveryRequestBuilder.request()
                .selectors(arguments.selectors())
                .configurationParameters(arguments.configurationParameters())
                .build();
        ProtocolReportingListener listener = new ProtocolReportingListener(out);
        try {
            Launcher launcher = LauncherFactory.create();
            launcher.execute(request, listener);
        } catch (RuntimeException | LinkageError e) {
            err.println("[test-runner] 运行测试时出错: " + e);
            e.printStackTrace(err);
            return EXIT_RUNNER_ERROR;
        }
        listener.runFinished();
        return listener.hasFailures() ? EXIT_TESTS_FAILED : EXIT_OK;
    }
}
