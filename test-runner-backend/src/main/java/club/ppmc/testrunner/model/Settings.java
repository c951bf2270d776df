/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化测试运行器后端的各项配置。
 * 这些设置由用户通过UI修改，由 SettingsService 负责加载和保存到 .ide/settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.testrunner.model;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class Settings {

    // --- 环境配置 ---
    /**
     * 工作区根目录的绝对路径。所有项目都存放在此目录下。
     */
    private String workspaceRoot = "./workspace";

    /**
     * Maven 的主目录（MAVEN_HOME）。仅在 buildBeforeRun 为 true 时需要。
     */
    private String mavenHome;

    /**
     * 存储多个 JDK 版本的路径。
     * Key: JDK标识符, 如 "jdk11", "jdk17"。
     * Value: 对应JDK的 java 可执行文件的绝对路径。
     */
    private Map<String, String> jdkPaths = new HashMap<>();

    // --- 测试运行器 ---
    /**
     * 测试运行器自身的类路径（例如运行器 jar 的路径），会追加到被测项目的类路径之后。
     */
    private String runnerClasspath;

    /**
     * 测试运行器的主类。它接收测试的完全限定名作为参数，并按行输出 @@testResult 协议。
     */
    private String runnerMainClass = "club.ppmc.testrunner.runner.JUnitRunnerMain";

    /** 运行前是否先执行 Maven 的 test-compile。 */
    private boolean buildBeforeRun = false;

    /** 调试模式下 JDWP 监听的端口。 */
    private int debugPort = 5005;

    // --- 调度与监听 ---
    /** 文件监听器重新注册的防抖间隔。 */
    private long watcherDebounceMillis = 500;

    /** 文件监听器轮询文件系统的间隔。 */
    private long watcherPollIntervalMillis = 1000;

    /** 取消或关闭时等待后端进程确认退出的最长时间。 */
    private long cancelTimeoutMillis = 5000;
}
