/**
 * MavenProjectHelper.java
 *
 * 这是一个帮助类，用于处理与被测Maven项目相关的常见操作：
 * 解析 pom.xml（Java版本、测试源码目录）、选择JDK、执行 test-compile 构建以及拼装测试类路径。
 * 它被设计为无状态的组件，由执行后端和文件监听模块共同注入使用。
 */
package club.ppmc.testrunner.util;

import club.ppmc.testrunner.model.Settings;
import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.service.WebSocketNotificationService;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MavenProjectHelper {

    private static final Logger LOGGER = LoggerFactory.getLogger(MavenProjectHelper.class);
    private static final String DEFAULT_JAVA_VERSION = "17";
    private static final String DEFAULT_TEST_SOURCE_DIRECTORY = "src/test/java";
    private static final List<String> JAVA_VERSION_PROPERTIES =
            List.of("java.version", "maven.compiler.release", "maven.compiler.source");
    private static final boolean IS_WINDOWS = System.getProperty("os.name").toLowerCase().contains("win");

    private final SettingsService settingsService;
    private final WebSocketNotificationService notificationService;

    public MavenProjectHelper(SettingsService settingsService, WebSocketNotificationService notificationService) {
        this.settingsService = settingsService;
        this.notificationService = notificationService;
    }

    public Path getWorkspaceRoot() {
        String workspaceRootPath = settingsService.getSettings().getWorkspaceRoot();
        return Paths.get(workspaceRootPath).toAbsolutePath().normalize();
    }

    public Path resolveProjectDir(String projectName) {
        Path projectDir = getWorkspaceRoot().resolve(projectName).normalize();
        if (!projectDir.startsWith(getWorkspaceRoot())) {
            throw new IllegalArgumentException("项目路径越出了工作区: " + projectName);
        }
        return projectDir;
    }

    /**
     * 读取项目的 pom.xml。文件不存在或无法解析时返回空。
     */
    public Optional<Model> readModel(File projectDir) {
        File pomFile = new File(projectDir, "pom.xml");
        if (!pomFile.isFile()) {
            return Optional.empty();
        }
        try (var fileReader = new FileReader(pomFile, StandardCharsets.UTF_8)) {
            return Optional.of(new MavenXpp3Reader().read(fileReader));
        } catch (IOException | XmlPullParserException e) {
            LOGGER.error("解析 {} 失败", pomFile.getAbsolutePath(), e);
            return Optional.empty();
        }
    }

    /**
     * 从项目的 pom.xml 文件中解析 Java 版本，找不到时回退到默认版本。
     */
    public String getJavaVersionFromPom(File projectDir, Consumer<String> logConsumer) {
        Optional<Model> model = readModel(projectDir);
        if (model.isEmpty()) {
            report(logConsumer, String.format(
                    "信息: 在 %s 中没有可用的 pom.xml。将默认使用 JDK %s。",
                    projectDir.getAbsolutePath(), DEFAULT_JAVA_VERSION));
            return DEFAULT_JAVA_VERSION;
        }
        for (String property : JAVA_VERSION_PROPERTIES) {
            String version = model.get().getProperties().getProperty(property);
            if (StringUtils.hasText(version)) {
                report(logConsumer, String.format("信息: 从 <%s> 属性中检测到 Java 版本 '%s'。", property, version));
                return version.startsWith("1.") ? version.substring(2) : version.trim();
            }
        }
        report(logConsumer, String.format(
                "信息: 在 pom.xml 中未找到指定的Java版本。将默认使用 JDK %s 运行测试。", DEFAULT_JAVA_VERSION));
        return DEFAULT_JAVA_VERSION;
    }

    /**
     * 返回项目的测试源码目录（pom 中的 testSourceDirectory，默认为 src/test/java）。
     */
    public Path getTestSourceDirectory(Path projectDir) {
        String configured = readModel(projectDir.toFile())
                .map(Model::getBuild)
                .map(Build::getTestSourceDirectory)
                .filter(StringUtils::hasText)
                .map(dir -> dir.replace("${project.basedir}/", "").replace("${basedir}/", ""))
                .orElse(DEFAULT_TEST_SOURCE_DIRECTORY);
        return projectDir.resolve(configured).normalize();
    }

    /**
     * 拼装运行测试所需的类路径：test-classes、classes 以及 dependency:copy-dependencies 复制出的依赖。
     */
    public List<String> buildTestClasspath(Path projectDir) throws IOException {
        Path targetDir = projectDir.resolve("target");
        Path testClassesDir = targetDir.resolve("test-classes");
        Path classesDir = targetDir.resolve("classes");
        Path dependencyDir = targetDir.resolve("dependency");

        if (!Files.isDirectory(testClassesDir)) {
            throw new IOException("未找到测试编译输出目录 'target/test-classes'。请先编译项目或开启运行前构建。");
        }

        List<String> entries = new ArrayList<>();
        entries.add(testClassesDir.toAbsolutePath().toString());
        if (Files.isDirectory(classesDir)) {
            entries.add(classesDir.toAbsolutePath().toString());
        }
        if (Files.isDirectory(dependencyDir)) {
            try (Stream<Path> jars = Files.walk(dependencyDir)) {
                jars.filter(path -> path.toString().endsWith(".jar"))
                        .map(path -> path.toAbsolutePath().toString())
                        .sorted()
                        .forEach(entries::add);
            }
        }
        return entries;
    }

    /**
     * 执行Maven构建，并将输出实时流式传输到前端的构建日志。
     *
     * @param onStarted 进程派生后立即以该进程回调，调用方可借此在需要时销毁构建。
     * @return Maven 进程的退出码，无法执行时为 -1。
     */
    public int executeMavenBuild(String projectName, Settings settings, List<String> goals, Consumer<Process> onStarted) {
        try {
            File projectDir = resolveProjectDir(projectName).toFile();
            String mavenHome = settings.getMavenHome();
            String releaseVersion = getJavaVersionFromPom(projectDir, notificationService::sendBuildLog);
            String javaExecutable = selectJdkExecutable(settings, releaseVersion, notificationService::sendBuildLog);

            Path bootDir = Paths.get(mavenHome, "boot");
            File plexusJar;
            try (var stream = Files.list(bootDir)) {
                plexusJar = stream.map(Path::toFile)
                        .filter(file -> file.getName().startsWith("plexus-classworlds") && file.getName().endsWith(".jar"))
                        .findFirst()
                        .orElseThrow(() -> new IOException("在 " + bootDir + " 中找不到 plexus-classworlds JAR。请检查Maven主目录配置。"));
            }

            List<String> command = new ArrayList<>(List.of(
                    javaExecutable,
                    "-cp", plexusJar.getAbsolutePath(),
                    "-Dclassworlds.conf=" + Paths.get(mavenHome, "bin", "m2.conf").toAbsolutePath(),
                    "-Dmaven.home=" + mavenHome,
                    "-Dfile.encoding=UTF-8",
                    "-Dmaven.multiModuleProjectDirectory=" + projectDir.getAbsolutePath(),
                    "-Dmaven.compiler.release=" + releaseVersion,
                    "org.codehaus.plexus.classworlds.launcher.Launcher"));
            command.addAll(goals);

            notificationService.sendBuildLog("执行: " + String.join(" ", command) + " 于 " + projectDir.getAbsolutePath());
            Process process = new ProcessBuilder(command).directory(projectDir).redirectErrorStream(true).start();
            onStarted.accept(process);
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                reader.lines().forEach(notificationService::sendBuildLog);
            }
            return process.waitFor();
        } catch (IOException | InterruptedException e) {
            LOGGER.error("为项目 '{}' 执行Maven构建失败", projectName, e);
            notificationService.sendBuildLog("[致命错误] Maven构建过程失败: " + e.getMessage());
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return -1;
        }
    }

    /**
     * 根据优先级选择要使用的JDK可执行文件：用户配置 → 后端自身的JDK → PATH 中的 java。
     */
    public String selectJdkExecutable(Settings settings, String requiredVersion, Consumer<String> logConsumer) {
        String userDefinedJdkPath = settings.getJdkPaths().get("jdk" + requiredVersion);
        if (StringUtils.hasText(userDefinedJdkPath) && Files.isExecutable(Paths.get(userDefinedJdkPath))) {
            report(logConsumer, String.format("信息: 使用用户为 JDK %s 配置的路径: %s", requiredVersion, userDefinedJdkPath));
            return userDefinedJdkPath;
        }

        Path javaHome = Paths.get(System.getProperty("java.home"));
        Path backendJdkExecutable = javaHome.resolve(IS_WINDOWS ? "bin/java.exe" : "bin/java");
        if (Files.isExecutable(backendJdkExecutable)) {
            report(logConsumer, String.format(
                    "信息: 未找到用户为 JDK %s 配置的有效路径。将回退到后端自身的 JDK。", requiredVersion));
            return backendJdkExecutable.toAbsolutePath().toString();
        }

        LOGGER.warn("无法找到任何已配置的或内置的JDK，回退到系统PATH中的'java'命令。");
        report(logConsumer, "警告: 无法找到任何已配置的或内置的JDK。将回退到使用系统PATH中的'java'命令。");
        return "java";
    }

    private void report(Consumer<String> logConsumer, String message) {
        LOGGER.info(message);
        if (logConsumer != null) {
            logConsumer.accept(message);
        }
    }
}
