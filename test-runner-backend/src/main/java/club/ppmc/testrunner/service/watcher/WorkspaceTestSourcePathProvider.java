/**
 * WorkspaceTestSourcePathProvider.java
 *
 * 扫描工作区的一级子目录，每个带 pom.xml 的目录视为一个 Maven 项目，
 * 测试源码根目录取自 pom 的 testSourceDirectory（默认 src/test/java）。
 */
package club.ppmc.testrunner.service.watcher;

import club.ppmc.testrunner.util.MavenProjectHelper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

@Component
public class WorkspaceTestSourcePathProvider implements TestSourcePathProvider {

    private final MavenProjectHelper mavenHelper;

    public WorkspaceTestSourcePathProvider(MavenProjectHelper mavenHelper) {
        this.mavenHelper = mavenHelper;
    }

    @Override
    public List<Path> getTestSourceRoots() {
        Path workspaceRoot = getWorkspaceRoot();
        if (!Files.isDirectory(workspaceRoot)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(workspaceRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> !dir.getFileName().toString().startsWith("."))
                    .filter(dir -> Files.isRegularFile(dir.resolve("pom.xml")))
                    .sorted()
                    .map(mavenHelper::getTestSourceDirectory)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("无法列出工作区 " + workspaceRoot + " 中的项目", e);
        }
    }

    @Override
    public Path getWorkspaceRoot() {
        return mavenHelper.getWorkspaceRoot();
    }
}
