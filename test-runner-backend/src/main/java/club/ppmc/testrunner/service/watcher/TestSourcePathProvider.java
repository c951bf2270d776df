/**
 * TestSourcePathProvider.java
 *
 * 提供当前工作区中各项目的测试源码根目录。
 */
package club.ppmc.testrunner.service.watcher;

import java.nio.file.Path;
import java.util.List;

public interface TestSourcePathProvider {

    List<Path> getTestSourceRoots();

    Path getWorkspaceRoot();
}
