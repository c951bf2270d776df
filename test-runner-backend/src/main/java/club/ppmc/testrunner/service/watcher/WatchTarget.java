/**
 * WatchTarget.java
 *
 * 一个监听目标：根目录以及要关注的文件后缀（例如 ".java"）。
 */
package club.ppmc.testrunner.service.watcher;

import java.nio.file.Path;

public record WatchTarget(Path root, String extension) {

    public static WatchTarget javaSources(Path root) {
        return new WatchTarget(root, ".java");
    }
}
