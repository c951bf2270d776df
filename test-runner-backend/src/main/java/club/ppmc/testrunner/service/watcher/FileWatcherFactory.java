/**
 * FileWatcherFactory.java
 *
 * 文件监听器的工厂。返回的 Disposable 用于停止监听。
 */
package club.ppmc.testrunner.service.watcher;

import club.ppmc.testrunner.util.Disposable;

public interface FileWatcherFactory {

    Disposable watch(WatchTarget target, FileChangeListener listener);
}
