/**
 * CommonsIoFileWatcherFactory.java
 *
 * 基于 commons-io 的 FileAlterationMonitor 的轮询式文件监听。
 * 轮询间隔取自设置中的 watcherPollIntervalMillis，创建时生效。
 */
package club.ppmc.testrunner.service.watcher;

import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.util.Disposable;
import java.io.File;
import java.io.FileFilter;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.HiddenFileFilter;
import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CommonsIoFileWatcherFactory implements FileWatcherFactory {

    private final SettingsService settingsService;

    public CommonsIoFileWatcherFactory(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public Disposable watch(WatchTarget target, FileChangeListener listener) {
        FileFilter filter = FileFilterUtils.and(
                HiddenFileFilter.VISIBLE,
                FileFilterUtils.or(
                        FileFilterUtils.directoryFileFilter(),
                        FileFilterUtils.suffixFileFilter(target.extension())));
        var observer = new FileAlterationObserver(target.root().toFile(), filter);
        observer.addListener(new FileAlterationListenerAdaptor() {
            @Override
            public void onFileChange(File file) {
                listener.onChanged(file.toPath());
            }

            @Override
            public void onFileDelete(File file) {
                listener.onDeleted(file.toPath());
            }
        });

        var monitor = new FileAlterationMonitor(settingsService.getSettings().getWatcherPollIntervalMillis(), observer);
        monitor.setThreadFactory(new CustomizableThreadFactory("file-watcher-"));
        try {
            monitor.start();
        } catch (Exception e) {
            throw new IllegalStateException("无法启动对 " + target.root() + " 的文件监听: " + e.getMessage(), e);
        }
        log.debug("开始监听 {} 下的 *{} 文件", target.root(), target.extension());
        return new MonitorSubscription(target, monitor);
    }

    private static final class MonitorSubscription implements Disposable {

        private final WatchTarget target;
        private final FileAlterationMonitor monitor;
        private final AtomicBoolean disposed = new AtomicBoolean(false);

        private MonitorSubscription(WatchTarget target, FileAlterationMonitor monitor) {
            this.target = target;
            this.monitor = monitor;
        }

        @Override
        public void dispose() {
            if (!disposed.compareAndSet(false, true)) {
                return;
            }
            try {
                // 等待轮询线程退出，之后不会再有回调
                monitor.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("停止对 " + target.root() + " 的监听时被中断", e);
            } catch (Exception e) {
                throw new IllegalStateException("停止对 " + target.root() + " 的监听失败: " + e.getMessage(), e);
            }
        }

        @Override
        public String toString() {
            return "FileWatcher[" + target.root() + ", *" + target.extension() + "]";
        }
    }
}
