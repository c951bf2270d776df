/**
 * DebouncedWatcherRegistry.java
 *
 * 根据语言服务器当前的模式维护一组测试文件监听器。
 * 类路径更新、项目导入这类成串到达的通知走防抖路径，只有一串调用中的最后一次会真正重新绑定；
 * 模式切换走立即路径，并取消尚未触发的防抖绑定。
 * 重新绑定时先释放旧的监听器，再创建新的，对调用方而言替换是原子的。
 */
package club.ppmc.testrunner.service.watcher;

import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.service.ServerModeTracker;
import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.util.Disposable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class DebouncedWatcherRegistry {

    private final ServerModeTracker modeTracker;
    private final TestSourcePathProvider pathProvider;
    private final FileWatcherFactory watcherFactory;
    private final FileChangeListener changeListener;
    private final SettingsService settingsService;
    private final CancellableTimer debounceTimer;

    private final Object lock = new Object();
    private List<Disposable> activeWatchers = List.of();
    private ServerMode boundMode;
    private int bindCount;
    private boolean disposed;

    public DebouncedWatcherRegistry(
            ServerModeTracker modeTracker,
            TestSourcePathProvider pathProvider,
            FileWatcherFactory watcherFactory,
            FileChangeListener changeListener,
            SettingsService settingsService,
            @Qualifier("watcherDebounceScheduler") ScheduledExecutorService debounceScheduler) {
        this.modeTracker = modeTracker;
        this.pathProvider = pathProvider;
        this.watcherFactory = watcherFactory;
        this.changeListener = changeListener;
        this.settingsService = settingsService;
        this.debounceTimer = new CancellableTimer(debounceScheduler);
    }

    /**
     * 重新绑定文件监听器。
     *
     * @param debounce true 时重新开始防抖计时，计时结束时才绑定；false 时取消待定的防抖绑定并立即绑定。
     */
    public void registerListeners(boolean debounce) {
        if (debounce) {
            debounceTimer.arm(settingsService.getSettings().getWatcherDebounceMillis(), this::rebind);
        } else {
            debounceTimer.cancel();
            rebind();
        }
    }

    /**
     * 取消待定的绑定并释放当前所有监听器。之后的 registerListeners 调用不再生效。
     */
    public void dispose() {
        debounceTimer.cancel();
        synchronized (lock) {
            disposed = true;
            disposeActive();
            boundMode = null;
        }
        log.info("测试文件监听器已全部释放。");
    }

    public int getActiveWatcherCount() {
        synchronized (lock) {
            return activeWatchers.size();
        }
    }

    public ServerMode getBoundMode() {
        synchronized (lock) {
            return boundMode;
        }
    }

    public int getBindCount() {
        synchronized (lock) {
            return bindCount;
        }
    }

    public boolean isDebouncePending() {
        return debounceTimer.isArmed();
    }

    private void rebind() {
        synchronized (lock) {
            if (disposed) {
                log.debug("监听器注册表已释放，忽略重新绑定。");
                return;
            }
            disposeActive();

            ServerMode mode = modeTracker.get();
            List<Disposable> bound = new ArrayList<>();
            for (WatchTarget target : targetsFor(mode)) {
                try {
                    bound.add(watcherFactory.watch(target, changeListener));
                } catch (RuntimeException e) {
                    log.error("无法创建对 {} 的文件监听", target.root(), e);
                }
            }
            activeWatchers = List.copyOf(bound);
            boundMode = mode;
            bindCount++;
            log.info("已按 {} 模式绑定 {} 个测试文件监听器。", mode.wireName(), bound.size());
        }
    }

    private List<WatchTarget> targetsFor(ServerMode mode) {
        return switch (mode) {
            // 服务器正在切换，随后会有模式变更通知
            case HYBRID -> List.of();
            case LIGHT_WEIGHT -> List.of(WatchTarget.javaSources(pathProvider.getWorkspaceRoot()));
            case STANDARD, UNKNOWN -> testSourceTargets();
        };
    }

    private List<WatchTarget> testSourceTargets() {
        List<Path> roots;
        try {
            roots = pathProvider.getTestSourceRoots();
        } catch (RuntimeException e) {
            log.error("无法获取测试源码目录，本次不创建监听器", e);
            return List.of();
        }
        return roots.stream().map(WatchTarget::javaSources).toList();
    }

    private void disposeActive() {
        int failures = Disposable.disposeAll(activeWatchers);
        if (failures > 0) {
            log.warn("释放旧的监听器时有 {} 个失败。", failures);
        }
        activeWatchers = List.of();
    }
}
