/**
 * LanguageServerEventBridge.java
 *
 * 内置的分析服务实现。语言服务器宿主通过 /api/language-server 下的 REST 接口推送通知，
 * 本类把通知分发给已订阅的监听器。可以通过 app.analysis-service.enabled=false 关闭。
 * 未配置 app.analysis-service.initial-mode 时，语言服务器第一次报告之前模式为 UNKNOWN。
 */
package club.ppmc.testrunner.service.analysis;

import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.util.Disposable;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.analysis-service.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LanguageServerEventBridge
        implements ClasspathUpdateEvents, ServerModeChangeEvents, ProjectsImportEvents {

    private final ServerMode initialMode;
    private final List<Runnable> classpathListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ServerMode>> modeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<URI>>> importListeners = new CopyOnWriteArrayList<>();

    public LanguageServerEventBridge(@Value("${app.analysis-service.initial-mode:}") String initialMode) {
        this.initialMode = ServerMode.fromWireName(initialMode);
    }

    @Override
    public ServerMode initialServerMode() {
        return initialMode;
    }

    @Override
    public Disposable onClasspathUpdate(Runnable listener) {
        return subscribe(classpathListeners, listener);
    }

    @Override
    public Disposable onServerModeChange(Consumer<ServerMode> listener) {
        return subscribe(modeListeners, listener);
    }

    @Override
    public Disposable onProjectsImport(Consumer<List<URI>> listener) {
        return subscribe(importListeners, listener);
    }

    public void fireClasspathUpdated() {
        log.debug("收到类路径更新通知，分发给 {} 个监听器", classpathListeners.size());
        classpathListeners.forEach(Runnable::run);
    }

    public void fireServerModeChanged(ServerMode mode) {
        log.info("收到语言服务器模式切换通知: {}", mode.wireName());
        modeListeners.forEach(listener -> listener.accept(mode));
    }

    public void fireProjectsImported(List<URI> projectUris) {
        List<URI> uris = projectUris == null ? List.of() : List.copyOf(projectUris);
        log.info("收到项目导入通知，共 {} 个项目", uris.size());
        importListeners.forEach(listener -> listener.accept(uris));
    }

    private static <T> Disposable subscribe(List<T> listeners, T listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
}
