/**
 * LanguageServerController.java
 *
 * 语言服务器宿主推送通知的入口：类路径更新、模式切换、项目导入。
 * 通知由 LanguageServerEventBridge 分发；桥接被关闭时这些接口返回 404。
 */
package club.ppmc.testrunner.controller;

import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.model.dto.ProjectsImportedRequest;
import club.ppmc.testrunner.model.dto.ServerModeChangeRequest;
import club.ppmc.testrunner.service.ServerModeTracker;
import club.ppmc.testrunner.service.analysis.LanguageServerEventBridge;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.watcher.DebouncedWatcherRegistry;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/language-server")
public class LanguageServerController {

    private final ObjectProvider<LanguageServerEventBridge> bridgeProvider;
    private final ServerModeTracker modeTracker;
    private final DebouncedWatcherRegistry watcherRegistry;
    private final RunnerScheduler scheduler;

    public LanguageServerController(
            ObjectProvider<LanguageServerEventBridge> bridgeProvider,
            ServerModeTracker modeTracker,
            DebouncedWatcherRegistry watcherRegistry,
            RunnerScheduler scheduler) {
        this.bridgeProvider = bridgeProvider;
        this.modeTracker = modeTracker;
        this.watcherRegistry = watcherRegistry;
        this.scheduler = scheduler;
    }

    @PostMapping("/classpath-updated")
    public ResponseEntity<Map<String, String>> classpathUpdated() {
        return dispatch(LanguageServerEventBridge::fireClasspathUpdated);
    }

    @PostMapping("/server-mode")
    public ResponseEntity<Map<String, String>> serverModeChanged(@RequestBody @Valid ServerModeChangeRequest request) {
        ServerMode mode = ServerMode.fromWireName(request.mode());
        return dispatch(bridge -> bridge.fireServerModeChanged(mode));
    }

    @PostMapping("/projects-imported")
    public ResponseEntity<Map<String, String>> projectsImported(@RequestBody ProjectsImportedRequest request) {
        return dispatch(bridge -> bridge.fireProjectsImported(request.projectUris()));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        var body = new LinkedHashMap<String, Object>();
        body.put("serverMode", modeTracker.get().wireName());
        body.put("standardReady", modeTracker.isStandardReady());
        body.put("boundMode", watcherRegistry.getBoundMode() == null ? null : watcherRegistry.getBoundMode().wireName());
        body.put("activeWatchers", watcherRegistry.getActiveWatcherCount());
        body.put("debouncePending", watcherRegistry.isDebouncePending());
        body.put("schedulerState", scheduler.getState());
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, String>> dispatch(Consumer<LanguageServerEventBridge> action) {
        LanguageServerEventBridge bridge = bridgeProvider.getIfAvailable();
        if (bridge == null) {
            return ResponseEntity.status(404).body(Map.of("message", "语言服务器事件桥接未启用。"));
        }
        action.accept(bridge);
        return ResponseEntity.ok(Map.of("message", "通知已接收。"));
    }
}
