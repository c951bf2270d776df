/**
 * TestRunnerActivator.java
 *
 * 测试运行模块的生命周期入口。
 * 激活时订阅分析服务提供的通知（实现了哪个能力接口就订阅哪个，只探测一次），
 * 立即按当前模式绑定文件监听器，并初始化调度器；
 * 停用时拆除正在运行的会话，取消订阅并释放监听器。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.exception.CancelTimeoutException;
import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.service.analysis.AnalysisServiceApi;
import club.ppmc.testrunner.service.analysis.ClasspathUpdateEvents;
import club.ppmc.testrunner.service.analysis.ProjectsImportEvents;
import club.ppmc.testrunner.service.analysis.ServerModeChangeEvents;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.watcher.DebouncedWatcherRegistry;
import club.ppmc.testrunner.util.Disposable;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestRunnerActivator {

    static final String REASON_MODE_CHANGED = "server-mode-changed";

    private final ObjectProvider<AnalysisServiceApi> analysisServiceProvider;
    private final ServerModeTracker modeTracker;
    private final DebouncedWatcherRegistry watcherRegistry;
    private final RunnerScheduler scheduler;
    private final TestExplorerNotifier explorerNotifier;

    private final List<Disposable> subscriptions = new ArrayList<>();

    public TestRunnerActivator(
            ObjectProvider<AnalysisServiceApi> analysisServiceProvider,
            ServerModeTracker modeTracker,
            DebouncedWatcherRegistry watcherRegistry,
            RunnerScheduler scheduler,
            TestExplorerNotifier explorerNotifier) {
        this.analysisServiceProvider = analysisServiceProvider;
        this.modeTracker = modeTracker;
        this.watcherRegistry = watcherRegistry;
        this.scheduler = scheduler;
        this.explorerNotifier = explorerNotifier;
    }

    @PostConstruct
    public synchronized void activate() {
        AnalysisServiceApi analysisService = analysisServiceProvider.getIfAvailable();
        if (analysisService == null) {
            log.warn("没有可用的分析服务，测试文件监听将保持在 {} 模式。", modeTracker.get().wireName());
        } else {
            modeTracker.set(analysisService.initialServerMode());
            subscribe(analysisService);
        }
        watcherRegistry.registerListeners(false);
        scheduler.initialize();
        log.info("测试运行模块已激活，语言服务器模式: {}", modeTracker.get().wireName());
    }

    @PreDestroy
    public synchronized void deactivate() {
        log.info("正在停用测试运行模块...");
        try {
            scheduler.cleanUp(false);
        } catch (CancelTimeoutException e) {
            log.error("停用时未能确认测试会话已终止: {}", e.getMessage());
        }
        int failures = Disposable.disposeAll(subscriptions);
        if (failures > 0) {
            log.warn("取消 {} 个分析服务订阅时失败。", failures);
        }
        subscriptions.clear();
        watcherRegistry.dispose();
    }

    void onServerModeChange(ServerMode mode) {
        if (!modeTracker.set(mode)) {
            log.debug("语言服务器模式未变化 ({})，忽略。", mode.wireName());
            return;
        }
        log.info("语言服务器模式切换为 {}", modeTracker.get().wireName());
        explorerNotifier.refresh(REASON_MODE_CHANGED);
        watcherRegistry.registerListeners(false);
    }

    void onClasspathUpdate() {
        watcherRegistry.registerListeners(true);
    }

    void onProjectsImport(List<URI> projectUris) {
        log.debug("{} 个项目导入完成", projectUris.size());
        watcherRegistry.registerListeners(true);
    }

    private void subscribe(AnalysisServiceApi analysisService) {
        if (analysisService instanceof ClasspathUpdateEvents classpathEvents) {
            subscriptions.add(classpathEvents.onClasspathUpdate(this::onClasspathUpdate));
        }
        if (analysisService instanceof ServerModeChangeEvents modeEvents) {
            subscriptions.add(modeEvents.onServerModeChange(this::onServerModeChange));
        }
        if (analysisService instanceof ProjectsImportEvents importEvents) {
            subscriptions.add(importEvents.onProjectsImport(this::onProjectsImport));
        }
        log.info("已订阅分析服务的 {} 类通知。", subscriptions.size());
    }
}
