/**
 * TestRunService.java
 *
 * 前端运行/调试命令的入口：把测试项 id 解析为测试项，组装 RunRequest 后交给调度器。
 * 启动条件不满足（例如运行器未配置）时调度器同步结束会话，这里把失败原样抛给调用方。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.exception.EnvironmentConfigurationException;
import club.ppmc.testrunner.exception.InvalidRequestException;
import club.ppmc.testrunner.exception.LaunchFailedException;
import club.ppmc.testrunner.model.LaunchConfiguration;
import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.RunRequest;
import club.ppmc.testrunner.model.SessionState;
import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.scheduler.SessionHandle;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestRunService {

    private final TestItemRegistry itemRegistry;
    private final RunnerScheduler scheduler;
    private final TestExplorerNotifier explorerNotifier;

    public TestRunService(TestItemRegistry itemRegistry, RunnerScheduler scheduler, TestExplorerNotifier explorerNotifier) {
        this.itemRegistry = itemRegistry;
        this.scheduler = scheduler;
        this.explorerNotifier = explorerNotifier;
    }

    public SessionHandle runOne(String testId, RunMode mode) {
        TestItem item = itemRegistry.require(testId);
        return submit(RunRequest.of(List.of(item), mode, null));
    }

    public SessionHandle runAll(RunMode mode) {
        return submit(RunRequest.of(itemRegistry.runAllTargets(), mode, null));
    }

    /**
     * 运行某个源文件中的全部测试：有测试类时运行测试类，否则运行文件中登记的所有测试项。
     *
     * @throws InvalidRequestException 文件中没有登记任何测试项。
     */
    public SessionHandle runFile(URI uri, RunMode mode) {
        List<TestItem> items = itemRegistry.findByUri(uri);
        List<TestItem> suites = items.stream().filter(TestItem::isSuite).toList();
        List<TestItem> targets = suites.isEmpty() ? items : suites;
        if (targets.isEmpty()) {
            throw new InvalidRequestException("文件 " + uri + " 中没有已登记的测试。");
        }
        return submit(RunRequest.of(targets, mode, null));
    }

    public SessionHandle runSelection(List<String> testIds, RunMode mode, LaunchConfiguration launchConfiguration) {
        return submit(RunRequest.of(resolve(testIds), mode, launchConfiguration));
    }

    public int enqueue(List<String> testIds, RunMode mode, LaunchConfiguration launchConfiguration) {
        return scheduler.enqueue(RunRequest.of(resolve(testIds), mode, launchConfiguration));
    }

    public SessionHandle relaunch() {
        return surfaceLaunchFailure(scheduler.relaunch());
    }

    public void cancel() {
        scheduler.cleanUp(true);
    }

    /**
     * 刷新测试资源管理器。itemId 为 null 时全量刷新。
     *
     * @throws club.ppmc.testrunner.exception.UnknownTestItemException 指定的测试项不存在。
     */
    public void refreshExplorer(String itemId) {
        if (itemId == null) {
            explorerNotifier.refresh("用户请求刷新");
            return;
        }
        explorerNotifier.refresh(itemRegistry.require(itemId), "用户请求刷新");
    }

    private SessionHandle submit(RunRequest request) {
        return surfaceLaunchFailure(scheduler.submit(request));
    }

    /**
     * 会话在返回前就已启动失败时，抛出失败原因；环境配置错误优先于包装它的 LaunchFailedException。
     */
    private static SessionHandle surfaceLaunchFailure(SessionHandle handle) {
        if (handle.session().getState() == SessionState.FAILED
                && handle.session().getFailure() instanceof LaunchFailedException launchFailed) {
            if (launchFailed.getCause() instanceof EnvironmentConfigurationException environmentError) {
                throw environmentError;
            }
            throw launchFailed;
        }
        return handle;
    }

    private List<TestItem> resolve(List<String> testIds) {
        if (testIds == null) {
            return List.of();
        }
        return testIds.stream().map(itemRegistry::require).toList();
    }
}
