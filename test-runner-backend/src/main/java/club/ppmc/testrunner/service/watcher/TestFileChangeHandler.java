/**
 * TestFileChangeHandler.java
 *
 * 把文件监听事件转换为测试浏览器的刷新：
 * 修改时对该文件中的测试项做局部刷新（文件中还没有已知测试项时做全局刷新）；
 * 删除时移除该文件的测试项及其结果，然后全局刷新。
 */
package club.ppmc.testrunner.service.watcher;

import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.service.TestExplorerNotifier;
import club.ppmc.testrunner.service.TestItemRegistry;
import club.ppmc.testrunner.service.TestResultManager;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class TestFileChangeHandler implements FileChangeListener {

    static final String REASON_CHANGED = "file-changed";
    static final String REASON_DELETED = "file-deleted";

    private final TestItemRegistry itemRegistry;
    private final TestResultManager resultManager;
    private final TestExplorerNotifier explorerNotifier;

    public TestFileChangeHandler(
            TestItemRegistry itemRegistry, TestResultManager resultManager, TestExplorerNotifier explorerNotifier) {
        this.itemRegistry = itemRegistry;
        this.resultManager = resultManager;
        this.explorerNotifier = explorerNotifier;
    }

    @Override
    public void onChanged(Path file) {
        List<TestItem> items = itemRegistry.findByUri(file.toUri());
        log.debug("测试文件已修改: {}，涉及 {} 个测试项", file, items.size());
        if (items.isEmpty()) {
            explorerNotifier.refresh(REASON_CHANGED);
            return;
        }
        List<TestItem> suites = items.stream().filter(TestItem::isSuite).toList();
        (suites.isEmpty() ? items : suites).forEach(item -> explorerNotifier.refresh(item, REASON_CHANGED));
    }

    @Override
    public void onDeleted(Path file) {
        List<TestItem> removed = itemRegistry.removeByUri(file.toUri());
        if (!removed.isEmpty()) {
            resultManager.removeResults(removed.stream().map(TestItem::id).toList());
            log.info("测试文件已删除: {}，移除了 {} 个测试项", file, removed.size());
        }
        explorerNotifier.refresh(REASON_DELETED);
    }
}
