/**
 * TestItemRegistry.java
 *
 * 保存外部发现服务推送过来的测试项。
 * 测试项按源文件整体替换：一个文件重新被发现时，旧的测试项全部丢弃，由新的一组取代。
 * 文件被删除时，由文件监听器调用 removeByUri 移除该文件下的所有测试项。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.exception.UnknownTestItemException;
import club.ppmc.testrunner.model.TestItem;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestItemRegistry {

    private final Map<String, TestItem> itemsById = new LinkedHashMap<>();
    private final Map<String, List<TestItem>> itemsByFile = new LinkedHashMap<>();

    /**
     * 注册一批测试项。按源文件分组后，每个文件的旧测试项被整体替换。
     */
    public synchronized void register(List<TestItem> items) {
        Map<String, List<TestItem>> grouped = items.stream()
                .collect(Collectors.groupingBy(item -> fileKey(item.uri()), LinkedHashMap::new, Collectors.toList()));
        grouped.forEach(this::replaceFile);
        log.info("已注册 {} 个测试项，涉及 {} 个文件。", items.size(), grouped.size());
    }

    /**
     * 用一组新的测试项替换某个文件下的全部测试项。
     */
    public synchronized void replace(URI uri, List<TestItem> items) {
        replaceFile(fileKey(uri), items);
    }

    public synchronized Optional<TestItem> findById(String id) {
        return Optional.ofNullable(itemsById.get(id));
    }

    public TestItem require(String id) {
        return findById(id).orElseThrow(() -> new UnknownTestItemException(id));
    }

    /**
     * 按完全限定名查找测试项。多个项目中存在同名测试时，优先返回 preferredProjects 中的。
     */
    public synchronized Optional<TestItem> findByFullName(Collection<String> preferredProjects, String fullName) {
        return itemsById.values().stream()
                .filter(item -> item.fullName().equals(fullName))
                .min(Comparator.comparing((TestItem item) -> !preferredProjects.contains(item.projectName())));
    }

    public synchronized List<TestItem> findByUri(URI uri) {
        return List.copyOf(itemsByFile.getOrDefault(fileKey(uri), List.of()));
    }

    /**
     * 移除某个文件下的所有测试项。
     *
     * @return 被移除的测试项。
     */
    public synchronized List<TestItem> removeByUri(URI uri) {
        List<TestItem> removed = itemsByFile.remove(fileKey(uri));
        if (removed == null) {
            return List.of();
        }
        removed.forEach(item -> itemsById.remove(item.id()));
        log.info("文件 {} 已删除，移除了 {} 个测试项。", uri, removed.size());
        return List.copyOf(removed);
    }

    public synchronized List<TestItem> all() {
        return List.copyOf(itemsById.values());
    }

    /**
     * "全部运行"的目标：所有测试类；没有登记测试类时退化为所有测试项。
     */
    public synchronized List<TestItem> runAllTargets() {
        List<TestItem> suites = itemsById.values().stream()
                .filter(TestItem::isSuite)
                .sorted(Comparator.comparing(TestItem::id))
                .toList();
        return suites.isEmpty() ? List.copyOf(itemsById.values()) : suites;
    }

    private void replaceFile(String key, List<TestItem> items) {
        List<TestItem> previous = itemsByFile.remove(key);
        if (previous != null) {
            previous.forEach(item -> itemsById.remove(item.id()));
        }
        if (items.isEmpty()) {
            return;
        }
        itemsByFile.put(key, new ArrayList<>(items));
        items.forEach(item -> itemsById.put(item.id(), item));
    }

    /**
     * file: URI 统一规范化为绝对路径，避免 "file:/a" 和 "file:///a" 被视为不同文件。
     */
    static String fileKey(URI uri) {
        if ("file".equalsIgnoreCase(uri.getScheme())) {
            return Path.of(uri).toAbsolutePath().normalize().toString();
        }
        return uri.normalize().toString();
    }
}
