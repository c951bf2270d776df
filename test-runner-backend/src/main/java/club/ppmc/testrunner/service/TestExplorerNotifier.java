/**
 * TestExplorerNotifier.java
 *
 * 向展示层（测试资源管理器、CodeLens）发出"刷新"信号。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.model.dto.ExplorerRefreshEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestExplorerNotifier {

    private final WebSocketNotificationService notificationService;

    public TestExplorerNotifier(WebSocketNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    public void refresh(String reason) {
        log.debug("请求全量刷新测试资源管理器: {}", reason);
        notificationService.sendExplorerRefresh(new ExplorerRefreshEvent(null, reason));
    }

    public void refresh(TestItem item, String reason) {
        notificationService.sendExplorerRefresh(new ExplorerRefreshEvent(item.id(), reason));
    }
}
