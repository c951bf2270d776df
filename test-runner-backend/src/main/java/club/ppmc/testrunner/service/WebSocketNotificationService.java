/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 测试结果、会话状态、资源管理器刷新、调试事件以及运行/构建日志都从这里发往前端对应的主题(topic)。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.model.dto.ExplorerRefreshEvent;
import club.ppmc.testrunner.model.dto.SessionStatusEvent;
import club.ppmc.testrunner.model.dto.WsDebugEvent;
import com.google.gson.Gson;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    public static final String TEST_RESULTS_TOPIC = "/topic/test-results";
    public static final String SESSION_STATUS_TOPIC = "/topic/test-runner/status";
    public static final String EXPLORER_REFRESH_TOPIC = "/topic/test-explorer/refresh";
    public static final String DEBUG_EVENTS_TOPIC = "/topic/debug-events";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送单个测试项的增量结果。
     */
    public void sendTestResult(TestResult result) {
        sendMessage(TEST_RESULTS_TOPIC, gson.toJson(result));
    }

    /**
     * 发送会话状态变化，供状态栏展示。
     */
    public void sendSessionStatus(SessionStatusEvent event) {
        sendMessage(SESSION_STATUS_TOPIC, gson.toJson(event));
    }

    public void sendExplorerRefresh(ExplorerRefreshEvent event) {
        sendMessage(EXPLORER_REFRESH_TOPIC, gson.toJson(event));
    }

    public void sendDebugEvent(WsDebugEvent<?> event) {
        // 泛型记录类型交给Gson手动序列化
        sendMessage(DEBUG_EVENTS_TOPIC, gson.toJson(event));
    }

    public void sendBuildLog(String message) {
        sendMessage("/topic/build-log", message);
    }

    public void sendRunLog(String message) {
        sendMessage("/topic/run-log", message);
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
