/**
 * DebugAttachment.java
 *
 * 一次调试器附加。持有 VM 连接和 JDI 事件线程，dispose 后二者都被释放。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.dto.WsDebugEvent;
import club.ppmc.testrunner.service.WebSocketNotificationService;
import club.ppmc.testrunner.util.Disposable;
import com.sun.jdi.VMDisconnectedException;
import com.sun.jdi.VirtualMachine;
import com.sun.jdi.event.Event;
import com.sun.jdi.event.EventQueue;
import com.sun.jdi.event.EventSet;
import com.sun.jdi.event.VMDeathEvent;
import com.sun.jdi.event.VMDisconnectEvent;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class DebugAttachment implements Disposable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebugAttachment.class);

    private final String sessionId;
    private final VirtualMachine vm;
    private final WebSocketNotificationService notificationService;
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicBoolean terminatedSent = new AtomicBoolean(false);
    private volatile Thread eventThread;

    DebugAttachment(String sessionId, VirtualMachine vm, WebSocketNotificationService notificationService) {
        this.sessionId = sessionId;
        this.vm = vm;
        this.notificationService = notificationService;
    }

    void startEventHandling() {
        eventThread = new Thread(() -> {
            try {
                EventQueue eventQueue = vm.eventQueue();
                while (!Thread.currentThread().isInterrupted()) {
                    EventSet eventSet = eventQueue.remove();
                    boolean vmGone = false;
                    for (Event event : eventSet) {
                        if (event instanceof VMDisconnectEvent || event instanceof VMDeathEvent) {
                            vmGone = true;
                        }
                    }
                    if (vmGone) {
                        LOGGER.info("会话 {} 的被调试 VM 已结束。", sessionId);
                        sendTerminated();
                        return;
                    }
                    eventSet.resume();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (VMDisconnectedException e) {
                LOGGER.info("会话 {} 的 VM 在事件处理期间断开连接。", sessionId);
                sendTerminated();
            }
        }, "JDI-Event-Handler-" + sessionId);
        eventThread.setDaemon(true);
        eventThread.start();
    }

    String description() {
        return vm.description();
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        Thread thread = eventThread;
        if (thread != null && thread.isAlive()) {
            thread.interrupt();
        }
        try {
            vm.dispose();
            LOGGER.info("会话 {} 的 VM 连接已释放。", sessionId);
        } catch (VMDisconnectedException e) {
            LOGGER.info("会话 {} 的 VM 在清理时已断开连接。", sessionId);
        }
        sendTerminated();
    }

    private void sendTerminated() {
        if (terminatedSent.compareAndSet(false, true)) {
            notificationService.sendDebugEvent(new WsDebugEvent<>("TERMINATED", Map.of("sessionId", sessionId)));
        }
    }
}
