/**
 * DebugSessionAttacher.java
 *
 * 通过 JDI 的 dt_socket 连接器附加到以 JDWP 代理启动的测试进程，附加后恢复 VM 的执行。
 * 断点与单步由前端的调试面板另行管理，这里只负责建立和拆除连接。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.dto.DebugAttachedData;
import club.ppmc.testrunner.model.dto.WsDebugEvent;
import club.ppmc.testrunner.service.WebSocketNotificationService;
import com.sun.jdi.Bootstrap;
import com.sun.jdi.VirtualMachine;
import com.sun.jdi.VirtualMachineManager;
import com.sun.jdi.connect.AttachingConnector;
import com.sun.jdi.connect.Connector;
import com.sun.jdi.connect.IllegalConnectorArgumentsException;
import java.io.IOException;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DebugSessionAttacher {

    private static final Logger LOGGER = LoggerFactory.getLogger(DebugSessionAttacher.class);
    private static final Pattern ADDRESS_PORT = Pattern.compile("address:\\s*(?:[^\\s:]*:)?(\\d+)");
    private static final String ATTACH_TIMEOUT_MILLIS = "10000";

    private final WebSocketNotificationService notificationService;

    public DebugSessionAttacher(WebSocketNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    /**
     * 从 JDWP 监听日志中解析实际端口，解析不到时使用配置的端口。
     */
    static int resolvePort(String listeningLine, int configuredPort) {
        if (listeningLine != null) {
            Matcher matcher = ADDRESS_PORT.matcher(listeningLine);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return configuredPort;
    }

    /**
     * 附加并恢复 VM。附加完成时若 cancelled 已为真，则断开连接且不恢复执行。
     *
     * @throws LaunchCancelledException 附加期间会话被请求终止。
     */
    DebugAttachment attach(String sessionId, int port, BooleanSupplier cancelled) throws IOException {
        VirtualMachine vm;
        try {
            vm = attachToVm(port);
        } catch (IllegalConnectorArgumentsException e) {
            throw new IOException("调试连接参数无效: " + e.getMessage(), e);
        }
        LOGGER.info("会话 {} 已附加到 VM: {}", sessionId, vm.description());

        DebugAttachment attachment = new DebugAttachment(sessionId, vm, notificationService);
        if (cancelled.getAsBoolean()) {
            attachment.dispose();
            throw new LaunchCancelledException(sessionId, "附加调试器");
        }
        attachment.startEventHandling();
        // 进程以 suspend=y 启动，附加完成后才开始执行测试
        vm.resume();
        notificationService.sendDebugEvent(
                new WsDebugEvent<>("ATTACHED", new DebugAttachedData(sessionId, port, vm.description())));
        return attachment;
    }

    private VirtualMachine attachToVm(int port) throws IOException, IllegalConnectorArgumentsException {
        VirtualMachineManager vmm = Bootstrap.virtualMachineManager();
        AttachingConnector connector = vmm.attachingConnectors().stream()
                .filter(c -> "dt_socket".equals(c.transport().name()))
                .findFirst()
                .orElseThrow(() -> new IOException("找不到 dt_socket attaching connector"));

        Map<String, Connector.Argument> arguments = connector.defaultArguments();
        arguments.get("port").setValue(String.valueOf(port));
        arguments.get("hostname").setValue("localhost");
        arguments.get("timeout").setValue(ATTACH_TIMEOUT_MILLIS);
        return connector.attach(arguments);
    }
}
