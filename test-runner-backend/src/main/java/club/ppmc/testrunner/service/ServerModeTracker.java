/**
 * ServerModeTracker.java
 *
 * 持有外部语言服务器最近一次报告的运行模式。纯状态，不发起任何I/O。
 * 只由模式变更通知的处理者写入；以 Bean 的形式注入，测试中可以单独构造。
 */
package club.ppmc.testrunner.service;

import club.ppmc.testrunner.model.ServerMode;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class ServerModeTracker {

    private final AtomicReference<ServerMode> mode = new AtomicReference<>(ServerMode.UNKNOWN);

    public ServerMode get() {
        return mode.get();
    }

    /**
     * 保存新的模式。
     *
     * @return 新模式与之前的值不同时返回 true。
     */
    public boolean set(ServerMode newMode) {
        ServerMode value = newMode == null ? ServerMode.UNKNOWN : newMode;
        return mode.getAndSet(value) != value;
    }

    /**
     * 标准模式已就绪。UNKNOWN 视为就绪：不报告模式的老版本语言服务器总是运行在标准模式。
     */
    public boolean isStandardReady() {
        ServerMode current = mode.get();
        return current == ServerMode.UNKNOWN || current == ServerMode.STANDARD;
    }

    public boolean isLightWeight() {
        return mode.get() == ServerMode.LIGHT_WEIGHT;
    }

    public boolean isHybrid() {
        return mode.get() == ServerMode.HYBRID;
    }
}
