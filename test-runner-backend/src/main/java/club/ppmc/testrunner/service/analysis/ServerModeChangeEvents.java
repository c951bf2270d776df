package club.ppmc.testrunner.service.analysis;

import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.util.Disposable;
import java.util.function.Consumer;

/**
 * 语言服务器模式切换的通知。
 */
public interface ServerModeChangeEvents extends AnalysisServiceApi {

    Disposable onServerModeChange(Consumer<ServerMode> listener);
}
