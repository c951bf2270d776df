/**
 * AnalysisServiceApi.java
 *
 * 语言分析服务（Java 语言服务器）对测试运行模块暴露的接口。
 * 通知能力是可选的，分别由 ClasspathUpdateEvents、ServerModeChangeEvents、ProjectsImportEvents 表示，
 * 实现类实现了哪些子接口，就具备哪些能力。
 */
package club.ppmc.testrunner.service.analysis;

import club.ppmc.testrunner.model.ServerMode;

public interface AnalysisServiceApi {

    /**
     * 激活时语言服务器所处的模式。
     */
    ServerMode initialServerMode();
}
