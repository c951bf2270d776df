/**
 * EnvironmentConfigurationException.java
 *
 * 一个自定义的运行时异常，用于表示测试执行环境（如JDK、Maven、测试运行器类路径）未正确配置。
 * 执行后端在派生进程前进行环境校验失败时抛出此异常，调度器会把它作为 LaunchFailed 的原因上报。
 */
package club.ppmc.testrunner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class EnvironmentConfigurationException extends TestRunnerException {

    /** 缺失或无效的组件名称 ("jdk", "maven", "runner")。 */
    private final String missingComponent;

    /**
     * @param message 详细的错误信息，将展示给用户。
     * @param missingComponent 问题组件的标识符。
     */
    public EnvironmentConfigurationException(String message, String missingComponent) {
        super(ErrorCode.ENVIRONMENT_ERROR, message);
        this.missingComponent = missingComponent;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        data.put("missing", missingComponent);
        return data;
    }
}
