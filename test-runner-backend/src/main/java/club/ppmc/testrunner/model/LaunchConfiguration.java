/**
 * LaunchConfiguration.java
 *
 * 调用方提供的可选启动配置（环境变量、JVM参数、程序参数、工作目录）。
 * 对调度器是不透明的，只会原样转发给执行后端。
 */
package club.ppmc.testrunner.model;

import java.util.List;
import java.util.Map;

public record LaunchConfiguration(
        String name,
        Map<String, String> env,
        List<String> vmArgs,
        List<String> args,
        String workingDirectory) {

    public LaunchConfiguration {
        env = env == null ? Map.of() : Map.copyOf(env);
        vmArgs = vmArgs == null ? List.of() : List.copyOf(vmArgs);
        args = args == null ? List.of() : List.copyOf(args);
    }
}
