/**
 * RunnerArguments.java
 *
 * 运行器的命令行参数：
 * <pre>
 * [key=value ...] -- 目标1 目标2 ...
 * </pre>
 * "--" 之前的 key=value 作为 JUnit Platform 的配置参数，之后是要运行的目标。
 * 目标可以是类名 "com.example.FooTest"，也可以是方法 "com.example.FooTest#bar"。
 * 没有 "--" 时全部参数都视为目标。
 */
package club.ppmc.testrunner.runner;

import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClass;
import static org.junit.platform.engine.discovery.DiscoverySelectors.selectMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.platform.engine.DiscoverySelector;

final class RunnerArguments {

    static final String TARGETS_SEPARATOR = "--";

    private final Map<String, String> configurationParameters;
    private final List<String> targets;

    private RunnerArguments(Map<String, String> configurationParameters, List<String> targets) {
        this.configurationParameters = configurationParameters;
        this.targets = targets;
    }

    static RunnerArguments parse(List<String> args) {
        int separator = args.indexOf(TARGETS_SEPARATOR);
        List<String> options = separator < 0 ? Collections.<String>emptyList() : args.subList(0, separator);
        List<String> targets = separator < 0 ? args : args.subList(separator + 1, args.size());

        Map<String, String> parameters = new LinkedHashMap<>();
        for (String option : options) {
            int eq = option.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("无法识别的运行器参数: " + option);
            }
            parameters.put(option.substring(0, eq).trim(), option.substring(eq + 1));
        }

        List<String> cleaned = new ArrayList<>();
        for (String target : targets) {
            if (!target.trim().isEmpty()) {
                cleaned.add(target.trim());
            }
        }
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("没有指定要运行的测试。");
        }
        return new RunnerArguments(parameters, cleaned);
    }

    Map<String, String> configurationParameters() {
        return configurationParameters;
    }

    List<String> targets() {
        return targets;
    }

    List<DiscoverySelector> selectors() {
        List<DiscoverySelector> selectors = new ArrayList<>();
        for (String target : targets) {
            selectors.add(target.indexOf('#') > 0 ? selectMethod(target) : selectClass(target));
        }
        return selectors;
    }
}
