/**
 * RunnerProtocolOutputParser.java
 *
 * 默认的输出解析器，识别测试运行器的行协议：
 * <pre>
 * @@testResult {"testId":"...","status":"PASSED","message":null,"durationMillis":12}
 * @@testRunFinished
 * </pre>
 * 其他行原样作为运行日志转发。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.TestResult;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class RunnerProtocolOutputParser implements TestOutputParser {

    static final String RESULT_PREFIX = "@@testResult ";
    static final String RUN_FINISHED_MARKER = "@@testRunFinished";

    private final Gson gson;

    public RunnerProtocolOutputParser(Gson gson) {
        this.gson = gson;
    }

    @Override
    public ParsedLine parse(String line) {
        if (line.startsWith(RUN_FINISHED_MARKER)) {
            return new ParsedLine(LineKind.RUN_FINISHED, null, line);
        }
        if (!line.startsWith(RESULT_PREFIX)) {
            return ParsedLine.output(line);
        }
        try {
            TestResult result = gson.fromJson(line.substring(RESULT_PREFIX.length()), TestResult.class);
            if (result == null || result.testId() == null || result.status() == null) {
                log.warn("测试结果缺少 testId 或 status，按普通输出处理: {}", line);
                return ParsedLine.output(line);
            }
            return new ParsedLine(LineKind.RESULT, result, line);
        } catch (JsonParseException e) {
            log.warn("无法解析测试结果行，按普通输出处理: {} ({})", line, e.getMessage());
            return ParsedLine.output(line);
        }
    }
}
