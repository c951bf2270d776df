/**
 * TestLogService.java
 *
 * 提供"打开测试日志"命令：读取 Logback 写出的测试运行器日志文件。
 */
package club.ppmc.testrunner.service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class TestLogService {

    private final String logFileName;

    public TestLogService(@Value("${logging.file.name:}") String logFileName) {
        this.logFileName = logFileName;
    }

    /**
     * 读取日志文件的最后若干行。
     *
     * @param maxLines 最多返回的行数，小于等于0表示全部。
     * @return 日志内容；未配置日志文件或文件尚不存在时为空。
     */
    public Optional<String> readLog(int maxLines) throws IOException {
        if (!StringUtils.hasText(logFileName)) {
            log.warn("未配置 logging.file.name，无法打开测试日志。");
            return Optional.empty();
        }
        File logFile = new File(logFileName);
        if (!logFile.isFile()) {
            return Optional.empty();
        }
        List<String> lines = FileUtils.readLines(logFile, StandardCharsets.UTF_8);
        if (maxLines > 0 && lines.size() > maxLines) {
            lines = lines.subList(lines.size() - maxLines, lines.size());
        }
        return Optional.of(String.join("\n", lines));
    }

    public String getLogFilePath() {
        return StringUtils.hasText(logFileName) ? new File(logFileName).getAbsolutePath() : null;
    }
}
