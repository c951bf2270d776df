/**
 * TestReportController.java
 *
 * 测试报告与测试日志。
 */
package club.ppmc.testrunner.controller;

import club.ppmc.testrunner.model.TestResult;
import club.ppmc.testrunner.service.TestLogService;
import club.ppmc.testrunner.service.TestResultManager;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tests")
@Slf4j
public class TestReportController {

    private final TestResultManager resultManager;
    private final TestLogService logService;

    public TestReportController(TestResultManager resultManager, TestLogService logService) {
        this.resultManager = resultManager;
        this.logService = logService;
    }

    /**
     * 返回指定测试项的最新结果；不指定 ids 时返回全部。
     */
    @GetMapping("/report")
    public ResponseEntity<Map<String, TestResult>> report(@RequestParam(required = false) List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return ResponseEntity.ok(resultManager.getAllResults());
        }
        return ResponseEntity.ok(resultManager.getResults(ids));
    }

    @GetMapping(value = "/log", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> testLog(@RequestParam(defaultValue = "500") int lines) {
        try {
            return logService.readLog(lines)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IOException e) {
            log.error("读取测试日志 {} 失败", logService.getLogFilePath(), e);
            return ResponseEntity.internalServerError().body("读取测试日志失败: " + e.getMessage());
        }
    }
}
