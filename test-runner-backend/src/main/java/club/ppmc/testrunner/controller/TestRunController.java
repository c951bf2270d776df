/**
 * TestRunController.java
 *
 * 测试资源管理器的命令入口：登记测试项、运行/调试（单个、全部、选中项、当前文件）、排队、重新运行、取消、
 * 刷新资源管理器，以及查询会话状态。
 * 运行类命令在会话占位后立即返回 202（会话通常仍在 STARTING），构建和派生进程在后台进行，结果通过 WebSocket 推送。
 * 启动条件不满足时直接返回 500。
 */
package club.ppmc.testrunner.controller;

import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.model.dto.RegisterItemsRequest;
import club.ppmc.testrunner.model.dto.RunTestsRequest;
import club.ppmc.testrunner.model.dto.SessionStatusEvent;
import club.ppmc.testrunner.service.TestItemRegistry;
import club.ppmc.testrunner.service.TestRunService;
import club.ppmc.testrunner.service.scheduler.RunnerScheduler;
import club.ppmc.testrunner.service.scheduler.SessionHandle;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tests")
public class TestRunController {

    private final TestRunService testRunService;
    private final TestItemRegistry itemRegistry;
    private final RunnerScheduler scheduler;

    public TestRunController(TestRunService testRunService, TestItemRegistry itemRegistry, RunnerScheduler scheduler) {
        this.testRunService = testRunService;
        this.itemRegistry = itemRegistry;
        this.scheduler = scheduler;
    }

    /**
     * 登记发现服务推送的测试项，按文件整体替换。
     */
    @PutMapping("/items")
    public ResponseEntity<Map<String, Object>> registerItems(@RequestBody @Valid RegisterItemsRequest request) {
        itemRegistry.register(request.items());
        return ResponseEntity.ok(Map.of("registered", request.items().size()));
    }

    @GetMapping("/items")
    public ResponseEntity<List<TestItem>> listItems() {
        return ResponseEntity.ok(itemRegistry.all());
    }

    @PostMapping("/run/{testId}")
    public ResponseEntity<Map<String, Object>> runOne(@PathVariable String testId) {
        return accepted(testRunService.runOne(testId, RunMode.RUN));
    }

    @PostMapping("/debug/{testId}")
    public ResponseEntity<Map<String, Object>> debugOne(@PathVariable String testId) {
        return accepted(testRunService.runOne(testId, RunMode.DEBUG));
    }

    @PostMapping("/run-all")
    public ResponseEntity<Map<String, Object>> runAll() {
        return accepted(testRunService.runAll(RunMode.RUN));
    }

    @PostMapping("/debug-all")
    public ResponseEntity<Map<String, Object>> debugAll() {
        return accepted(testRunService.runAll(RunMode.DEBUG));
    }

    /**
     * 运行编辑器当前打开的文件中的全部测试。
     */
    @PostMapping("/run-file")
    public ResponseEntity<Map<String, Object>> runFile(@RequestParam URI uri) {
        return accepted(testRunService.runFile(uri, RunMode.RUN));
    }

    @PostMapping("/debug-file")
    public ResponseEntity<Map<String, Object>> debugFile(@RequestParam URI uri) {
        return accepted(testRunService.runFile(uri, RunMode.DEBUG));
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> runSelection(@RequestBody RunTestsRequest request) {
        return accepted(testRunService.runSelection(request.testIds(), RunMode.RUN, request.launchConfiguration()));
    }

    @PostMapping("/debug")
    public ResponseEntity<Map<String, Object>> debugSelection(@RequestBody RunTestsRequest request) {
        return accepted(testRunService.runSelection(request.testIds(), RunMode.DEBUG, request.launchConfiguration()));
    }

    /**
     * 把请求放入队列，当前会话结束后按顺序执行。
     */
    @PostMapping("/queue")
    public ResponseEntity<Map<String, Object>> enqueue(@RequestBody RunTestsRequest request) {
        int pending = testRunService.enqueue(request.testIds(), RunMode.RUN, request.launchConfiguration());
        return ResponseEntity.accepted().body(Map.of("pending", pending));
    }

    @PostMapping("/relaunch")
    public ResponseEntity<Map<String, Object>> relaunch() {
        return accepted(testRunService.relaunch());
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, String>> cancel() {
        testRunService.cancel();
        return ResponseEntity.ok(Map.of("message", "已取消当前测试会话。"));
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, String>> refreshAll() {
        testRunService.refreshExplorer(null);
        return ResponseEntity.ok(Map.of("message", "已请求刷新测试资源管理器。"));
    }

    @PostMapping("/refresh/{testId}")
    public ResponseEntity<Map<String, String>> refreshOne(@PathVariable String testId) {
        testRunService.refreshExplorer(testId);
        return ResponseEntity.ok(Map.of("message", "已请求刷新测试项 " + testId + "。"));
    }

    @GetMapping("/session")
    public ResponseEntity<Map<String, Object>> session() {
        var body = new LinkedHashMap<String, Object>();
        body.put("state", scheduler.getState());
        body.put("pending", scheduler.getPendingCount());
        scheduler.getCurrentSession().ifPresent(session -> body.put("session", SessionStatusEvent.of(session, null)));
        body.put("canRelaunch", scheduler.getLastCompletedRequest().isPresent());
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, Object>> accepted(SessionHandle handle) {
        return ResponseEntity.accepted().body(Map.of(
                "sessionId", handle.sessionId(),
                "state", handle.session().getState(),
                "targets", handle.session().getRequest().targets().size()));
    }
}
