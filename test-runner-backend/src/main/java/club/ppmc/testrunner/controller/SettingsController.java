/**
 * SettingsController.java
 *
 * 读取和更新测试运行器的设置。
 * 更新后立即按新设置（工作区、轮询间隔）重新绑定文件监听器。
 */
package club.ppmc.testrunner.controller;

import club.ppmc.testrunner.model.Settings;
import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.service.watcher.DebouncedWatcherRegistry;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;
    private final DebouncedWatcherRegistry watcherRegistry;

    public SettingsController(SettingsService settingsService, DebouncedWatcherRegistry watcherRegistry) {
        this.settingsService = settingsService;
        this.watcherRegistry = watcherRegistry;
    }

    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> updateSettings(@RequestBody Settings newSettings) {
        try {
            settingsService.updateSettings(newSettings);
        } catch (IOException e) {
            log.error("保存设置失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
        watcherRegistry.registerListeners(false);
        return ResponseEntity.ok(Map.of("message", "设置更新成功。"));
    }
}
