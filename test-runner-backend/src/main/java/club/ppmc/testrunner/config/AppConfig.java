/**
 * AppConfig.java
 *
 * 应用级别的 Bean：WebSocket 推送使用的 Gson、测试会话的启动线程池，以及文件监听防抖使用的调度线程。
 */
package club.ppmc.testrunner.config;

import com.google.gson.Gson;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class AppConfig {

    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 运行前构建、派生进程和附加调试器都在这里执行，不占用 HTTP 请求线程。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService testLaunchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("test-launch-"));
    }

    /**
     * 防抖计时器共用的单线程调度器。单线程保证同一时刻只有一个绑定任务在执行。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService watcherDebounceScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("watcher-debounce-"));
    }
}
