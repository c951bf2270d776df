/**
 * RunTestsRequest.java
 *
 * 前端"运行/调试选中项"命令的请求体。
 */
package club.ppmc.testrunner.model.dto;

import club.ppmc.testrunner.model.LaunchConfiguration;
import java.util.List;

/**
 * @param testIds 要执行的测试项 id，按顺序。为空时由调度器以 InvalidRequest 拒绝。
 * @param launchConfiguration 可选的启动配置。
 */
public record RunTestsRequest(List<String> testIds, LaunchConfiguration launchConfiguration) {}
