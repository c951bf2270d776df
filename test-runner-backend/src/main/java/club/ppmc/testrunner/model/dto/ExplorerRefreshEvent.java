/**
 * ExplorerRefreshEvent.java
 *
 * 通知前端测试资源管理器刷新。testId 为 null 时表示全量刷新，否则只刷新该测试项所在的子树。
 */
package club.ppmc.testrunner.model.dto;

public record ExplorerRefreshEvent(String testId, String reason) {}
