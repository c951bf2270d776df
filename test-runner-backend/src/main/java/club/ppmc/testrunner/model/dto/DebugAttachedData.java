/**
 * DebugAttachedData.java
 *
 * 调试器成功附加后随 ATTACHED 事件下发的数据。
 */
package club.ppmc.testrunner.model.dto;

public record DebugAttachedData(String sessionId, int port, String vmDescription) {}
