/**
 * SessionStatusEvent.java
 *
 * 通过WebSocket推送给状态栏的会话状态变化事件。
 */
package club.ppmc.testrunner.model.dto;

import club.ppmc.testrunner.model.RunMode;
import club.ppmc.testrunner.model.RunSession;
import club.ppmc.testrunner.model.SessionState;

/**
 * @param sessionId 会话 id，队列中被丢弃的请求没有会话时为 null。
 * @param state 会话状态。
 * @param mode 运行或调试。
 * @param targetCount 目标测试项数量。
 * @param message 附加说明（失败原因等），可以为 null。
 */
public record SessionStatusEvent(
        String sessionId, SessionState state, RunMode mode, int targetCount, String message) {

    public static SessionStatusEvent of(RunSession session, String message) {
        return new SessionStatusEvent(
                session.getId(),
                session.getState(),
                session.getRequest().mode(),
                session.getRequest().targets().size(),
                message);
    }
}
