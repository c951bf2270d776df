/**
 * WsDebugEvent.java
 *
 * 该文件定义了一个通用的DTO，用于封装所有通过WebSocket发送到前端的调试相关事件。
 * 前端根据 'type' 字段分发处理不同类型的调试事件。
 */
package club.ppmc.testrunner.model.dto;

/**
 * @param type 事件类型，例如 "ATTACHED", "TERMINATED"。
 * @param data 事件相关的数据负载，简单通知事件可以为 null。
 * @param <T> 数据负载的泛型类型。
 */
public record WsDebugEvent<T>(String type, T data) {}
