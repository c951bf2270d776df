/**
 * RunMode.java
 *
 * 一次测试会话的执行方式：普通运行或在调试器下运行。
 */
package club.ppmc.testrunner.model;

public enum RunMode {
    RUN,
    DEBUG
}
