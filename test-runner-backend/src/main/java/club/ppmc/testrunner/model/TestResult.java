/**
 * TestResult.java
 *
 * 执行后端针对某个测试项产生的一次增量结果更新。
 */
package club.ppmc.testrunner.model;

/**
 * @param testId 对应 TestItem 的 id。
 * @param status 结果状态。
 * @param message 可选的诊断文本（失败信息、堆栈等）。
 * @param durationMillis 执行耗时，未知时为 -1。
 */
public record TestResult(String testId, TestStatus status, String message, long durationMillis) {

    public static TestResult of(String testId, TestStatus status) {
        return new TestResult(testId, status, null, -1);
    }
}
