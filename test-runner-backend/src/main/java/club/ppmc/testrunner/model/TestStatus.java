/**
 * TestStatus.java
 *
 * 单个测试项的结果状态。
 */
package club.ppmc.testrunner.model;

public enum TestStatus {
    RUNNING,
    PASSED,
    FAILED,
    SKIPPED
}
