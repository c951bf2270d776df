/**
 * ResultLine.java
 *
 * 一条 @@testResult 行的 JSON 负载，字段与后端的 TestResult 一致。
 */
package club.ppmc.testrunner.runner;

final class ResultLine {

    final String testId;
    final String status;
    final String message;
    final long durationMillis;

    ResultLine(String testId, String status, String message, long durationMillis) {
        this.testId = testId;
        this.status = status;
        this.message = message;
        this.durationMillis = durationMillis;
    }
}
