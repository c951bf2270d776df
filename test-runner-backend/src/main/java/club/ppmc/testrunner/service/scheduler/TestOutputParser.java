/**
 * TestOutputParser.java
 *
 * 把测试运行器进程的一行输出解释为结果、运行结束标记或普通输出。
 * 具体测试框架的输出语义不在调度器的职责范围内，由实现者决定。
 */
package club.ppmc.testrunner.service.scheduler;

import club.ppmc.testrunner.model.TestResult;

public interface TestOutputParser {

    ParsedLine parse(String line);

    enum LineKind {
        RESULT,
        RUN_FINISHED,
        OUTPUT
    }

    /**
     * @param kind 行的种类。
     * @param result kind 为 RESULT 时的结果，否则为 null。
     * @param text 原始文本。
     */
    record ParsedLine(LineKind kind, TestResult result, String text) {

        public static ParsedLine output(String text) {
            return new ParsedLine(LineKind.OUTPUT, null, text);
        }
    }
}
