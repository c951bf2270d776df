/**
 * ProtocolReportingListener.java
 *
 * 把 JUnit Platform 的执行事件翻译成后端能解析的行协议：
 * <pre>
 * @@testResult {"testId":"com.example.FooTest#bar","status":"PASSED","message":null,"durationMillis":12}
 * @@testRunFinished
 * </pre>
 * testId 是测试的完全限定名：方法为 "类名#方法名"，类为类名。
 * 参数化、重复测试的多次调用汇总到同一个方法名下，任何一次失败即为失败。
 */
package club.ppmc.testrunner.runner;

import com.google.gson.Gson;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.engine.TestSource;
import org.junit.platform.engine.support.descriptor.ClassSource;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;

class ProtocolReportingListener implements TestExecutionListener {

    static final String RESULT_PREFIX = "@@testResult ";
    static final String RUN_FINISHED_MARKER = "@@testRunFinished";

    private final PrintStream out;
    private final Gson gson = new Gson();
    private final Map<String, Tally> tallies = new ConcurrentHashMap<>();
    private final AtomicBoolean anyFailure = new AtomicBoolean(false);
    private volatile TestPlan testPlan;

    ProtocolReportingListener(PrintStream out) {
        this.out = out;
    }

    boolean hasFailures() {
        return anyFailure.get();
    }

    void runFinished() {
        synchronized (out) {
            out.println(RUN_FINISHED_MARKER);
            out.flush();
        }
    }

    @Override
    public void testPlanExecutionStarted(TestPlan testPlan) {
        this.testPlan = testPlan;
    }

    @Override
    public void executionStarted(TestIdentifier identifier) {
        String key = keyOf(identifier);
        if (key == null) {
            return;
        }
        Tally tally = tallyFor(key);
        if (identifier.isTest() && tally.markStarted()) {
            emit(key, "RUNNING", null, -1);
        }
    }

    @Override
    public void executionSkipped(TestIdentifier identifier, String reason) {
        String key = keyOf(identifier);
        if (key != null) {
            tallyFor(key).recordSkipped(reason);
            emit(key, "SKIPPED", reason, 0);
        }
        // 被禁用的类不会为其中的方法产生事件
        for (TestIdentifier descendant : testPlan.getDescendants(identifier)) {
            String descendantKey = keyOf(descendant);
            if (descendant.isTest() && descendantKey != null && !descendantKey.equals(key)) {
                emit(descendantKey, "SKIPPED", reason, 0);
            }
        }
    }

    @Override
    public void executionFinished(TestIdentifier identifier, TestExecutionResult result) {
        String key = keyOf(identifier);
        if (result.getStatus() == TestExecutionResult.Status.FAILED) {
            anyFailure.set(true);
        }
        if (key == null) {
            return;
        }

        if (identifier.isTest()) {
            for (String affected : keysUpToRoot(identifier)) {
                tallyFor(affected).record(result);
            }
            Tally tally = tallyFor(key);
            emit(key, tally.status(), tally.message(), tally.elapsedMillis());
        } else if (identifier.getSource().filter(ClassSource.class::isInstance).isPresent()) {
            Tally tally = tallyFor(key);
            if (result.getStatus() != TestExecutionResult.Status.SUCCESSFUL) {
                // 类级别的失败，例如 @BeforeAll 抛出异常
                tally.record(result);
            }
            if (tally.hasOutcome()) {
                emit(key, tally.status(), tally.message(), tally.elapsedMillis());
            }
        }
    }

    private Set<String> keysUpToRoot(TestIdentifier identifier) {
        Set<String> keys = new LinkedHashSet<>();
        Optional<TestIdentifier> current = Optional.of(identifier);
        while (current.isPresent()) {
            String key = keyOf(current.get());
            if (key != null) {
                keys.add(key);
            }
            current = testPlan.getParent(current.get());
        }
        return keys;
    }

    private Tally tallyFor(String key) {
        return tallies.computeIfAbsent(key, k -> new Tally());
    }

    private void emit(String testId, String status, String message, long durationMillis) {
        String json = gson.toJson(new ResultLine(testId, status, message, durationMillis));
        synchronized (out) {
            out.println(RESULT_PREFIX + json);
            out.flush();
        }
    }

    static String keyOf(TestIdentifier identifier) {
        Optional<TestSource> source = identifier.getSource();
        if (!source.isPresent()) {
            return null;
        }
        if (source.get() instanceof MethodSource) {
            MethodSource method = (MethodSource) source.get();
            return method.getClassName() + "#" + method.getMethodName();
        }
        if (source.get() instanceof ClassSource) {
            return ((ClassSource) source.get()).getClassName();
        }
        return null;
    }

    static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    /**
     * 同一个测试名下所有调用的汇总。
     */
    private static final class Tally {

        private final long startNanos = System.nanoTime();
        private final AtomicBoolean started = new AtomicBoolean(false);
        private int passed;
        private int failed;
        private int skipped;
        private String message;

        boolean markStarted() {
            return started.compareAndSet(false, true);
        }

        synchronized void record(TestExecutionResult result) {
            switch (result.getStatus()) {
                case SUCCESSFUL:
                    passed++;
                    break;
                case ABORTED:
                    skipped++;
                    if (message == null) {
                        message = result.getThrowable().map(Throwable::getMessage).orElse(null);
                    }
                    break;
                default:
                    failed++;
                    // 保留第一次失败的信息
                    if (failed == 1) {
                        message = result.getThrowable().map(ProtocolReportingListener::stackTraceOf).orElse(null);
                    }
                    break;
            }
        }

        synchronized void recordSkipped(String reason) {
            skipped++;
            if (message == null) {
                message = reason;
            }
        }

        synchronized boolean hasOutcome() {
            return passed + failed + skipped > 0;
        }

        synchronized String status() {
            if (failed > 0) {
                return "FAILED";
            }
            if (passed == 0 && skipped > 0) {
                return "SKIPPED";
            }
            return "PASSED";
        }

        synchronized String message() {
            return message;
        }

        long elapsedMillis() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }
    }
}
