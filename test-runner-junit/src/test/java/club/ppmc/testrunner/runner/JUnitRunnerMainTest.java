package club.ppmc.testrunner.runner;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JUnitRunnerMainTest {

    private static final String SAMPLE = SampleCases.class.getName();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws UnsupportedEncodingException {
        JUnitRunnerMain runner = new JUnitRunnerMain(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
        return runner.run(Arrays.asList(args));
    }

    private List<String> lines() throws UnsupportedEncodingException {
        return Arrays.asList(out.toString("UTF-8").split("\\R"));
    }

    private List<JsonObject> results() throws UnsupportedEncodingException {
        List<JsonObject> results = new ArrayList<>();
        for (String line : lines()) {
            if (line.startsWith(ProtocolReportingListener.RESULT_PREFIX)) {
                String json = line.substring(ProtocolReportingListener.RESULT_PREFIX.length());
                results.add(JsonParser.parseString(json).getAsJsonObject());
            }
        }
        return results;
    }

    /** 每个 testId 的最后一次状态。 */
    private Map<String, JsonObject> latest() throws UnsupportedEncodingException {
        Map<String, JsonObject> latest = new LinkedHashMap<>();
        for (JsonObject result : results()) {
            latest.put(result.get("testId").getAsString(), result);
        }
        return latest;
    }

    private static String status(JsonObject result) {
        return result.get("status").getAsString();
    }

    @Test
    void runsAClassAndReportsEveryMethodThenTheFinishMarker() throws Exception {
        int exitCode = run("--", SAMPLE);

        assertThat(exitCode).isEqualTo(JUnitRunnerMain.EXIT_TESTS_FAILED);
        Map<String, JsonObject> latest = latest();
        assertThat(status(latest.get(SAMPLE + "#passing"))).isEqualTo("PASSED");
        assertThat(status(latest.get(SAMPLE + "#failing"))).isEqualTo("FAILED");
        assertThat(latest.get(SAMPLE + "#failing").get("message").getAsString()).contains("加法出错了");
        assertThat(status(latest.get(SAMPLE + "#notImplemented"))).isEqualTo("SKIPPED");
        assertThat(latest.get(SAMPLE + "#notImplemented").get("message").getAsString()).isEqualTo("尚未实现");
        assertThat(status(latest.get(SAMPLE))).isEqualTo("FAILED");

        List<String> lines = lines();
        assertThat(lines.get(lines.size() - 1)).isEqualTo(ProtocolReportingListener.RUN_FINISHED_MARKER);
    }

    @Test
    void parameterizedInvocationsAreReportedUnderTheMethodAndAnyFailureWins() throws Exception {
        run("--", SAMPLE + "#onlyOddValues");

        List<String> statuses = new ArrayList<>();
        for (JsonObject result : results()) {
            if (result.get("testId").getAsString().equals(SAMPLE + "#onlyOddValues")) {
                statuses.add(status(result));
            }
        }
        // 第一次调用开始时报告 RUNNING，之后每次调用结束报告汇总状态
        assertThat(statuses).containsExactly("RUNNING", "PASSED", "FAILED", "FAILED");
    }

    @Test
    void runningASingleMethodReportsOnlyThatMethod() throws Exception {
        int exitCode = run("--", SAMPLE + "#passing");

        assertThat(exitCode).isEqualTo(JUnitRunnerMain.EXIT_OK);
        Map<String, JsonObject> latest = latest();
        assertThat(latest).containsOnlyKeys(SAMPLE + "#passing", SAMPLE);
        assertThat(status(latest.get(SAMPLE))).isEqualTo("PASSED");

        List<String> statuses = new ArrayList<>();
        for (JsonObject result : results()) {
            if (result.get("testId").getAsString().equals(SAMPLE + "#passing")) {
                statuses.add(status(result));
            }
        }
        assertThat(statuses).containsExactly("RUNNING", "PASSED");
    }

    @Test
    void badArgumentsExitWithoutTheFinishMarker() throws Exception {
        int exitCode = run("not-an-option", "--", SAMPLE);

        assertThat(exitCode).isEqualTo(JUnitRunnerMain.EXIT_USAGE);
        assertThat(lines()).doesNotContain(ProtocolReportingListener.RUN_FINISHED_MARKER);
        assertThat(err.toString("UTF-8")).contains("not-an-option");
    }
}
