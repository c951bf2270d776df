/**
 * UnknownTestItemException.java
 *
 * 命令引用了一个尚未注册（或已被删除）的测试项 id。
 */
package club.ppmc.testrunner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class UnknownTestItemException extends TestRunnerException {

    private final String testId;

    public UnknownTestItemException(String testId) {
        super(ErrorCode.UNKNOWN_TEST_ITEM, "找不到测试项: " + testId);
        this.testId = testId;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        data.put("testId", testId);
        return data;
    }
}
