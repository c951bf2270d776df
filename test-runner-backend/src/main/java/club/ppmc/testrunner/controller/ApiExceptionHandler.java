/**
 * ApiExceptionHandler.java
 *
 * 把测试运行器的业务异常转换为结构化的 HTTP 响应。
 * 结构性错误（400/404/409）只记录 INFO，运行时错误（500）记录 ERROR。
 */
package club.ppmc.testrunner.controller;

import club.ppmc.testrunner.exception.TestRunnerException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(TestRunnerException.class)
    public ResponseEntity<Map<String, Object>> handleTestRunnerException(TestRunnerException e) {
        HttpStatus status = statusOf(e);
        if (e.getErrorCode().isRuntimeFailure()) {
            log.error("测试运行器请求失败: {}", e.getMessage(), e);
        } else {
            log.info("拒绝测试运行器请求 ({}): {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(e.toErrorData());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("请求参数无效");
        return ResponseEntity.badRequest().body(Map.of("type", "INVALID_REQUEST", "message", message));
    }

    static HttpStatus statusOf(TestRunnerException e) {
        return switch (e.getErrorCode()) {
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_TEST_ITEM -> HttpStatus.NOT_FOUND;
            case BUSY, NO_PRIOR_REQUEST -> HttpStatus.CONFLICT;
            case LAUNCH_FAILED, BACKEND_CRASHED, CANCEL_TIMEOUT, ENVIRONMENT_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
