/**
 * TestRunnerBackendApplication.java
 *
 * 测试运行器后端的主入口类。
 */
package club.ppmc.testrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TestRunnerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestRunnerBackendApplication.class, args);
    }
}
