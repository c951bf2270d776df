/**
 * TestItem.java
 *
 * 该文件定义了一个可被发现的测试单元（测试类或测试方法）。
 * 测试项由外部的发现服务推送过来，一旦注册便不可变；重新发现时整体替换，从不原地修改。
 */
package club.ppmc.testrunner.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;

/**
 * 一个测试项。
 *
 * @param id 全局唯一标识，通常形如 "project@com.example.FooTest#bar"。
 * @param label 前端显示的名称。
 * @param kind 测试项种类。
 * @param projectName 所属项目（工作区下的一级目录名）。
 * @param fullName 交给测试运行器的完全限定名，例如 "com.example.FooTest" 或 "com.example.FooTest#bar"。
 * @param uri 源文件的 URI。
 * @param range 源文件中的显示范围，可以为 null。
 */
public record TestItem(
        @NotBlank String id,
        String label,
        @NotNull TestKind kind,
        @NotBlank String projectName,
        @NotBlank String fullName,
        @NotNull URI uri,
        SourceRange range) {

    public boolean isSuite() {
        return kind == TestKind.SUITE;
    }
}
