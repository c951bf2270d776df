/**
 * SourceRange.java
 *
 * 测试项在源文件中的显示范围（基于0的行号和列号），供前端定位和渲染 CodeLens 使用。
 */
package club.ppmc.testrunner.model;

public record SourceRange(int startLine, int startCharacter, int endLine, int endCharacter) {}
