/**
 * TestKind.java
 *
 * 测试项的种类。SUITE 表示测试类（或包含多个用例的容器），CASE 表示单个测试方法。
 */
package club.ppmc.testrunner.model;

public enum TestKind {
    SUITE,
    CASE
}
