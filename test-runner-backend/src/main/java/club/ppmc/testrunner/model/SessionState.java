/**
 * SessionState.java
 *
 * RunSession 的生命周期状态：PENDING → STARTING → RUNNING → {COMPLETED | CANCELLED | FAILED}。
 */
package club.ppmc.testrunner.model;

public enum SessionState {
    PENDING,
    STARTING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
