/**
 * SchedulerState.java
 *
 * RunnerScheduler 自身的状态。SHUTTING_DOWN 是终态，只能通过 cleanUp(false) 到达。
 */
package club.ppmc.testrunner.model;

public enum SchedulerState {
    IDLE,
    BUSY,
    SHUTTING_DOWN
}
