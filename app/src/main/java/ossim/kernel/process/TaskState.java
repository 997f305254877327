package ossim.kernel.process;

/**
 * Lifecycle states of a simulated task.
 * WAITING is reserved for blocking I/O; no scheduling policy moves a task there.
 */
public enum TaskState {
    NEW,
    READY,
    RUNNING,
    WAITING,
    TERMINATED
}
