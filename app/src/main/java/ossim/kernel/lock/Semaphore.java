package ossim.kernel.lock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Counting semaphore with a FIFO wait list.
 * <p>
 * Blocking is modelled, not performed: a {@link #waitFor(String)} that cannot
 * proceed records the caller in the wait list and returns {@code false}; the
 * caller is treated as suspended until a {@link #signal()} releases it.
 */
public class Semaphore {
    private final Spinlock lock;
    private final Deque<String> waitingQueue = new ArrayDeque<>();
    private int value;

    public Semaphore(int initialValue) {
        this("semaphore", initialValue);
    }

    public Semaphore(String name, int initialValue) {
        if (initialValue < 0) {
            throw new IllegalArgumentException("Initial value must be non-negative: " + initialValue);
        }
        this.lock = new Spinlock(name);
        this.value = initialValue;
    }

    /**
     * P operation (wait/down).
     *
     * @return true if the caller acquired the semaphore, false if it now waits
     */
    public boolean waitFor(String processName) {
        lock.acquire();
        try {
            value--;
            if (value < 0) {
                waitingQueue.offer(processName);
                return false;
            }
            return true;
        } finally {
            lock.release();
        }
    }

    /**
     * V operation (signal/up).
     *
     * @return the waiter released by this signal, if any
     */
    public Optional<String> signal() {
        lock.acquire();
        try {
            value++;
            return Optional.ofNullable(waitingQueue.poll());
        } finally {
            lock.release();
        }
    }

    public int getValue() {
        lock.acquire();
        try {
            return value;
        } finally {
            lock.release();
        }
    }

    public List<String> getWaiting() {
        lock.acquire();
        try {
            return new ArrayList<>(waitingQueue);
        } finally {
            lock.release();
        }
    }

    public String getName() {
        return lock.getName();
    }
}
