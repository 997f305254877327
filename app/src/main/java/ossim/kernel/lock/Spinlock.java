package ossim.kernel.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Test-and-set mutual exclusion lock.
 * Not reentrant: acquiring a lock the current thread already holds is an error.
 */
public class Spinlock {
    private final String name;
    private final AtomicBoolean locked = new AtomicBoolean(false);

    // Debugging information
    private volatile Thread owner;

    public Spinlock(String name) {
        this.name = name;
    }

    /**
     * Acquire the lock, spinning until it is free.
     */
    public void acquire() {
        if (holding()) {
            throw new IllegalStateException("Spinlock '" + name + "' acquire: already holding");
        }
        while (!locked.compareAndSet(false, true)) {
            Thread.onSpinWait();
        }
        owner = Thread.currentThread();
    }

    public void release() {
        if (!holding()) {
            throw new IllegalStateException("Spinlock '" + name + "' release: not holding");
        }
        owner = null;
        locked.set(false);
    }

    /**
     * Check if the current thread holds the lock.
     */
    public boolean holding() {
        return locked.get() && owner == Thread.currentThread();
    }

    public String getName() {
        return name;
    }
}
