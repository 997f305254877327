package ossim.kernel;

import ossim.kernel.contiguous.ContiguousMemoryManager;
import ossim.kernel.contiguous.FirstFitStrategy;
import ossim.kernel.disk.DiskScheduler;
import ossim.kernel.process.Task;
import ossim.kernel.scheduler.CpuScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConsoleTraceListenerTest {

    private ByteArrayOutputStream buffer;
    private ConsoleTraceListener trace;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        trace = new ConsoleTraceListener(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testSchedulerTrace() {
        CpuScheduler scheduler = new CpuScheduler(trace);
        scheduler.admit(new Task(1, "Editor", 1, 5, 0));
        scheduler.runFcfs();

        String out = output();
        assertTrue(out.contains("[Time 0] Process Editor (PID: 1) added to ready queue"), out);
        assertTrue(out.contains("[Time 0] Running Editor for 5 units"), out);
        assertTrue(out.contains("[Time 5] Editor terminated"), out);
    }

    @Test
    void testMemoryAndDiskTrace() throws Exception {
        ContiguousMemoryManager mm = new ContiguousMemoryManager(100, new FirstFitStrategy(), trace);
        mm.allocate(1, 20);
        mm.deallocate(1);
        mm.allocate(2, 10);
        mm.compact();

        new DiskScheduler(200, trace).fcfs(List.of(98), 53);

        String out = output();
        assertTrue(out.contains("Allocated 20 units to Process 1 at address 0 (split at 20)"), out);
        assertTrue(out.contains("Deallocated memory for Process 1 [0-20]"), out);
        assertTrue(out.contains("Coalesced 1 free extent(s)"), out);
        assertTrue(out.contains("Compacted memory, 90 units free at address 10"), out);
        assertTrue(out.contains("Move from 53 to 98 (seek: 45)"), out);
    }
}
