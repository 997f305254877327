package ossim;

import java.util.List;

import ossim.exception.SimulationException;
import ossim.kernel.ConsoleTraceListener;
import ossim.kernel.KernelConfig;
import ossim.kernel.SimulationListener;
import ossim.kernel.contiguous.ContiguousMemoryManager;
import ossim.kernel.contiguous.Extent;
import ossim.kernel.deadlock.DeadlockDetector;
import ossim.kernel.deadlock.SafetyResult;
import ossim.kernel.disk.DiskScheduler;
import ossim.kernel.disk.SeekResult;
import ossim.kernel.fs.FileSystem;
import ossim.kernel.fs.INode;
import ossim.kernel.lock.Semaphore;
import ossim.kernel.paging.PageTable;
import ossim.kernel.process.Task;
import ossim.kernel.process.TaskState;
import ossim.kernel.scheduler.CpuScheduler;
import ossim.kernel.scheduler.ScheduleResult;

/**
 * Runs each engine once on a fixed scenario and prints the outcome.
 */
public class SimulatorDemo {

    public static void main(String[] args) {
        KernelConfig config = KernelConfig.load();
        SimulationListener trace = config.isTrace() ? new ConsoleTraceListener() : SimulationListener.NONE;

        banner("EDUCATIONAL OPERATING SYSTEM SIMULATOR");
        try {
            processStates();
            cpuScheduling(config, trace);
            memoryManagement(config, trace);
            paging();
            synchronization();
            deadlockDetection(trace);
            fileSystem();
            diskScheduling(config, trace);
        } catch (SimulationException e) {
            System.err.println("Simulation failed: " + e.getMessage());
            System.exit(1);
        }
        banner("All demonstrations completed!");
    }

    private static void processStates() {
        banner("Process Management & States");
        Task editor = new Task(1, "Editor", 2, 5, 0);
        Task compiler = new Task(2, "Compiler", 1, 8, 2);
        System.out.println("Created Process: " + editor.getStatusString());
        System.out.println("Created Process: " + compiler.getStatusString());
        System.out.println("Process states: " + List.of(TaskState.values()));
    }

    private static void cpuScheduling(KernelConfig config, SimulationListener trace) throws SimulationException {
        banner("CPU Scheduling (" + config.getSchedulerType().getDisplayName() + ")");
        CpuScheduler scheduler = new CpuScheduler(trace);
        scheduler.admit(new Task(1, "P1", 1, 5, 0));
        scheduler.admit(new Task(2, "P2", 2, 3, 1));
        scheduler.admit(new Task(3, "P3", 1, 8, 2));

        ScheduleResult result = scheduler.run(config);
        System.out.println("Timeline: " + result.getTimeline());
        System.out.println(scheduler.statistics());
    }

    private static void memoryManagement(KernelConfig config, SimulationListener trace) {
        banner("Memory Management (" + config.getAllocationPolicy() + ")");
        ContiguousMemoryManager memory = new ContiguousMemoryManager(config.getTotalMemory(),
                config.getAllocationPolicy().createStrategy(), trace);
        try {
            memory.allocate(1, 20);
            memory.allocate(2, 30);
            memory.allocate(3, 15);
            printLayout(memory);

            memory.deallocate(2);
            printLayout(memory);

            memory.allocate(4, 40);
        } catch (SimulationException e) {
            System.out.println(e.getMessage());
        }
    }

    private static void printLayout(ContiguousMemoryManager memory) {
        System.out.println("--- Memory Layout ---");
        for (Extent e : memory.snapshot()) {
            System.out.println(e);
        }
    }

    private static void paging() {
        banner("Paging System");
        PageTable pageTable = new PageTable(4);
        pageTable.addMapping(0, 2);
        pageTable.addMapping(1, 5);
        pageTable.addMapping(2, 1);

        for (int logical : new int[] { 0, 7, 10, 13 }) {
            try {
                System.out.printf("Logical %d -> Physical %d%n", logical, pageTable.translate(logical));
            } catch (SimulationException e) {
                System.out.println(e.getMessage());
            }
        }
    }

    private static void synchronization() {
        banner("Synchronization - Semaphores");
        Semaphore sem = new Semaphore(1);
        System.out.println("Process A " + (sem.waitFor("Process A") ? "acquired semaphore" : "is waiting..."));
        System.out.println("Process B " + (sem.waitFor("Process B") ? "acquired semaphore" : "is waiting..."));
        System.out.println("Process A released semaphore");
        sem.signal().ifPresent(woken -> System.out.println(woken + " woken up"));
    }

    private static void deadlockDetection(SimulationListener trace) {
        banner("Deadlock Detection");
        DeadlockDetector detector = new DeadlockDetector(5, 3, trace);
        detector.setAllocation(0, 0, 1, 0);
        detector.setAllocation(1, 2, 0, 0);
        detector.setAllocation(2, 3, 0, 2);
        detector.setAllocation(3, 2, 1, 1);
        detector.setAllocation(4, 0, 0, 2);

        detector.setMaxNeed(0, 7, 5, 3);
        detector.setMaxNeed(1, 3, 2, 2);
        detector.setMaxNeed(2, 9, 0, 2);
        detector.setMaxNeed(3, 2, 2, 2);
        detector.setMaxNeed(4, 4, 3, 3);

        detector.setAvailable(3, 3, 2);
        SafetyResult result = detector.detect();
        System.out.println("System is in " + result);
    }

    private static void fileSystem() throws SimulationException {
        banner("File System Simulation");
        FileSystem fs = new FileSystem();
        fs.createFile("hello.txt", "Hello, World!");
        fs.createFile("readme.md", "# Operating System Project");
        fs.createDirectory("documents");

        System.out.println("Contents of " + fs.getCurrentPath() + ":");
        for (INode node : fs.listDirectory()) {
            System.out.println("  " + node);
        }
        System.out.println("Content of 'hello.txt': " + fs.readFile("hello.txt"));
    }

    private static void diskScheduling(KernelConfig config, SimulationListener trace) {
        banner("I/O Management & Disk Scheduling");
        DiskScheduler disk = new DiskScheduler(config.getTotalCylinders(), trace);
        List<Integer> requests = List.of(98, 183, 37, 122, 14, 124, 65, 67);

        SeekResult fcfs = disk.fcfs(requests, 53);
        System.out.println(fcfs);
        SeekResult scan = disk.scan(requests, 53, config.getDiskDirection());
        System.out.println(scan);
    }

    private static void banner(String title) {
        System.out.println();
        System.out.println("=".repeat(60));
        System.out.println(title);
        System.out.println("=".repeat(60));
    }
}
