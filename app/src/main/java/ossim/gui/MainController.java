package ossim.gui;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import javafx.geometry.Insets;
import javafx.geometry.Orientation;
import javafx.scene.Node;
import javafx.scene.Parent;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.Separator;
import javafx.scene.control.Spinner;
import javafx.scene.control.SplitPane;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import ossim.exception.SimulationException;
import ossim.gui.components.ConsoleView;
import ossim.gui.components.MemoryView;
import ossim.gui.components.SchedulerView;
import ossim.gui.util.GuiOutputStream;
import ossim.kernel.ConsoleTraceListener;
import ossim.kernel.KernelConfig;
import ossim.kernel.SimulationListener;
import ossim.kernel.contiguous.ContiguousMemoryManager;
import ossim.kernel.deadlock.DeadlockDetector;
import ossim.kernel.disk.DiskScheduler;
import ossim.kernel.process.Task;
import ossim.kernel.scheduler.CpuScheduler;
import ossim.kernel.scheduler.ScheduleResult;
import ossim.kernel.scheduler.SchedulerType;

/**
 * Wires the toolbar actions to the engines and refreshes the views after each one.
 */
public class MainController {

    private static final List<Integer> DISK_REQUESTS = List.of(98, 183, 37, 122, 14, 124, 65, 67);

    private final KernelConfig config;
    private final BorderPane root;
    private final SimulationListener trace;

    private CpuScheduler scheduler;
    private ContiguousMemoryManager memory;
    private int nextPid = 1;

    // Components
    private SchedulerView schedulerView;
    private MemoryView memoryView;
    private ConsoleView consoleView;

    // Controls
    private ComboBox<SchedulerType> cbPolicy;
    private Spinner<Integer> spQuantum;
    private Spinner<Integer> spBurst;
    private Spinner<Integer> spPid;
    private Spinner<Integer> spSize;

    public MainController(KernelConfig config) {
        this.config = config;
        this.root = new BorderPane();
        this.trace = new ConsoleTraceListener();
        initializeUI();
        reset();
    }

    private void initializeUI() {
        // --- TOP: Toolbars ---
        cbPolicy = new ComboBox<>();
        cbPolicy.getItems().addAll(SchedulerType.values());
        cbPolicy.setValue(config.getSchedulerType());
        spQuantum = new Spinner<>(1, 50, config.getTimeSlice());
        spBurst = new Spinner<>(1, 100, 5);

        Button btnAdmit = new Button("Admit");
        btnAdmit.setOnAction(e -> admit());
        Button btnRun = new Button("Run");
        btnRun.setOnAction(e -> runScheduler());

        spPid = new Spinner<>(0, 999, 1);
        spSize = new Spinner<>(1, config.getTotalMemory(), 10);
        Button btnAlloc = new Button("Allocate");
        btnAlloc.setOnAction(e -> allocate());
        Button btnFree = new Button("Free");
        btnFree.setOnAction(e -> deallocate());
        Button btnCompact = new Button("Compact");
        btnCompact.setOnAction(e -> {
            memory.compact();
            refresh();
        });

        Button btnDeadlock = new Button("Deadlock Check");
        btnDeadlock.setOnAction(e -> detectDeadlock());
        Button btnDisk = new Button("Disk Scheduling");
        btnDisk.setOnAction(e -> scheduleDisk());
        Button btnReset = new Button("Reset");
        btnReset.setOnAction(e -> reset());

        HBox cpuBar = toolbar(new Label("Policy:"), cbPolicy, new Label("Quantum:"), spQuantum,
                new Label("Burst:"), spBurst, btnAdmit, btnRun);
        HBox memBar = toolbar(new Label("PID:"), spPid, new Label("Size:"), spSize, btnAlloc, btnFree, btnCompact,
                new Separator(Orientation.VERTICAL), btnDeadlock, btnDisk, btnReset);
        root.setTop(new VBox(cpuBar, memBar));

        // --- CENTER: Views ---
        schedulerView = new SchedulerView();
        VBox schedulerBox = new VBox(10, new Label("CPU Scheduler"), schedulerView);
        schedulerBox.setPadding(new Insets(10));
        VBox.setVgrow(schedulerView, Priority.ALWAYS);

        memory = newMemory();
        memoryView = new MemoryView(memory);
        VBox memoryBox = new VBox(10, new Label("Memory Visualization"), memoryView);
        memoryBox.setPadding(new Insets(10));
        VBox.setVgrow(memoryView, Priority.ALWAYS);

        SplitPane splitPane = new SplitPane(schedulerBox, memoryBox);
        splitPane.setDividerPositions(0.4);

        // BOTTOM: Console
        consoleView = new ConsoleView();
        consoleView.setPrefHeight(200);

        BorderPane centerLayout = new BorderPane();
        centerLayout.setCenter(splitPane);
        centerLayout.setBottom(consoleView);
        root.setCenter(centerLayout);

        // Redirect System.out and System.err to ConsoleView
        PrintStream printStream = new PrintStream(new GuiOutputStream(consoleView.getOutputArea()), true,
                StandardCharsets.UTF_8);
        System.setOut(printStream);
        System.setErr(printStream);
        System.out.println("GUI: Console Output Redirected.");
    }

    private HBox toolbar(Node... nodes) {
        HBox bar = new HBox(10, nodes);
        bar.setPadding(new Insets(10));
        bar.setStyle("-fx-background-color: #ddd; -fx-border-color: #bbb; -fx-border-width: 0 0 1 0;");
        return bar;
    }

    private ContiguousMemoryManager newMemory() {
        return new ContiguousMemoryManager(config.getTotalMemory(), config.getAllocationPolicy().createStrategy(),
                trace);
    }

    private void reset() {
        scheduler = new CpuScheduler(trace);
        memory = newMemory();
        memoryView.setMemory(memory);
        nextPid = 1;
        refresh();
    }

    private void admit() {
        int pid = nextPid++;
        // Arrival is the current clock: the task shows up now
        scheduler.admit(new Task(pid, "P" + pid, 1, spBurst.getValue(), scheduler.getClock()));
        refresh();
    }

    private void runScheduler() {
        try {
            config.setSchedulerType(cbPolicy.getValue());
            config.setTimeSlice(spQuantum.getValue());
            ScheduleResult result = scheduler.run(config);
            System.out.println("Timeline: " + result.getTimeline());
        } catch (IllegalArgumentException e) {
            System.err.println("Scheduler: " + e.getMessage());
        }
        refresh();
    }

    private void allocate() {
        try {
            memory.allocate(spPid.getValue(), spSize.getValue());
        } catch (SimulationException | IllegalArgumentException e) {
            System.err.println("Memory: " + e.getMessage());
        }
        refresh();
    }

    private void deallocate() {
        try {
            memory.deallocate(spPid.getValue());
        } catch (SimulationException e) {
            System.err.println("Memory: " + e.getMessage());
        }
        refresh();
    }

    private void detectDeadlock() {
        DeadlockDetector detector = DeadlockDetector.of(
                new int[][] { { 0, 1, 0 }, { 2, 0, 0 }, { 3, 0, 2 }, { 2, 1, 1 }, { 0, 0, 2 } },
                new int[][] { { 7, 5, 3 }, { 3, 2, 2 }, { 9, 0, 2 }, { 2, 2, 2 }, { 4, 3, 3 } },
                new int[] { 3, 3, 2 },
                trace);
        System.out.println("Deadlock check: " + detector.detect());
    }

    private void scheduleDisk() {
        DiskScheduler disk = new DiskScheduler(config.getTotalCylinders(), trace);
        System.out.println(disk.fcfs(DISK_REQUESTS, 53));
        System.out.println(disk.scan(DISK_REQUESTS, 53, config.getDiskDirection()));
    }

    private void refresh() {
        schedulerView.update(scheduler);
        memoryView.update();
    }

    public Parent getView() {
        return root;
    }
}
