package ossim.gui.components;

import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Tooltip;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import ossim.kernel.contiguous.ContiguousMemoryManager;
import ossim.kernel.contiguous.Extent;

/**
 * Tape view of the contiguous address space: one box per extent.
 */
public class MemoryView extends Pane {

    private static final double BAR_Y = 50;
    private static final double BAR_HEIGHT = 60;
    private static final Color[] COLORS = { Color.SALMON, Color.LIGHTBLUE, Color.ORANGE, Color.VIOLET, Color.CYAN };

    private final Canvas canvas;
    private ContiguousMemoryManager memory;

    public MemoryView(ContiguousMemoryManager memory) {
        this.memory = memory;
        this.canvas = new Canvas(800, 200);
        this.getChildren().add(canvas);

        Tooltip tooltip = new Tooltip();
        Tooltip.install(canvas, tooltip);
        canvas.setOnMouseMoved(e -> handleMouseMove(e, tooltip));

        this.widthProperty().addListener(e -> draw());
        this.heightProperty().addListener(e -> draw());
    }

    public void setMemory(ContiguousMemoryManager memory) {
        this.memory = memory;
        draw();
    }

    public void update() {
        draw();
    }

    private void draw() {
        double w = getWidth();
        double h = getHeight();
        if (w == 0 || h == 0)
            return;

        canvas.setWidth(w);
        canvas.setHeight(h);

        GraphicsContext gc = canvas.getGraphicsContext2D();
        gc.clearRect(0, 0, w, h);

        int totalMem = memory.getTotalMemory();
        double scale = w / totalMem;

        gc.setStroke(Color.BLACK);
        for (Extent e : memory.snapshot()) {
            double x = e.getStart() * scale;
            double bw = e.getSize() * scale;

            gc.setFill(e.isFree() ? Color.LIGHTGREEN : COLORS[e.getOwnerPid() % COLORS.length]);
            gc.fillRect(x, BAR_Y, bw, BAR_HEIGHT);
            gc.strokeRect(x, BAR_Y, bw, BAR_HEIGHT);

            if (!e.isFree() && bw > 20) {
                gc.setFill(Color.BLACK);
                gc.fillText("P" + e.getOwnerPid(), x + 2, BAR_Y + BAR_HEIGHT / 2 + 5);
            }
        }

        gc.setFill(Color.BLACK);
        gc.fillText(String.format("Contiguous Memory (%s) - Total: %d, Free: %d, Largest hole: %d",
                memory.getStrategy().getName(), totalMem, memory.getFreeMemory(), memory.getLargestFreeExtent()),
                10, 30);
    }

    private void handleMouseMove(MouseEvent e, Tooltip tooltip) {
        if (e.getY() < BAR_Y || e.getY() > BAR_Y + BAR_HEIGHT) {
            tooltip.hide();
            return;
        }

        double scale = getWidth() / memory.getTotalMemory();
        int address = (int) (e.getX() / scale);

        for (Extent extent : memory.snapshot()) {
            if (extent.contains(address)) {
                String owner = extent.isFree() ? "FREE" : "PID: " + extent.getOwnerPid();
                tooltip.setText(String.format("%s\nStart: %d\nSize: %d", owner, extent.getStart(), extent.getSize()));
                tooltip.show(canvas, e.getScreenX() + 10, e.getScreenY() + 10);
                return;
            }
        }
        tooltip.hide();
    }
}
