package ossim.gui.util;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import javafx.application.Platform;
import javafx.scene.control.TextArea;

/**
 * Appends everything written to it to a TextArea on the FX thread.
 */
public class GuiOutputStream extends OutputStream {
    private final TextArea outputArea;

    public GuiOutputStream(TextArea outputArea) {
        this.outputArea = outputArea;
    }

    @Override
    public void write(int b) {
        String s = String.valueOf((char) b);
        Platform.runLater(() -> outputArea.appendText(s));
    }

    @Override
    public void write(byte[] b, int off, int len) {
        String s = new String(b, off, len, StandardCharsets.UTF_8);
        Platform.runLater(() -> outputArea.appendText(s));
    }
}
