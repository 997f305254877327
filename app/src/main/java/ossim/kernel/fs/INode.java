package ossim.kernel.fs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A file or directory node. Directories keep their entries in creation order.
 */
public class INode {
    private final int id;
    private final String name;
    private final boolean directory;
    private final INode parent;
    private final Map<String, INode> entries;
    private String content;

    private INode(int id, String name, boolean directory, INode parent, String content) {
        this.id = id;
        this.name = name;
        this.directory = directory;
        this.parent = parent;
        this.entries = directory ? new LinkedHashMap<>() : Collections.emptyMap();
        this.content = content;
    }

    static INode directory(int id, String name, INode parent) {
        return new INode(id, name, true, parent, null);
    }

    static INode file(int id, String name, INode parent, String content) {
        return new INode(id, name, false, parent, content);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isDirectory() {
        return directory;
    }

    /** Parent directory, or null for the root. */
    public INode getParent() {
        return parent;
    }

    /** File length in characters; 0 for directories. */
    public int getSize() {
        return directory ? 0 : content.length();
    }

    public String getContent() {
        return content;
    }

    void setContent(String content) {
        this.content = content;
    }

    Map<String, INode> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (size: %d bytes)", directory ? "DIR" : "FILE", name, getSize());
    }
}
