package ossim.kernel.fs;

import java.util.ArrayList;
import java.util.List;

import ossim.exception.NotFoundException;

/**
 * In-memory hierarchical name to inode directory structure.
 * Operations are relative to a current directory, starting at the root.
 */
public class FileSystem {
    private final INode root;
    private INode currentDir;
    private int inodeCounter = 1;

    public FileSystem() {
        this.root = INode.directory(0, "/", null);
        this.currentDir = root;
    }

    public INode createFile(String name, String content) {
        checkName(name);
        INode file = INode.file(inodeCounter++, name, currentDir, content == null ? "" : content);
        currentDir.entries().put(name, file);
        return file;
    }

    public INode createDirectory(String name) {
        checkName(name);
        INode dir = INode.directory(inodeCounter++, name, currentDir);
        currentDir.entries().put(name, dir);
        return dir;
    }

    /**
     * Entries of the current directory in creation order.
     */
    public List<INode> listDirectory() {
        return new ArrayList<>(currentDir.entries().values());
    }

    public String readFile(String name) throws NotFoundException {
        INode node = lookup(name);
        if (node.isDirectory()) {
            throw new IllegalArgumentException("'" + name + "' is a directory");
        }
        return node.getContent();
    }

    public void writeFile(String name, String content) throws NotFoundException {
        INode node = lookup(name);
        if (node.isDirectory()) {
            throw new IllegalArgumentException("'" + name + "' is a directory");
        }
        node.setContent(content == null ? "" : content);
    }

    /**
     * Change the current directory. Accepts a child directory name, ".." or "/".
     */
    public void changeDirectory(String name) throws NotFoundException {
        if ("/".equals(name)) {
            currentDir = root;
            return;
        }
        if ("..".equals(name)) {
            if (currentDir.getParent() != null) {
                currentDir = currentDir.getParent();
            }
            return;
        }
        INode node = lookup(name);
        if (!node.isDirectory()) {
            throw new IllegalArgumentException("'" + name + "' is not a directory");
        }
        currentDir = node;
    }

    public INode lookup(String name) throws NotFoundException {
        INode node = currentDir.entries().get(name);
        if (node == null) {
            throw new NotFoundException("'" + name + "' not found in " + getCurrentPath());
        }
        return node;
    }

    public String getCurrentPath() {
        if (currentDir == root) {
            return "/";
        }
        StringBuilder path = new StringBuilder();
        for (INode n = currentDir; n != root; n = n.getParent()) {
            path.insert(0, "/" + n.getName());
        }
        return path.toString();
    }

    private void checkName(String name) {
        if (name == null || name.isEmpty() || name.contains("/") || ".".equals(name) || "..".equals(name)) {
            throw new IllegalArgumentException("Invalid entry name: '" + name + "'");
        }
        if (currentDir.entries().containsKey(name)) {
            throw new IllegalArgumentException("'" + name + "' already exists in " + getCurrentPath());
        }
    }
}
