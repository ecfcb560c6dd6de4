package info.isaksson.erland.templatereg.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A template backed by a file. Content is never read here; the path is the identity.
 */
public final class FileTemplate implements Template {

    private final String fileName;
    private final Path path;

    public FileTemplate(String fileName, Path templateDir) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.path = Objects.requireNonNull(templateDir, "templateDir").resolve(fileName).toAbsolutePath().normalize();
    }

    public String fileName() {
        return fileName;
    }

    public Path path() {
        return path;
    }

    @Override
    public String describe() {
        return "file template " + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileTemplate)) return false;
        return path.equals(((FileTemplate) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }
}
