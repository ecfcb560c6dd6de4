package info.isaksson.erland.templatereg.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ModuleInfo} backed by a plain directory: resources of the module live in {@code resourceRoot}.
 */
public final class DirectoryModuleInfo implements ModuleInfo {

    private final String dottedName;
    private final Path resourceRoot;
    private final boolean isPackage;
    private final String templateDirName;

    public DirectoryModuleInfo(String dottedName, Path resourceRoot) {
        this(dottedName, resourceRoot, false, null);
    }

    public DirectoryModuleInfo(String dottedName, Path resourceRoot, boolean isPackage, String templateDirName) {
        if (dottedName == null || dottedName.isBlank()) {
            throw new IllegalArgumentException("dottedName must not be blank");
        }
        this.dottedName = dottedName;
        this.resourceRoot = Objects.requireNonNull(resourceRoot, "resourceRoot").toAbsolutePath().normalize();
        this.isPackage = isPackage;
        this.templateDirName = templateDirName == null || templateDirName.isBlank() ? null : templateDirName.trim();
    }

    /** Copy of this module using {@code dirName} as its template directory. */
    public DirectoryModuleInfo withTemplateDirName(String dirName) {
        return new DirectoryModuleInfo(dottedName, resourceRoot, isPackage, dirName);
    }

    @Override
    public String dottedName() {
        return dottedName;
    }

    @Override
    public boolean isPackage() {
        return isPackage;
    }

    @Override
    public Path resourcePath(String name) {
        return resourceRoot.resolve(name).normalize();
    }

    @Override
    public Optional<String> templateDirName() {
        return Optional.ofNullable(templateDirName);
    }

    public Path resourceRoot() {
        return resourceRoot;
    }

    @Override
    public String toString() {
        return "DirectoryModuleInfo[" + dottedName + " @ " + resourceRoot + "]";
    }
}
