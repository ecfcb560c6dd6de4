package info.isaksson.erland.templatereg.registry;

import info.isaksson.erland.templatereg.model.ModuleInfo;
import info.isaksson.erland.templatereg.model.Template;
import info.isaksson.erland.templatereg.model.TemplateFileFactories;
import info.isaksson.erland.templatereg.model.TemplateFileFactory;
import info.isaksson.erland.templatereg.warnings.RegistryWarning;
import info.isaksson.erland.templatereg.warnings.WarningSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Templates discovered on disk, one template directory per module.
 *
 * <p>Entries are keyed by absolute file path; at most one entry exists per (directory, base name).
 * A directory is registered all-or-nothing: every conflict check runs before the first insertion.</p>
 */
public final class FileTemplateRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileTemplateRegistry.class);

    private final TemplateFileFactories factories;
    private final WarningSink warnings;
    private final TemplateConflictChecker conflicts;

    private final Map<Path, FileTemplateEntry> byPath = new LinkedHashMap<>();
    private final Map<Path, Map<String, FileTemplateEntry>> byDirectory = new HashMap<>();
    private final Set<Path> registeredDirectories = new LinkedHashSet<>();
    private final Map<String, Path> moduleDirectories = new HashMap<>();
    private final Set<Path> reportedFiles = new HashSet<>();

    public FileTemplateRegistry(TemplateFileFactories factories, WarningSink warnings, TemplateConflictChecker conflicts) {
        this.factories = Objects.requireNonNull(factories, "factories");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts");
    }

    /** Register the module's own template directory (see {@link ModuleInfo#effectiveTemplateDirName()}). */
    public void registerDirectory(ModuleInfo moduleInfo) {
        Objects.requireNonNull(moduleInfo, "moduleInfo");
        registerDirectory(moduleInfo, moduleInfo.effectiveTemplateDirName());
    }

    /**
     * Scan {@code moduleInfo.resourcePath(templateDirName)} and register every template in it.
     *
     * <p>Packages and missing directories are skipped. Scanning a directory again only adds paths that
     * are not registered yet, so associated flags survive. Once registered, the directory is the one
     * {@link #lookup}, {@link #templateDir} and the conflict check use for this module.</p>
     *
     * @throws TemplateConflictException if two files share a base name, or a file template collides
     *         with an inline template of the module
     * @throws UncheckedIOException if the directory cannot be listed
     */
    public void registerDirectory(ModuleInfo moduleInfo, String templateDirName) {
        Objects.requireNonNull(moduleInfo, "moduleInfo");
        if (moduleInfo.isPackage()) {
            LOGGER.debug("Skipping template directory of package {}", moduleInfo.dottedName());
            return;
        }
        Path templateDir = normalize(moduleInfo.resourcePath(templateDirName));
        if (!Files.isDirectory(templateDir)) {
            LOGGER.debug("No template directory {} for {}", templateDir, moduleInfo.dottedName());
            return;
        }

        Map<String, List<Path>> groups = groupByTemplateName(templateDir);

        // Pass 1: checks only. A failure here leaves the registry untouched.
        Map<String, Path> accepted = new TreeMap<>();
        for (Map.Entry<String, List<Path>> group : groups.entrySet()) {
            String templateName = group.getKey();
            List<Path> files = group.getValue();
            FileTemplateEntry existing = entriesIn(templateDir).get(templateName);
            if (files.size() > 1 || (existing != null && !existing.path().equals(files.get(0)))) {
                throw new TemplateConflictException(templateName, "Conflicting templates found for name '"
                        + templateName + "' in directory '" + templateDir
                        + "': multiple templates with the same name and different extensions.");
            }
            if (existing != null) {
                continue;
            }
            Optional<TemplateConflict> conflict = conflicts.findInlineConflict(moduleInfo, templateName, templateDir);
            if (conflict.isPresent()) {
                throw conflict.get().toException();
            }
            accepted.put(templateName, files.get(0));
        }

        // Pass 2: build templates, then insert.
        List<FileTemplateEntry> created = new ArrayList<>(accepted.size());
        for (Map.Entry<String, Path> e : accepted.entrySet()) {
            Path path = e.getValue();
            String fileName = path.getFileName().toString();
            TemplateFileFactory factory = factories.factoryFor(extensionOf(fileName))
                    .orElseThrow(() -> new IllegalStateException("No template factory for " + path));
            Template template = factory.create(fileName, templateDir);
            if (template == null) {
                throw new IllegalStateException("Template factory returned null for " + path);
            }
            created.add(new FileTemplateEntry(path, templateDir, e.getKey(), template));
        }
        for (FileTemplateEntry entry : created) {
            byPath.put(entry.path(), entry);
            byDirectory.computeIfAbsent(templateDir, d -> new HashMap<>()).put(entry.templateName(), entry);
            LOGGER.debug("Registered file template {}", entry.path());
        }

        moduleDirectories.put(moduleInfo.dottedName(), templateDir);
        if (registeredDirectories.add(templateDir)) {
            LOGGER.info("Registered template directory {} for {} ({} templates)",
                    templateDir, moduleInfo.dottedName(), entriesIn(templateDir).size());
        } else if (!created.isEmpty()) {
            LOGGER.info("Rescanned template directory {}: {} new templates", templateDir, created.size());
        }
    }

    /**
     * @throws TemplateLookupException if the module's template directory does not exist or holds no
     *         template named {@code templateName}
     */
    public Template lookup(ModuleInfo moduleInfo, String templateName) {
        return lookupEntry(moduleInfo, templateName).template();
    }

    public FileTemplateEntry lookupEntry(ModuleInfo moduleInfo, String templateName) {
        Path templateDir = templateDir(moduleInfo);
        FileTemplateEntry entry = Files.isDirectory(templateDir) ? entriesIn(templateDir).get(templateName) : null;
        if (entry == null) {
            throw new TemplateLookupException(templateName,
                    "template '" + templateName + "' in '" + templateDir + "' cannot be found");
        }
        return entry;
    }

    /**
     * Mark the entry at {@code path} as associated.
     *
     * <p>Unknown paths are ignored: callers holding stale or foreign paths must not fail the run.</p>
     */
    public void associate(Path path) {
        if (path == null) return;
        FileTemplateEntry entry = byPath.get(normalize(path));
        if (entry == null) {
            LOGGER.debug("Ignoring association of unregistered template {}", path);
            return;
        }
        entry.markAssociated();
    }

    public SortedSet<Path> unassociated() {
        SortedSet<Path> out = new TreeSet<>();
        for (FileTemplateEntry e : byPath.values()) {
            if (!e.isAssociated()) out.add(e.path());
        }
        return Collections.unmodifiableSortedSet(out);
    }

    /**
     * Absolute template directory of {@code moduleInfo}: the directory it was last registered with,
     * else its default one. It may not exist.
     */
    public Path templateDir(ModuleInfo moduleInfo) {
        Path registered = moduleDirectories.get(moduleInfo.dottedName());
        if (registered != null) {
            return registered;
        }
        return normalize(moduleInfo.resourcePath(moduleInfo.effectiveTemplateDirName()));
    }

    public Optional<FileTemplateEntry> entry(Path path) {
        return path == null ? Optional.empty() : Optional.ofNullable(byPath.get(normalize(path)));
    }

    public Set<Path> registeredDirectories() {
        return Collections.unmodifiableSet(registeredDirectories);
    }

    public int size() {
        return byPath.size();
    }

    boolean contains(Path templateDir, String templateName) {
        return entriesIn(normalize(templateDir)).containsKey(templateName);
    }

    void clear() {
        byPath.clear();
        byDirectory.clear();
        registeredDirectories.clear();
        moduleDirectories.clear();
        reportedFiles.clear();
    }

    /**
     * List {@code templateDir} and group template files by base name, in file name order.
     * Files without a factory are dropped; each one is reported only the first time it is seen.
     */
    private Map<String, List<Path>> groupByTemplateName(Path templateDir) {
        List<Path> files;
        try (Stream<Path> stream = Files.list(templateDir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list template directory " + templateDir, e);
        }

        Map<String, List<Path>> groups = new TreeMap<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (factories.factoryFor(extensionOf(fileName)).isEmpty()) {
                if (!reportedFiles.add(normalize(file))) {
                    continue;
                }
                warnings.warn(RegistryWarning.UNRECOGNIZED_EXTENSION,
                        "File '" + fileName + "' has an unrecognized extension in directory '" + templateDir + "'",
                        Map.of("file", fileName, "directory", templateDir.toString()));
                continue;
            }
            groups.computeIfAbsent(templateNameOf(fileName), n -> new ArrayList<>()).add(normalize(file));
        }
        return groups;
    }

    private Map<String, FileTemplateEntry> entriesIn(Path templateDir) {
        return byDirectory.getOrDefault(templateDir, Collections.emptyMap());
    }

    /** Editor droppings, hidden files and on-the-fly caches next to templates. */
    static boolean isIgnored(String fileName) {
        return fileName.startsWith(".") || fileName.endsWith("~") || fileName.endsWith(".cache");
    }

    static String templateNameOf(String fileName) {
        int idx = fileName.lastIndexOf('.');
        return idx <= 0 ? fileName : fileName.substring(0, idx);
    }

    static String extensionOf(String fileName) {
        int idx = fileName.lastIndexOf('.');
        return idx <= 0 ? "" : fileName.substring(idx + 1);
    }

    private static Path normalize(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
