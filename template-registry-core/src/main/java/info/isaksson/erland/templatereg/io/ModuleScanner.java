package info.isaksson.erland.templatereg.io;

import info.isaksson.erland.templatereg.model.DirectoryModuleInfo;
import info.isaksson.erland.templatereg.model.ModuleInfo;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of modules that own a template directory.
 *
 * <p>A directory {@code a/b/mammoth_templates} under the root stands for module {@code a.b.mammoth}
 * whose resources live in {@code a/b}. Results are sorted by dotted name.</p>
 */
public final class ModuleScanner {

    private ModuleScanner() {}

    /**
     * Scan for template directories under {@code root}.
     *
     * @param root root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to root, using '/' separators
     */
    public static List<DirectoryModuleInfo> scan(Path root, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(root, "root");
        final Path base = root.toAbsolutePath().normalize();
        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(base)) {
            List<DirectoryModuleInfo> out = new ArrayList<>();
            stream
                .filter(Files::isDirectory)
                .filter(p -> !p.equals(base))
                .filter(p -> isTemplateDirName(p.getFileName().toString()))
                .filter(p -> !isInCommonBuildDir(base, p))
                .filter(p -> !matchesAny(base, p, excludeMatchers))
                .forEach(p -> out.add(toModule(base, p)));

            out.sort(Comparator.comparing(ModuleInfo::dottedName));
            return out;
        }
    }

    /**
     * Module for a dotted name that was not found by scanning: {@code a.b.c} lives in {@code root/a/b}.
     */
    public static DirectoryModuleInfo moduleFor(Path root, String dottedName) {
        Objects.requireNonNull(root, "root");
        if (dottedName == null || dottedName.isBlank()) {
            throw new IllegalArgumentException("dottedName must not be blank");
        }
        String[] parts = dottedName.trim().split("\\.");
        Path dir = root.toAbsolutePath().normalize();
        for (int i = 0; i < parts.length - 1; i++) {
            dir = dir.resolve(parts[i]);
        }
        return new DirectoryModuleInfo(dottedName.trim(), dir);
    }

    static boolean isTemplateDirName(String name) {
        return name.endsWith(ModuleInfo.DEFAULT_TEMPLATE_DIR_SUFFIX)
                && name.length() > ModuleInfo.DEFAULT_TEMPLATE_DIR_SUFFIX.length()
                && !name.startsWith(".");
    }

    private static DirectoryModuleInfo toModule(Path root, Path templateDir) {
        String dirName = templateDir.getFileName().toString();
        String moduleName = dirName.substring(0, dirName.length() - ModuleInfo.DEFAULT_TEMPLATE_DIR_SUFFIX.length());
        Path resourceRoot = templateDir.getParent();
        String rel = normalizeRel(root, resourceRoot);
        String dotted = rel.isEmpty() ? moduleName : rel.replace('/', '.') + "." + moduleName;
        return new DirectoryModuleInfo(dotted, resourceRoot);
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            // Normalize to use forward slashes to be consistent across OSes.
            pattern = pattern.replace("\\", "/");

            // A plain directory pattern means "anything under this directory".
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isInCommonBuildDir(Path root, Path absolutePath) {
        String rel = normalizeRel(root, absolutePath);
        return rel.startsWith("target/")
                || rel.startsWith("build/")
                || rel.startsWith("out/")
                || rel.startsWith(".git/")
                || rel.startsWith(".idea/")
                || rel.startsWith("node_modules/");
    }

    private static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.relativize(p));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
