package info.isaksson.erland.templatereg;

import info.isaksson.erland.templatereg.core.TemplateRegistryOptions;
import info.isaksson.erland.templatereg.core.TemplateRegistryResult;
import info.isaksson.erland.templatereg.core.TemplateRegistryService;
import info.isaksson.erland.templatereg.manifest.AuditReportJson;
import info.isaksson.erland.templatereg.manifest.ManifestJson;
import info.isaksson.erland.templatereg.manifest.RegistryManifest;
import info.isaksson.erland.templatereg.registry.TemplateConfigurationException;
import info.isaksson.erland.templatereg.registry.TemplateLookupException;
import info.isaksson.erland.templatereg.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: register every template under a root, check the declared views and report
 * templates nobody uses.
 *
 * Exit codes: 0 ok, 1 usage error, 2 configuration or I/O error, 3 unassociated templates with
 * {@code --fail-on-unassociated true}.
 */
public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    private static final TemplateRegistryService SERVICE = new TemplateRegistryService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.root == null) {
            System.err.println("Error: --root is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path rootPath = Paths.get(parsed.root).toAbsolutePath().normalize();
        if (!Files.isDirectory(rootPath)) {
            System.err.println("Error: --root must be an existing directory: " + rootPath);
            return 1;
        }

        RegistryManifest manifest = RegistryManifest.empty();
        if (parsed.manifest != null) {
            final Path manifestPath = Paths.get(parsed.manifest).toAbsolutePath().normalize();
            if (!Files.isRegularFile(manifestPath)) {
                System.err.println("Error: --manifest must point to an existing JSON file: " + manifestPath);
                return 1;
            }
            try {
                manifest = ManifestJson.read(manifestPath);
            } catch (IOException e) {
                System.err.println("Error: could not read manifest: " + manifestPath);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        final Path reportOut = resolveReportOutput(parsed.report, parsed.output);
        final Path jsonOut = parsed.json == null ? null : Paths.get(parsed.json).toAbsolutePath().normalize();

        final TemplateRegistryResult res;
        try {
            res = SERVICE.run(rootPath, manifest, toCoreOptions(parsed));
        } catch (TemplateConfigurationException | TemplateLookupException e) {
            System.err.println("Error: template configuration is invalid.");
            System.err.println(e.getMessage());
            LOGGER.debug("Registration of {} failed", rootPath, e);
            return 2;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Error: could not scan " + rootPath);
            System.err.println(e.getMessage());
            LOGGER.debug("Scanning {} failed", rootPath, e);
            return 2;
        }

        try {
            ReportGenerator.writeMarkdown(reportOut, res, parsed.excludes, res.failOnUnassociated);
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        if (jsonOut != null) {
            try {
                AuditReportJson.write(res.toAuditReport(), jsonOut);
            } catch (IOException e) {
                System.err.println("Error: could not write JSON report to: " + jsonOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        System.out.println(
                "template-registry\n" +
                "- Root: " + rootPath + "\n" +
                "- Report: " + reportOut + "\n" +
                (jsonOut != null ? "- JSON: " + jsonOut + "\n" : "") +
                "- Modules: " + res.modules.size() + "\n" +
                "- File templates: " + res.fileTemplateCount() + "\n" +
                "- Inline templates: " + res.inlineTemplateCount() + "\n" +
                "- Views checked: " + res.viewsChecked + "\n" +
                "- Warnings: " + res.warnings.size() + "\n" +
                "- Unassociated: " + res.audit.count()
        );

        if (res.isFailedByUnassociated()) {
            System.err.println("Unassociated templates present (" + res.audit.count() + ") and --fail-on-unassociated is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }
        return 0;
    }

    private static TemplateRegistryOptions toCoreOptions(CliArgs parsed) {
        TemplateRegistryOptions o = new TemplateRegistryOptions();
        if (!parsed.extensions.isEmpty()) {
            o.extensions = new ArrayList<>(parsed.extensions);
        }
        o.excludes = new ArrayList<>(parsed.excludes);
        o.failOnUnassociated = parsed.failOnUnassociated;
        return o;
    }

    private static Path resolveReportOutput(String reportArg, String outputArg) {
        if (reportArg != null && !reportArg.isBlank()) {
            return Paths.get(reportArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve("template-report.md");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String root;
        String output = "./output";
        String report;
        String json;
        String manifest;
        boolean failOnUnassociated = false;
        final List<String> extensions = new ArrayList<>();
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }
                if (a.startsWith("--extension=")) {
                    out.extensions.add(parseExtension(a.substring("--extension=".length())));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--root":
                        out.root = requireValue(args, ++i, "--root");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--json":
                        out.json = requireValue(args, ++i, "--json");
                        break;
                    case "--manifest":
                        out.manifest = requireValue(args, ++i, "--manifest");
                        break;
                    case "--extension":
                        out.extensions.add(parseExtension(requireValue(args, ++i, "--extension")));
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--fail-on-unassociated":
                        out.failOnUnassociated = parseBoolean(requireValue(args, ++i, "--fail-on-unassociated"), "--fail-on-unassociated");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --root
                        if (out.root == null) {
                            out.root = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String parseExtension(String v) {
            String s = v == null ? "" : v.trim();
            if (s.startsWith(".")) s = s.substring(1);
            if (s.isEmpty() || s.contains("/") || s.contains("\\")) {
                throw new IllegalArgumentException("Invalid value for --extension: " + v);
            }
            return s;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "template-registry\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar template-registry.jar --root <path> [--manifest <file.json>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --root <path>          Root folder; every '<module>_templates' directory below it is registered (required)\n" +
                    "  --manifest <file>      JSON manifest with inline templates, template directory overrides and views\n" +
                    "  --extension <ext>      Template file extension (repeatable, default: pt). Also supports --extension=<ext>.\n" +
                    "  --exclude <glob>       Exclude template directories matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to --root* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --output <dir>         Output folder for the markdown report (default: ./output)\n" +
                    "  --report <file>        Markdown report path (default: <output>/template-report.md)\n" +
                    "  --json <file>          Also write a JSON report\n" +
                    "  --fail-on-unassociated <bool>  Exit with code 3 when templates are left unassociated (default: false)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar template-registry.jar --root app --manifest app/views.json\n" +
                    "  java -jar template-registry.jar app --extension pt --extension cpt --fail-on-unassociated true\n"
            );
        }
    }
}
