package com.tableedit;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import lombok.extern.java.Log;

/**
 * Command line entry point: opens a delimited text table in the user's editor, checks
 * the result and writes it back.
 */
@Log
public class TableEdit {

    static {
        // Load logging configuration from classpath but don't log yet
        try (InputStream loggingConfig = TableEdit.class.getResourceAsStream("/logging.properties")) {
            if (loggingConfig != null) {
                LogManager.getLogManager().readConfiguration(loggingConfig);
            } else {
                System.err.println("Warning: logging.properties not found, using default configuration");
            }
        } catch (IOException e) {
            System.err.println("Warning: Failed to load logging.properties: " + e.getMessage());
        }
    }

    private static void configureLogging(boolean debug) {
        Logger rootLogger = Logger.getLogger("");

        if (!debug) {
            // logs only go to file
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    rootLogger.removeHandler(handler);
                }
            }
        } else {
            Logger.getLogger("com.tableedit").setLevel(Level.FINE);
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    handler.setLevel(Level.FINE);
                }
            }
        }

        log.info("Logging configuration loaded - debug mode: " + debug);
    }

    public static void main(String[] args) {
        boolean debug = false;
        boolean json = false;
        String configFile = null;
        String profileName = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--debug".equals(arg)) {
                debug = true;
                continue;
            }
            if ("--json".equals(arg)) {
                json = true;
                continue;
            }
            if (arg.startsWith("--config")) {
                if (arg.contains("=")) {
                    configFile = arg.substring(arg.indexOf('=') + 1);
                } else if (i + 1 < args.length) {
                    configFile = args[++i];
                }
                continue;
            }
            if (arg.startsWith("--profile")) {
                if (arg.contains("=")) {
                    profileName = arg.substring(arg.indexOf('=') + 1);
                } else if (i + 1 < args.length) {
                    profileName = args[++i];
                }
                continue;
            }
            positional.add(arg);
        }

        configureLogging(debug);

        if (positional.isEmpty()) {
            System.err.println("Usage: tableedit [--debug] [--json] [--config <profiles.yaml>] [--profile <name>] <table-file> [output-file]");
            System.err.println();
            System.err.println("Options:");
            System.err.println("  --debug    Enable detailed console logging");
            System.err.println("  --json     Print the edit result as JSON to stdout");
            System.err.println("  --config   YAML file with edit profiles");
            System.err.println("  --profile  Profile to use from the config file (default: \"default\")");
            System.err.println();
            System.err.println("Notes:");
            System.err.println("  The editor is taken from the profile, then $VISUAL, then $EDITOR, then vi.");
            System.err.println("  Without output-file the edited table is written back to table-file,");
            System.err.println("  unless --json is given.");
            System.exit(1);
        }

        Path tableFile = Path.of(positional.get(0));
        Path outputFile = positional.size() > 1 ? Path.of(positional.get(1)) : null;

        try {
            EditProfile profile = configFile != null
                    ? EditProfileLoader.load(Path.of(configFile)).profile(profileName)
                    : new EditProfile();
            int status = run(tableFile, outputFile, profile, json);
            System.exit(status);
        } catch (IOException | InterruptedException | IllegalArgumentException e) {
            log.log(Level.SEVERE, "Fatal error during edit", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static int run(Path tableFile, Path outputFile, EditProfile profile, boolean json)
            throws IOException, InterruptedException {
        return run(tableFile, outputFile, profile, json, new ProcessEditorLauncher(profile.editor()));
    }

    /**
     * @return process exit status: 0 on success, 1 if the input or the edit is invalid
     */
    static int run(Path tableFile, Path outputFile, EditProfile profile, boolean json, EditorLauncher launcher)
            throws IOException, InterruptedException {
        EditOptions options = profile.toEditOptions();
        if (!Files.exists(tableFile)) {
            throw new FileNotFoundException("Table file not found: " + tableFile);
        }
        ParseResult loaded = new TableParser(options.format()).parse(tableFile);
        if (!loaded.isOk()) {
            System.err.println("Cannot load " + tableFile + ":");
            printErrors(loaded.errors());
            return 1;
        }
        Table original = loaded.toTable();
        log.log(Level.INFO, "Loaded {0} rows from {1}", new Object[] { original.rows().size(), tableFile });

        ReturnMode mode = options.returnMode();
        if (mode.needsOriginal() && !options.rules().hasKeyColumns()) {
            EditResult rejected = EditSession.configurationError("Return mode "
                    + mode.name().toLowerCase(Locale.ROOT) + " requires an original table and key columns");
            System.err.println("Invalid profile:");
            printErrors(rejected.errors());
            if (json) {
                System.out.println(ResultJson.toJson(rejected));
            }
            return 1;
        }

        EditSession session = new EditSession(launcher);
        EditResult result = session.run(original, options.withOriginal(original).withReturnMode(ReturnMode.FULL));
        if (!result.ok()) {
            System.err.println("Edit rejected:");
            printErrors(result.errors());
            if (json) {
                System.out.println(ResultJson.toJson(result));
            }
            return 1;
        }

        Table edited = result.table();
        Path target = outputFile != null ? outputFile : (json ? null : tableFile);
        if (target != null) {
            new TableWriter(options.writeOptions()).write(edited, target);
            log.log(Level.INFO, "Wrote {0} rows to {1}", new Object[] { edited.rows().size(), target });
        }

        EditResult report = result;
        if (options.rules().hasKeyColumns()) {
            TableDiff diff = new TableDiffer(options.rules().keyColumns()).diff(original, edited);
            printSummary(diff);
            if (options.returnMode() == ReturnMode.DIFF) {
                report = EditResult.success(diff);
            } else if (options.returnMode() == ReturnMode.CHANGES_ONLY) {
                report = EditResult.success(diff.toChanges());
            }
        }
        if (json) {
            System.out.println(ResultJson.toJson(report));
        }
        return 0;
    }

    private static void printErrors(List<ParseError> errors) {
        for (ParseError error : errors) {
            System.err.println("  " + error);
        }
    }

    private static void printSummary(TableDiff diff) {
        System.err.println("\n" + "=".repeat(60));
        System.err.println("SUMMARY");
        System.err.println("=".repeat(60));
        System.err.printf("Added:    %,d%n", diff.added().size());
        System.err.printf("Removed:  %,d%n", diff.removed().size());
        System.err.printf("Modified: %,d%n", diff.modified().size());
        System.err.printf("Total:    %,d%n", diff.changeCount());
        System.err.println("=".repeat(60));
    }
}
