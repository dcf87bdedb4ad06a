package io.fieldtree.cli;

import java.nio.file.Path;

/**
 * Command and inputs of one CLI invocation.
 *
 * Supports:
 *  - command:      compile | decode | help
 *  - schemaPath:   schema type graph JSON (required)
 *  - documentPath: parsed document JSON (required)
 *  - operation:    operation to compile or decode; the only one when the document has one
 *  - fragment:     compile a fragment definition instead of an operation
 *  - catchAll:     decode unmatched runtime types with the shared fields instead of failing
 *  - optionsPath:  compiler options JSON (optional)
 *  - payloadPath:  base payload JSON (decode)
 *  - variablesPath: variables JSON object (optional)
 *  - patchesPath:  JSON array of incremental patches (optional)
 */
public record CliConfig(
        String command,
        Path schemaPath,
        Path documentPath,
        String operation,
        String fragment,
        boolean catchAll,
        Path optionsPath,
        Path payloadPath,
        Path variablesPath,
        Path patchesPath
) {

    /**
     * Small CLI parser: {@code <command> [options]}.
     *
     * Supported flags:
     *   --schema,    -s  <path>
     *   --document,  -d  <path>
     *   --operation, -o  <name>
     *   --fragment,  -f  <name>
     *   --catch-all
     *   --options        <path>
     *   --payload,   -p  <path>
     *   --variables, -v  <path>
     *   --patches        <path>
     *   --help,      -h
     *
     * @throws Cli.CliException on unknown flags, missing values or missing required inputs
     */
    public static CliConfig fromArgs(String[] args) {
        if (args.length == 0) throw new Cli.CliException("missing command");
        String command = args[0];
        if (command.equals("--help") || command.equals("-h") || command.equals("help")) return help();
        if (!command.equals("compile") && !command.equals("decode")) {
            throw new Cli.CliException("unknown command: " + command);
        }

        Path schema = null;
        Path document = null;
        String operation = null;
        String fragment = null;
        boolean catchAll = false;
        Path options = null;
        Path payload = null;
        Path variables = null;
        Path patches = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return help();
                }
                case "--schema", "-s" -> schema = Path.of(value(args, i++));
                case "--document", "-d" -> document = Path.of(value(args, i++));
                case "--operation", "-o" -> operation = value(args, i++);
                case "--fragment", "-f" -> fragment = value(args, i++);
                case "--catch-all" -> catchAll = true;
                case "--options" -> options = Path.of(value(args, i++));
                case "--payload", "-p" -> payload = Path.of(value(args, i++));
                case "--variables", "-v" -> variables = Path.of(value(args, i++));
                case "--patches" -> patches = Path.of(value(args, i++));
                default -> throw new Cli.CliException("unknown option: " + args[i]);
            }
        }

        if (schema == null) throw new Cli.CliException(command + " requires --schema");
        if (document == null) throw new Cli.CliException(command + " requires --document");
        if (operation != null && fragment != null) {
            throw new Cli.CliException("--operation and --fragment are mutually exclusive");
        }
        if (command.equals("decode")) {
            if (payload == null) throw new Cli.CliException("decode requires --payload");
            if (fragment != null) throw new Cli.CliException("decode works on operations, not fragments");
        }
        return new CliConfig(command, schema, document, operation, fragment, catchAll, options, payload,
                variables, patches);
    }

    public boolean isHelp() { return command.equals("help"); }

    private static CliConfig help() {
        return new CliConfig("help", null, null, null, null, false, null, null, null, null);
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) throw new Cli.CliException("missing value for option: " + args[i]);
        return args[i + 1];
    }
}
