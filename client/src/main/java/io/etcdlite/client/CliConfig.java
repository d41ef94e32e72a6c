// file: client/src/main/java/io/etcdlite/client/CliConfig.java
package io.etcdlite.client;

/**
 * Shell configuration parsed from CLI args.
 *
 * Supports:
 *  - dumpEntries: log request handling and every entry after each request
 *  - scriptPath:  read commands from this file instead of stdin (optional)
 */
public record CliConfig(boolean dumpEntries, String scriptPath) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --dump-entries, -d
     *   --script,       -s  <path>
     *   --help,         -h
     */
    public static CliConfig fromArgs(String[] args) {
        boolean dumpEntries = false;
        String scriptPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--dump-entries", "-d" -> dumpEntries = true;

                case "--script", "-s" -> {
                    ensureValue(args, i);
                    scriptPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new CliConfig(dumpEntries, scriptPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: etcdlite-shell [options]

            Options:
              --dump-entries, -d   Log requests and dump all entries after each one
              --script,       -s   Read commands from a file instead of stdin
              --help,         -h   Show this help message
            """);
        System.exit(0);
    }
}
