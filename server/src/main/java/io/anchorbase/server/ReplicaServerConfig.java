package io.anchorbase.server;

/**
 * Replica server configuration parsed from CLI args.
 *
 * @param host interface to bind
 * @param port HTTP port
 */
public record ReplicaServerConfig(String host, int port) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8080;

    public ReplicaServerConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Supported flags:
     *   --port, -p   <port>
     *   --host       <address>
     *   --help, -h
     *
     * All flags are optional. Exits the process on --help or a malformed flag.
     */
    public static ReplicaServerConfig fromArgs(String[] args) {
        try {
            return parse(args);
        } catch (HelpRequested help) {
            printHelp();
            System.exit(0);
        } catch (IllegalArgumentException bad) {
            System.err.println(bad.getMessage());
            printHelp();
            System.exit(1);
        }
        throw new IllegalStateException("unreachable");
    }

    /** Parse without exiting; --help surfaces as {@link HelpRequested}. */
    static ReplicaServerConfig parse(String[] args) {
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> throw new HelpRequested();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    String raw = args[++i];
                    try {
                        port = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid port: " + raw, e);
                    }
                }

                case "--host" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ReplicaServerConfig(host, port);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static void printHelp() {
        System.out.println("""
            Usage: anchorbase-replica [options]

            Options:
              --port, -p   HTTP port (default: 8080)
              --host       Bind address (default: 0.0.0.0)
              --help, -h   Show this help message
            """);
    }

    static final class HelpRequested extends RuntimeException {
        HelpRequested() {
            super("help requested", null, false, false);
        }
    }
}
