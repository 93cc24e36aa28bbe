package info.isaksson.erland.cppgen.cli;

/** Which diagnostic lines the CLI prints; each level includes the ones before it. */
public enum Verbosity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    DEBUG("debug");

    public final String cliValue;

    Verbosity(String cliValue) {
        this.cliValue = cliValue;
    }

    public boolean allows(Verbosity level) {
        return level.ordinal() <= ordinal();
    }

    public static Verbosity parseCli(String v) {
        if (v == null) return INFO;
        String s = v.trim().toLowerCase();
        switch (s) {
            case "error":
                return ERROR;
            case "warning":
            case "warn":
                return WARNING;
            case "info":
                return INFO;
            case "debug":
                return DEBUG;
            default:
                throw new IllegalArgumentException("Invalid value for --verbosity: " + v + " (expected one of: error|warning|info|debug)");
        }
    }
}
