package info.isaksson.erland.cppgen.render;

/** Targeted C++ language standard; ordered from oldest to newest. */
public enum CppStandard {
    CPP_03("c++03"),
    CPP_11("c++11");

    public final String cliValue;

    CppStandard(String cliValue) {
        this.cliValue = cliValue;
    }

    public boolean isAtLeast(CppStandard other) {
        return compareTo(other) >= 0;
    }

    public static CppStandard parseCli(String v) {
        if (v == null) return CPP_11;
        String s = v.trim().toLowerCase();
        switch (s) {
            case "c++03":
            case "cpp03":
            case "03":
                return CPP_03;
            case "c++11":
            case "cpp11":
            case "11":
                return CPP_11;
            default:
                throw new IllegalArgumentException("Invalid value for --std: " + v + " (expected one of: c++03|c++11)");
        }
    }
}
