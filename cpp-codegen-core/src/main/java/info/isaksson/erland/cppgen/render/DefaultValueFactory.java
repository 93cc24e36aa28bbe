package info.isaksson.erland.cppgen.render;

import info.isaksson.erland.cppgen.model.CppVariable;

import java.util.Set;

/** Default initial values for well-known C++ types. */
public final class DefaultValueFactory {

    private static final Set<String> INTEGRAL_TYPES = Set.of("int", "long", "size_t");

    private DefaultValueFactory() {}

    public static boolean isIntegral(String type) {
        return INTEGRAL_TYPES.contains(type);
    }

    /**
     * The variable's init value if present, otherwise a default inferred from its type name.
     *
     * @throws IllegalArgumentException when no default is known for the type
     */
    public static String defaultValue(CppVariable variable) {
        if (variable.hasInitValue()) return variable.getInitValue();
        String type = variable.type;
        if (isIntegral(type)) return "0";
        if (type.contains("string") || type.contains("char")) return "\"\"";
        if (type.contains("float") || type.contains("double")) return "0.0";
        throw new IllegalArgumentException(
                "Cannot determine default init value for '" + variable.name + "' of type: " + type);
    }
}
