package info.isaksson.erland.cppgen.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal warning produced while preparing or generating code. */
public final class GenerationWarning {

    /** Warning code stable across versions. */
    public final String code;

    public final String message;

    /** Optional structured context, e.g. file and line. */
    public final Map<String, String> context;

    public GenerationWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override
    public String toString() {
        if (context.isEmpty()) return code + ": " + message;
        StringBuilder sb = new StringBuilder(code).append(": ").append(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> e : context.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
