package info.isaksson.erland.cppgen.cli;

import info.isaksson.erland.cppgen.core.GenerationWarnings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value strings read from i18n files of {@code key = value} lines, in first-seen order.
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. Malformed lines and repeated keys
 * are reported as warnings; for a repeated key the first value is kept.</p>
 */
public final class I18nStrings {

    public static final String W_MALFORMED_LINE = "i18n.malformed-line";
    public static final String W_EMPTY_KEY = "i18n.empty-key";
    public static final String W_INVALID_KEY = "i18n.invalid-key";
    public static final String W_DUPLICATE_KEY = "i18n.duplicate-key";

    private final Map<String, String> values = new LinkedHashMap<>();
    private final GenerationWarnings warnings;

    public I18nStrings(GenerationWarnings warnings) {
        this.warnings = warnings == null ? new GenerationWarnings() : warnings;
    }

    public I18nStrings load(Path file) throws IOException {
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8), file.getFileName().toString());
    }

    public I18nStrings parse(List<String> lines, String source) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String where = String.valueOf(i + 1);

            int eq = line.indexOf('=');
            if (eq < 0) {
                warnings.warn(W_MALFORMED_LINE, "Line has no '=': " + line, "file", source, "line", where);
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if (key.isEmpty()) {
                warnings.warn(W_EMPTY_KEY, "Line has an empty key: " + line, "file", source, "line", where);
                continue;
            }
            if (!I18nConfig.isIdentifier(key)) {
                warnings.warn(W_INVALID_KEY, "Key is not a valid identifier: " + key, "file", source, "line", where);
                continue;
            }
            if (values.containsKey(key)) {
                warnings.warn(W_DUPLICATE_KEY, "Duplicate key '" + key + "' ignored", "file", source, "line", where);
                continue;
            }
            values.put(key, value);
        }
        return this;
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    public GenerationWarnings warnings() {
        return warnings;
    }

    /** The value as a C++ string literal; text already in double quotes is kept as is. */
    public static String toLiteral(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
