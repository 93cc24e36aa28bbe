package info.isaksson.erland.cppgen.cli;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON configuration of the i18n front end.
 *
 * <pre>
 * {"strings": ["en.txt"], "className": "Config", "fileName": "Config"}
 * </pre>
 *
 * String file paths are resolved against the directory holding the configuration file.
 */
public final class I18nConfig {

    static final String DEFAULT_CLASS_NAME = "Config";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public final List<String> strings;
    public final String className;

    /** Base name of the generated files, without extension. */
    public final String fileName;

    @JsonCreator
    public I18nConfig(
            @JsonProperty("strings") List<String> strings,
            @JsonProperty("className") String className,
            @JsonProperty("fileName") String fileName
    ) {
        this.strings = strings == null ? List.of() : List.copyOf(strings);
        this.className = (className == null || className.isBlank()) ? DEFAULT_CLASS_NAME : className.trim();
        this.fileName = (fileName == null || fileName.isBlank()) ? this.className : fileName.trim();
    }

    public static I18nConfig read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        I18nConfig config;
        try (var in = Files.newInputStream(path)) {
            config = MAPPER.readValue(in, I18nConfig.class);
        }
        config.validate();
        return config;
    }

    public static I18nConfig readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        I18nConfig config = MAPPER.readValue(json, I18nConfig.class);
        config.validate();
        return config;
    }

    /** @throws IllegalArgumentException when the configuration cannot produce a class */
    void validate() {
        if (strings.isEmpty()) {
            throw new IllegalArgumentException("Config must list at least one file in 'strings'");
        }
        if (!isIdentifier(className)) {
            throw new IllegalArgumentException("Config 'className' is not a valid identifier: " + className);
        }
    }

    public List<Path> resolveStrings(Path configFile) {
        Path dir = configFile.toAbsolutePath().normalize().getParent();
        List<Path> out = new ArrayList<>();
        for (String s : strings) {
            out.add(dir.resolve(s).normalize());
        }
        return out;
    }

    static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches();
    }
}
