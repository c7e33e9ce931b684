package com.codeact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Execution runtimes a model may target from an action block.
 */
public enum RuntimeKind {
    GENERAL_PURPOSE("general-purpose", ".py", Set.of("python", "py")),
    STATISTICAL("statistical", ".R", Set.of("r")),
    SHELL("shell", ".sh", Set.of("bash", "sh"));

    private final String tag;
    private final String scriptExtension;
    private final Set<String> aliases;

    RuntimeKind(String tag, String scriptExtension, Set<String> aliases) {
        this.tag = tag;
        this.scriptExtension = scriptExtension;
        this.aliases = aliases;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String scriptExtension() {
        return scriptExtension;
    }

    /**
     * Resolves a runtime tag or one of its aliases, case-insensitively.
     */
    public static Optional<RuntimeKind> fromTag(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(normalized) || kind.aliases.contains(normalized))
                .findFirst();
    }

    public static String knownTags() {
        return String.join(", ", Arrays.stream(values()).map(RuntimeKind::tag).toList());
    }
}
