package io.anchorbase.core.error;

import java.util.UUID;

/** A space or anchor that an operation requires does not exist. */
public class NotFoundException extends StorageException {
    private final String kind;
    private final UUID id;

    public NotFoundException(String kind, UUID id) {
        super(capitalize(kind) + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String kind() { return kind; }

    public UUID id() { return id; }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "Record";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
