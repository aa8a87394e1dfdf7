package io.tagkeeper.model;

public record Subject(String id, String kind) {
    public Subject {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Subject id must not be blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Subject kind must not be blank");
        }
        id = id.trim();
        kind = kind.trim();
    }

    public static Subject of(String kind, String id) {
        return new Subject(id, kind);
    }

    public static Subject parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Subject key must not be null");
        }
        int sep = key.indexOf(':');
        if (sep <= 0 || sep == key.length() - 1) {
            throw new IllegalArgumentException("Subject key must look like kind:id, got: " + key);
        }
        return new Subject(key.substring(sep + 1), key.substring(0, sep));
    }

    public String key() {
        return kind + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
