package com.labelops.config;

import java.util.Objects;

/**
 * Condition selecting a service rule: the default fallback, or a tag found in the text.
 */
public record ServiceTrigger(Type type, String tag) {

    public enum Type {
        DEFAULT,
        TAG
    }

    public ServiceTrigger {
        Objects.requireNonNull(type, "type");
        tag = tag == null ? null : tag.trim();
    }

    public static ServiceTrigger byDefault() {
        return new ServiceTrigger(Type.DEFAULT, null);
    }

    public static ServiceTrigger tag(String tag) {
        return new ServiceTrigger(Type.TAG, tag);
    }

    public boolean isDefault() {
        return type == Type.DEFAULT;
    }
}
