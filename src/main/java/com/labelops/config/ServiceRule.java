package com.labelops.config;

import java.util.Objects;

/**
 * Named shipping service with its optional courier code and selection trigger.
 */
public record ServiceRule(String name, String code, ServiceTrigger trigger) {

    public ServiceRule {
        Objects.requireNonNull(trigger, "trigger");
        name = name == null ? "" : name.trim();
        code = code == null || code.isBlank() ? null : code.trim();
    }

    public static ServiceRule fallback(String name) {
        return new ServiceRule(name, null, ServiceTrigger.byDefault());
    }

    public static ServiceRule tagged(String name, String tag) {
        return new ServiceRule(name, null, ServiceTrigger.tag(tag));
    }

    public boolean isDefault() {
        return trigger.isDefault();
    }
}
