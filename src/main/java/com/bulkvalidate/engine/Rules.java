package com.bulkvalidate.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class Rules {

    private Rules() {}

    public static List<ValidationRule> standard(PoolConfig cfg) {
        List<ValidationRule> rules = new ArrayList<>();
        for (RuleType type : RuleType.values()) {
            rules.add(forType(type, cfg));
        }
        return List.copyOf(rules);
    }

    public static ValidationRule forType(RuleType type, PoolConfig cfg) {
        return switch (type) {
            case FULL_NAME_REQUIRED -> r -> r.fullName.trim().isEmpty() ? "full_name is required" : null;
            case EMAIL_REQUIRED -> r -> r.email.trim().isEmpty() ? "email is required" : null;
            case EMAIL_AT_SIGN -> r -> r.email.contains("@") ? null : "email must contain '@'";
            case EMAIL_LENGTH -> {
                int max = cfg.maxEmailLength;
                yield r -> r.email.trim().length() > max ? "email too long" : null;
            }
            case BLOCKED_DOMAIN -> {
                String domain = cfg.blockedDomain.toLowerCase(Locale.ROOT);
                String suffix = "@" + domain;
                String message = domain + " emails are not allowed";
                yield r -> r.email.trim().toLowerCase(Locale.ROOT).endsWith(suffix) ? message : null;
            }
        };
    }
}
