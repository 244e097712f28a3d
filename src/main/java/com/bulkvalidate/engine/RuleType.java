package com.bulkvalidate.engine;

/** Built-in rules, declared in the order they are evaluated. */
public enum RuleType {
    FULL_NAME_REQUIRED,
    EMAIL_REQUIRED,
    EMAIL_AT_SIGN,
    EMAIL_LENGTH,
    BLOCKED_DOMAIN
}
