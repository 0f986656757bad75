package com.climbassessment.common.template;

/** Text fields a metric level may carry. */
public enum TextField {
    STRENGTH("strength"),
    WEAKNESS("weakness");

    private final String key;

    TextField(String key) {
        this.key = key;
    }

    public String key() { return key; }
}
