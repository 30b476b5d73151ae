package com.team.buildrelay.model.event;

import java.util.Locale;

public enum AnnotationStyle {
    SUCCESS, WARNING, ERROR, INFO, OTHER;

    // exact lower-case match only
    public static AnnotationStyle fromWireName(String style) {
        if (style == null) return OTHER;
        for (AnnotationStyle value : values()) {
            if (value != OTHER && value.name().toLowerCase(Locale.ROOT).equals(style)) {
                return value;
            }
        }
        return OTHER;
    }
}
