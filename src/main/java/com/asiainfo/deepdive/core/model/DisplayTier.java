package com.asiainfo.deepdive.core.model;

import com.asiainfo.deepdive.shared.InvariantViolationException;

/**
 * 展示分组：existing 按 A/B/C，new/lost 各自归为一组
 */
public enum DisplayTier {
    A, B, C, NEW, LOST;

    public static DisplayTier fromCode(String code) {
        for (DisplayTier t : values()) {
            if (t.name().equalsIgnoreCase(code)) {
                return t;
            }
        }
        throw new InvariantViolationException("Unknown tier filter: " + code);
    }
}
