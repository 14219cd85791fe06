package com.asiainfo.deepdive.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 收入分层
 * A/B/C 用于 existing，NEW-* 与 LOST-* 分别在新增、流失实体内部排名
 */
public enum Tier {
    A("A", Rank.A, LifecycleStatus.EXISTING),
    B("B", Rank.B, LifecycleStatus.EXISTING),
    C("C", Rank.C, LifecycleStatus.EXISTING),
    NEW_A("NEW-A", Rank.A, LifecycleStatus.NEW),
    NEW_B("NEW-B", Rank.B, LifecycleStatus.NEW),
    NEW_C("NEW-C", Rank.C, LifecycleStatus.NEW),
    LOST_A("LOST-A", Rank.A, LifecycleStatus.LOST),
    LOST_B("LOST-B", Rank.B, LifecycleStatus.LOST),
    LOST_C("LOST-C", Rank.C, LifecycleStatus.LOST);

    public enum Rank { A, B, C }

    private final String label;
    private final Rank rank;
    private final LifecycleStatus status;

    Tier(String label, Rank rank, LifecycleStatus status) {
        this.label = label;
        this.rank = rank;
        this.status = status;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Rank rank() {
        return rank;
    }

    public LifecycleStatus status() {
        return status;
    }

    public DisplayTier displayTier() {
        return switch (status) {
            case NEW -> DisplayTier.NEW;
            case LOST -> DisplayTier.LOST;
            case EXISTING -> DisplayTier.valueOf(rank.name());
        };
    }

    public static Tier of(LifecycleStatus status, Rank rank) {
        for (Tier t : values()) {
            if (t.status == status && t.rank == rank) {
                return t;
            }
        }
        throw new IllegalArgumentException("No tier for " + status + "/" + rank);
    }

    @Override
    public String toString() {
        return label;
    }
}
