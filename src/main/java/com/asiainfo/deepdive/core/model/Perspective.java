package com.asiainfo.deepdive.core.model;

import com.asiainfo.deepdive.shared.InvariantViolationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 分析视角
 * 每个视角对应数据仓库中的一个分组维度，视角之间通过 child 构成下钻层级：
 * team -> pic -> pid -> mid -> zone，product -> zone
 */
public enum Perspective {

    TEAM("team", "Team Analysis", "team", "team", "COUNT(DISTINCT pic)"),
    PIC("pic", "PIC (Person in Charge) Analysis", "pic", "pic", "COUNT(DISTINCT pid)"),
    PID("pid", "Publisher Analysis", "pid", "MAX(pubname)", "COUNT(DISTINCT mid)"),
    MID("mid", "Media Property Analysis", "mid", "MAX(medianame)", "COUNT(DISTINCT zid)"),
    PRODUCT("product", "Product Analysis", "product", "product", "COUNT(DISTINCT zid)"),
    ZONE("zone", "Zone Analysis", "zid", "MAX(zonename)", null);

    private final String id;
    private final String displayName;
    private final String groupingKey;      // GROUP BY 列
    private final String nameExpression;   // 名称列表达式
    private final String childCountExpression; // 下级实体数，叶子为 null

    static {
        // 下钻层级必须是无环的
        for (Perspective p : values()) {
            Set<Perspective> seen = EnumSet.of(p);
            Perspective cursor = p.child();
            while (cursor != null) {
                if (!seen.add(cursor)) {
                    throw new ExceptionInInitializerError("Perspective hierarchy has a cycle at " + p.id);
                }
                cursor = cursor.child();
            }
        }
    }

    Perspective(String id, String displayName, String groupingKey, String nameExpression,
            String childCountExpression) {
        this.id = id;
        this.displayName = displayName;
        this.groupingKey = groupingKey;
        this.nameExpression = nameExpression;
        this.childCountExpression = childCountExpression;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String groupingKey() {
        return groupingKey;
    }

    public String nameExpression() {
        return nameExpression;
    }

    public String childCountExpression() {
        return childCountExpression;
    }

    /**
     * 下钻的下一级视角，叶子视角返回 null
     */
    public Perspective child() {
        return switch (this) {
            case TEAM -> PIC;
            case PIC -> PID;
            case PID -> MID;
            case MID, PRODUCT -> ZONE;
            case ZONE -> null;
        };
    }

    public boolean isLeaf() {
        return child() == null;
    }

    /**
     * 所有能通过 child 链下钻到当前视角的上级视角
     */
    public Set<Perspective> ancestors() {
        Set<Perspective> result = EnumSet.noneOf(Perspective.class);
        for (Perspective p : values()) {
            if (p != this && p.isAncestorOf(this)) {
                result.add(p);
            }
        }
        return result;
    }

    public boolean isAncestorOf(Perspective other) {
        Perspective cursor = child();
        while (cursor != null) {
            if (cursor == other) {
                return true;
            }
            cursor = cursor.child();
        }
        return false;
    }

    @JsonCreator
    public static Perspective fromId(String id) {
        for (Perspective p : values()) {
            if (p.id.equalsIgnoreCase(id)) {
                return p;
            }
        }
        throw new InvariantViolationException("Unknown perspective: " + id);
    }

    /**
     * 按视角 id 或分组键解析（zone 的分组键为 zid）
     */
    public static Perspective fromGroupingKey(String key) {
        for (Perspective p : values()) {
            if (p.id.equalsIgnoreCase(key) || p.groupingKey.equalsIgnoreCase(key)) {
                return p;
            }
        }
        throw new InvariantViolationException("Unknown grouping key: " + key);
    }
}
