package com.asiainfo.deepdive.shared;

import java.util.regex.Pattern;

public class DeepDiveConstants {

    // Pareto 分层阈值（累计收入占比）
    public static final double TIER_A_THRESHOLD = 0.80;
    public static final double TIER_B_THRESHOLD = 0.95;

    // 表名/列名只允许普通标识符，防止拼进 SQL
    public static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // 缓存 Key 中各段的分隔符
    public static final String CACHE_KEY_SEPARATOR = "_";

    private DeepDiveConstants() {}
}
