package com.asiainfo.deepdive.core.filter;

import com.asiainfo.deepdive.shared.InvariantViolationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可过滤字段及其数据类型，列名与数据仓库一致
 */
public enum FilterField {
    PID("pid", DataType.NUMBER),
    MID("mid", DataType.NUMBER),
    ZID("zid", DataType.NUMBER),
    MONTH("month", DataType.NUMBER),
    YEAR("year", DataType.NUMBER),
    TEAM("team", DataType.STRING),
    PIC("pic", DataType.STRING),
    PRODUCT("product", DataType.STRING),
    H5("h5", DataType.STRING),
    PUBNAME("pubname", DataType.STRING),
    MEDIANAME("medianame", DataType.STRING),
    ZONENAME("zonename", DataType.STRING),
    REV_FLAG("rev_flag", DataType.STRING),
    DATE("date", DataType.DATE);

    public enum DataType { NUMBER, STRING, DATE }

    private final String column;
    private final DataType dataType;

    FilterField(String column, DataType dataType) {
        this.column = column;
        this.dataType = dataType;
    }

    @JsonValue
    public String column() {
        return column;
    }

    public DataType dataType() {
        return dataType;
    }

    @JsonCreator
    public static FilterField fromColumn(String column) {
        for (FilterField f : values()) {
            if (f.column.equalsIgnoreCase(column)) {
                return f;
            }
        }
        throw new InvariantViolationException("Unknown filter field: " + column);
    }
}
