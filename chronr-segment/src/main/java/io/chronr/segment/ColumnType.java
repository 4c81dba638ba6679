package io.chronr.segment;

import org.apache.commons.lang.StringUtils;

public enum ColumnType {
    TIMESTAMP(true, "TIMESTAMP", "DATETIME"),
    LONG(true, "LONG", "BIGINT"),
    DOUBLE(true, "DOUBLE"),
    STRING(false, "STRING", "VARCHAR"),
    //
    ;

    public final String[] names;
    private final boolean isNumber;

    ColumnType(boolean isNumber, String... names) {
        this.isNumber = isNumber;
        this.names = names;
    }

    public boolean isNumber() {
        return isNumber;
    }

    /**
     * Whether values of this type can act as sample timestamps.
     */
    public boolean isIntegral() {
        return this == TIMESTAMP || this == LONG;
    }

    public static ColumnType fromName(String name) {
        String upper = name.trim().toUpperCase();
        for (ColumnType type : values()) {
            for (String tname : type.names) {
                if (StringUtils.equals(tname, upper)) {
                    return type;
                }
            }
        }
        throw new IllegalStateException("Unsupported type: " + name);
    }
}
