package com.stratus.hosting;

import lombok.Value;

import java.util.Locale;

/**
 * A table entity type and its physical table name. The name is null when the
 * naming convention cannot produce one and nothing overrides it.
 */
@Value
public class TableRegistration {
    public static final String TABLE_VARIABLE_PREFIX = "TABLE_";

    Class<?> entityType;
    String tableName;

    public String getEntityName() {
        return entityType.getSimpleName();
    }

    /**
     * @throws StratusException if neither the convention nor an override gives a name
     */
    public String physicalName() {
        if (tableName == null) {
            throw new StratusException("Cannot derive a table name for entity '" + getEntityName()
                    + "' because it already ends in 's'. Annotate it with @TableName or pass a name "
                    + "to addTable(" + getEntityName() + ".class, options -> options.setTableName(...)).");
        }
        return tableName;
    }

    /** Environment variable that carries the deployed table name, e.g. {@code TABLE_ORDER}. */
    public String environmentVariable() {
        return TABLE_VARIABLE_PREFIX + getEntityName().toUpperCase(Locale.ROOT);
    }

    static String conventionName(Class<?> entityType) {
        String simpleName = entityType.getSimpleName();
        if (simpleName.endsWith("s") || simpleName.endsWith("S")) {
            return null;
        }
        return simpleName + "s";
    }
}
