package com.stratus.hosting;

import lombok.Data;

/**
 * Explicit per-table overrides.
 */
@Data
public class TableOptions {
    private String tableName;
}
