package com.reelpilot.publisher.model;

import java.util.Locale;

/**
 * Unit costs charged by the video platform per API operation.
 */
public enum QuotaOperation {
    UPLOAD(1600),
    COMMENT(50),
    UPDATE(50),
    LIST(1),
    THUMBNAIL(0);

    private static final int UNKNOWN_OPERATION_COST = 1;

    private final int cost;

    QuotaOperation(int cost) {
        this.cost = cost;
    }

    public int getCost() {
        return cost;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static int costOf(String operation) {
        if (operation == null) {
            return UNKNOWN_OPERATION_COST;
        }
        for (QuotaOperation op : values()) {
            if (op.key().equalsIgnoreCase(operation)) {
                return op.cost;
            }
        }
        return UNKNOWN_OPERATION_COST;
    }
}
