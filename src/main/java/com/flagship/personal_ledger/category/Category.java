package com.flagship.personal_ledger.category;

import com.flagship.personal_ledger.common.FlowType;
import lombok.Value;

import java.util.UUID;

/**
 * A transaction category. System categories have no owner, carry a
 * {@link SystemCategoryKey} and cannot be renamed or deleted.
 */
@Value
public class Category {
    UUID id;
    UUID ownerId;
    SystemCategoryKey systemKey;
    String name;
    FlowType flowType;

    public boolean isSystem() {
        return systemKey != null;
    }

    public enum SystemCategoryKey {
        INITIAL_BALANCE("initial_balance"),
        BALANCE_UPDATE("balance_update"),
        TRANSFER("transfer"),
        GENERAL("general");

        private final String key;

        SystemCategoryKey(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }

        public static SystemCategoryKey fromKey(String key) {
            for (SystemCategoryKey value : values()) {
                if (value.key.equals(key)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown system category key: " + key);
        }
    }
}
