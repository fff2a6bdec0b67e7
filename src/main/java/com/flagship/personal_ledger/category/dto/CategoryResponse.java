package com.flagship.personal_ledger.category.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.category.Category;
import com.flagship.personal_ledger.common.FlowType;
import lombok.Value;

import java.util.UUID;

@Value
public class CategoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("flow_type")
    FlowType flowType;

    @JsonProperty("system_key")
    String systemKey;

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.getId(), category.getName(), category.getFlowType(),
            category.isSystem() ? category.getSystemKey().key() : null);
    }
}
