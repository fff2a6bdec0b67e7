package com.flagship.personal_ledger.category.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.personal_ledger.common.FlowType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Create or rename. The flow type is only read on create.
 */
@Value
public class CategoryRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name is limited to 255 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("flow_type")
    FlowType flowType;
}
