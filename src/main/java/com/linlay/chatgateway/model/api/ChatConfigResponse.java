package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatConfigResponse(
        @JsonProperty("max_attached_files_size_kb")
        int maxAttachedFilesSizeKb
) {
}
