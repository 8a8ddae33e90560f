package com.linlay.chatgateway.model.openai;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ModelListResponse(
        String object,
        List<ModelData> data
) {

    public static ModelListResponse of(List<ModelData> data) {
        return new ModelListResponse("list", data);
    }

    public record ModelData(
            String id,
            String object,
            long created,
            @JsonProperty("owned_by")
            String ownedBy
    ) {
    }
}
