package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.chatgateway.domain.model.ModelDescriptor;

import java.util.List;

/**
 * Response of {@code GET /v1/models}.
 */
public record ModelListResponse(String object, List<ModelInfo> data) {

    public static ModelListResponse of(List<ModelDescriptor> models, long created) {
        List<ModelInfo> data = models.stream()
                .map(m -> new ModelInfo(m.alias(), "model", created, "google", m.tier(), m.deprecated()))
                .toList();
        return new ModelListResponse("list", data);
    }

    public record ModelInfo(
            String id,
            String object,
            long created,
            @JsonProperty("owned_by") String ownedBy,
            String tier,
            boolean deprecated
    ) {
    }
}
