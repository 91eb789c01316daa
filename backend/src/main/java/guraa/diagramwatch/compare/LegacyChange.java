package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import guraa.diagramwatch.model.BoundingBox;
import lombok.Builder;
import lombok.Value;

/**
 * Uniform view of any change, in the flat shape older consumers read from {@code changes[]}.
 */
@Value
@Builder
@JsonPropertyOrder({"change_type", "category", "old_text", "new_text", "old_position", "new_position", "description"})
public class LegacyChange {

    @JsonProperty("change_type")
    String changeType;

    @JsonProperty("category")
    ChangeCategory category;

    @JsonProperty("old_text")
    String oldText;

    @JsonProperty("new_text")
    String newText;

    @JsonProperty("old_position")
    BoundingBox oldPosition;

    @JsonProperty("new_position")
    BoundingBox newPosition;

    @JsonProperty("description")
    String description;
}
