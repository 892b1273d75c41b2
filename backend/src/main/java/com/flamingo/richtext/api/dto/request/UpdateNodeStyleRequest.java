package com.flamingo.richtext.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.richtext.domain.model.StyleUpdate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for restyling part of a single run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateNodeStyleRequest implements VersionedEditRequest {

  @NotBlank(message = "Document id is required")
  private String docId;

  @NotNull(message = "Base version is required")
  @PositiveOrZero
  private Long baseVersion;

  @NotBlank(message = "Client operation id is required")
  private String clientOpId;

  @NotBlank(message = "Node id is required")
  private String nodeId;

  @NotNull(message = "Start offset is required")
  @PositiveOrZero
  private Integer startOffset;

  @NotNull(message = "End offset is required")
  @PositiveOrZero
  private Integer endOffset;

  @Valid private StyleRequest style;

  public StyleUpdate toStyleUpdate() {
    return StyleRequest.toStyleUpdate(style);
  }
}
