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

/** Request DTO for restyling a span that may cross runs and paragraphs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateRangeStyleRequest implements VersionedEditRequest {

  @NotBlank(message = "Document id is required")
  private String docId;

  @NotNull(message = "Base version is required")
  @PositiveOrZero
  private Long baseVersion;

  @NotBlank(message = "Client operation id is required")
  private String clientOpId;

  @NotBlank(message = "Start node id is required")
  private String startNodeId;

  @NotNull(message = "Start offset is required")
  @PositiveOrZero
  private Integer startOffset;

  @NotBlank(message = "End node id is required")
  private String endNodeId;

  @NotNull(message = "End offset is required")
  @PositiveOrZero
  private Integer endOffset;

  @Valid private StyleRequest style;

  public StyleUpdate toStyleUpdate() {
    return StyleRequest.toStyleUpdate(style);
  }
}
