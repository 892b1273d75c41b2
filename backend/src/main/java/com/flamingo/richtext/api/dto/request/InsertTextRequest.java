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

/** Request DTO for inserting text at a caret. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InsertTextRequest implements VersionedEditRequest {

  @NotBlank(message = "Document id is required")
  private String docId;

  @NotNull(message = "Base version is required")
  @PositiveOrZero
  private Long baseVersion;

  @NotBlank(message = "Client operation id is required")
  private String clientOpId;

  @NotBlank(message = "Node id is required")
  private String nodeId;

  @NotNull(message = "Offset is required")
  @PositiveOrZero
  private Integer offset;

  @NotNull(message = "Text is required")
  private String text;

  /** Optional formatting for the inserted text. */
  @Valid private StyleRequest style;

  public StyleUpdate toStyleUpdate() {
    return StyleRequest.toStyleUpdate(style);
  }
}
