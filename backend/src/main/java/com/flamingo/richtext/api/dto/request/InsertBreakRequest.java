package com.flamingo.richtext.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for splitting a paragraph at a caret. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InsertBreakRequest implements VersionedEditRequest {

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
}
