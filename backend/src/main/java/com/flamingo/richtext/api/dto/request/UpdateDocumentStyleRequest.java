package com.flamingo.richtext.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.richtext.domain.enums.Alignment;
import com.flamingo.richtext.domain.model.StyleUpdate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for restyling the whole document. Style fields sit at the top level. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateDocumentStyleRequest implements VersionedEditRequest {

  @NotBlank(message = "Document id is required")
  private String docId;

  @NotNull(message = "Base version is required")
  @PositiveOrZero
  private Long baseVersion;

  @NotBlank(message = "Client operation id is required")
  private String clientOpId;

  private String fontName;

  @PositiveOrZero(message = "Font size must not be negative")
  private Double fontSize;

  @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Color must be #RRGGBB")
  private String color;

  private Alignment alignment;

  private Double firstLineIndent;

  private Boolean bold;

  private Boolean italic;

  public StyleUpdate toStyleUpdate() {
    return new StyleUpdate(fontName, fontSize, color, alignment, firstLineIndent, bold, italic);
  }
}
