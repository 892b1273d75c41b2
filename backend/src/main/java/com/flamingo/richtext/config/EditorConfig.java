package com.flamingo.richtext.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the editing core. */
@Configuration
@ConfigurationProperties(prefix = "editor")
@Getter
@Setter
public class EditorConfig {

  private History history = new History();
  private OpCache opCache = new OpCache();
  private Render render = new Render();
  private Addressing addressing = new Addressing();
  private DefaultDocument defaultDocument = new DefaultDocument();

  @Getter
  @Setter
  public static class History {
    /** Maximum entries on each of the undo and redo stacks. */
    private int capacity = 50;

    /** Insertions closer together than this share one undo step. */
    private Duration coalesceWindow = Duration.ofMillis(2500);
  }

  @Getter
  @Setter
  public static class OpCache {
    /** Maximum cached mutation responses per document; oldest evicted first. */
    private int capacity = 5000;
  }

  @Getter
  @Setter
  public static class Render {
    private int paragraphsPerPage = 40;
  }

  @Getter
  @Setter
  public static class Addressing {
    /**
     * When true, an edit naming an unbound address fails with a 404 and leaves version and history
     * untouched. When false the edit is a silent no-op that still advances the version.
     */
    private boolean strict = false;
  }

  @Getter
  @Setter
  public static class DefaultDocument {
    private List<String> paragraphs =
        new ArrayList<>(
            List.of(
                "Hello, this is a prototype document.",
                "You can change the font style of this text using the controls on the right.",
                "Select any span of text to restyle it, or start typing to edit."));
  }
}
