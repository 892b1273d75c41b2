package com.flamingo.richtext.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.richtext.api.rest.EditorController;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the editor endpoints keep their paths.
 *
 * <ul>
 *   <li>GET /api/sessions/{id}/editor/init, /render, /download
 *   <li>POST /api/sessions/{id}/editor/update, /update_node, /update_range, /insert_text,
 *       /delete_range, /delete_backward, /delete_forward, /insert_break, /undo, /redo, /upload
 *   <li>DELETE /api/sessions/{id}/editor
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("EditorController API contract")
  class EditorControllerContract {

    @Test
    @DisplayName("should be mapped to /api/sessions/{sessionId}/editor")
    void shouldBeMappedUnderSession() {
      RequestMapping mapping = EditorController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/sessions/{sessionId}/editor");
    }

    @Test
    @DisplayName("should expose read endpoints over GET")
    void shouldExposeReadEndpoints() {
      List<String> paths =
          Arrays.stream(EditorController.class.getDeclaredMethods())
              .map(method -> method.getAnnotation(GetMapping.class))
              .filter(mapping -> mapping != null)
              .flatMap(mapping -> Arrays.stream(mapping.value()))
              .toList();

      assertThat(paths).containsExactlyInAnyOrder("/init", "/render", "/download");
    }

    @Test
    @DisplayName("should expose mutations over POST")
    void shouldExposeMutations() {
      List<String> paths =
          Arrays.stream(EditorController.class.getDeclaredMethods())
              .map(EditorControllerContract::postPaths)
              .flatMap(List::stream)
              .toList();

      assertThat(paths)
          .containsExactlyInAnyOrder(
              "/update",
              "/update_node",
              "/update_range",
              "/insert_text",
              "/delete_range",
              "/delete_backward",
              "/delete_forward",
              "/insert_break",
              "/undo",
              "/redo",
              "/upload");
    }

    private static List<String> postPaths(Method method) {
      PostMapping mapping = method.getAnnotation(PostMapping.class);
      if (mapping == null) {
        return List.of();
      }
      return mapping.value().length > 0
          ? Arrays.asList(mapping.value())
          : Arrays.asList(mapping.path());
    }
  }
}
