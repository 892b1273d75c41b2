package com.flamingo.richtext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the rich-text editing service. */
@SpringBootApplication
public class RichTextEditorApplication {

  public static void main(String[] args) {
    SpringApplication.run(RichTextEditorApplication.class, args);
  }
}
