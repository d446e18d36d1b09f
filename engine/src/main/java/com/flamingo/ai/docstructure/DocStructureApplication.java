package com.flamingo.ai.docstructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot entry point wiring the structuring pipeline beans. */
@SpringBootApplication
public class DocStructureApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocStructureApplication.class, args);
  }
}
