package com.flamingo.ai.studystructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document structure extraction service. */
@SpringBootApplication
public class StudyStructureApplication {

  public static void main(String[] args) {
    SpringApplication.run(StudyStructureApplication.class, args);
  }
}
