package io.openproposal.composer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComposerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ComposerApplication.class, args);
  }
}
