package com.flamingo.ai.tabbacklog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Tab backlog service: imports saved tabs, extracts their pages and enriches them with an LLM. */
@SpringBootApplication
public class TabBacklogApplication {

  public static void main(String[] args) {
    SpringApplication.run(TabBacklogApplication.class, args);
  }
}
