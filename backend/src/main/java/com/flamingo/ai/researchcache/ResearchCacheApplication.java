package com.flamingo.ai.researchcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchCacheApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchCacheApplication.class, args);
  }
}
