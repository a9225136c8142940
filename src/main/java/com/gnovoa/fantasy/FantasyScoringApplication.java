// Namespace
package com.gnovoa.fantasy;

// Imports
import com.gnovoa.fantasy.config.ScoringProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(ScoringProperties.class)
public class FantasyScoringApplication {

  public static void main(String[] args) {
    SpringApplication.run(FantasyScoringApplication.class, args);
  }
}
