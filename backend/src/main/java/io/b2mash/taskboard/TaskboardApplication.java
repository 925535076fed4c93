package io.b2mash.taskboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskboardApplication.class, args);
  }
}
