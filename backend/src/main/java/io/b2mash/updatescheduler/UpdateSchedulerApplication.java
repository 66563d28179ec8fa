package io.b2mash.updatescheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class UpdateSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(UpdateSchedulerApplication.class, args);
  }
}
