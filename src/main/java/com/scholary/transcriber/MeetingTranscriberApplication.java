package com.scholary.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetingTranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(MeetingTranscriberApplication.class, args);
  }
}
