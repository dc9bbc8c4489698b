package com.scholary.video.fetcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoFetcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoFetcherApplication.class, args);
  }
}
