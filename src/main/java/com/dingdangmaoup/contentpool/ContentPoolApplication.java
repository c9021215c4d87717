package com.dingdangmaoup.contentpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentPoolApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentPoolApplication.class, args);
  }

}
