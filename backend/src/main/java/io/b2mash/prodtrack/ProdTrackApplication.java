package io.b2mash.prodtrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProdTrackApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProdTrackApplication.class, args);
  }
}
