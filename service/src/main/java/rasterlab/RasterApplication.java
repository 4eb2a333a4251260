package rasterlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RasterApplication {

  public static void main(String[] args) {
    SpringApplication.run(RasterApplication.class, args);
  }
}
