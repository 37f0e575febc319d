package io.tradedesk.opsengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpsEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpsEngineApplication.class, args);
  }
}
