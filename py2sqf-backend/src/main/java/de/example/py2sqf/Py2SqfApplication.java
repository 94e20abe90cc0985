package de.example.py2sqf;

import de.example.py2sqf.config.Py2SqfProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(Py2SqfProperties.class)
public class Py2SqfApplication {

  public static void main(String[] args) {
    SpringApplication.run(Py2SqfApplication.class, args);
  }
}
