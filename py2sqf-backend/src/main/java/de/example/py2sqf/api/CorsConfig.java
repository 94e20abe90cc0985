package de.example.py2sqf.api;

import de.example.py2sqf.config.Py2SqfProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  private final Py2SqfProperties properties;

  public CorsConfig(Py2SqfProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
      .allowedOriginPatterns(properties.cors().allowedOriginPatterns().toArray(String[]::new))
      .allowedMethods("GET", "POST", "OPTIONS")
      .allowedHeaders("*")
      .maxAge(3600);
  }
}
