package com.opensciencecatalog.backend;

import com.opensciencecatalog.backend.config.CatalogItemsProperties;
import com.opensciencecatalog.backend.config.GitHubBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({GitHubBackendProperties.class, CatalogItemsProperties.class})
public class CatalogBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(CatalogBackendApplication.class, args);
  }
}
