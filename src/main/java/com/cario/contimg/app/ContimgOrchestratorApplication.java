package com.cario.contimg.app;

import com.cario.contimg.app.config.PipelineProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the continuum imaging orchestrator.
 *
 * <p>The service queues arrived observation files, forms them into time-contiguous processing
 * groups, tracks derived products in a registry and publishes finished products from staging to
 * production storage. External tools run inside one long-lived worker session.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class ContimgOrchestratorApplication {

  public static void main(String[] args) {
    log.info("Starting contimg orchestrator...");
    SpringApplication.run(ContimgOrchestratorApplication.class, args);
    log.info("Contimg orchestrator started.");
  }
}
