package com.scholary.video.fetcher.config;

import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Servlet container tweaks for the file server.
 *
 * <p>Tomcat rejects {@code %2F} in request paths by default. Passing it through undecoded lets
 * encoded traversal attempts reach the artifact containment check, which answers 403.
 */
@Configuration
public class TomcatConfig {

  @Bean
  public WebServerFactoryCustomizer<TomcatServletWebServerFactory> encodedSlashCustomizer() {
    return factory ->
        factory.addConnectorCustomizers(
            connector -> connector.setEncodedSolidusHandling("passthrough"));
  }
}
