package com.example.idm;

import com.example.idm.properties.IdmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Identity Session Gateway
 *
 * Session bookkeeping in front of an OpenID Connect identity broker:
 * - request state correlation across the login round trip
 * - outbound redirect URL generation
 * - cached session credentials with token refresh and logout
 */
@SpringBootApplication
@EnableConfigurationProperties(IdmProperties.class)
public class IdmGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(IdmGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
