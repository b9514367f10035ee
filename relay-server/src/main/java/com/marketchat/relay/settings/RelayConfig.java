package com.marketchat.relay.settings;

import com.marketchat.store.processors.DeliveryStateMachine;
import com.marketchat.store.service.InMemoryMessageStore;
import com.marketchat.store.service.MessageStore;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Store and state machine beans, plus static serving of uploaded files.
 */
@Configuration
public class RelayConfig implements WebMvcConfigurer {

  @Value("${relay.upload.dir:uploads}")
  private String uploadDir;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public MessageStore messageStore(Clock clock) {
    return new InMemoryMessageStore(clock);
  }

  @Bean
  public DeliveryStateMachine deliveryStateMachine(Clock clock) {
    return new DeliveryStateMachine(clock);
  }

  @Override
  public void addResourceHandlers(ResourceHandlerRegistry registry) {
    Path root = Paths.get(uploadDir).toAbsolutePath().normalize();
    String location = root.toUri().toString();
    registry.addResourceHandler("/files/**")
        .addResourceLocations(location.endsWith("/") ? location : location + "/");
  }
}
