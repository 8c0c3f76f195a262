package com.letterboxed.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/** STOMP over SockJS at {@code /ws}; solve replies go to each client's {@code /user/queue}. */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

  @Value("${letterboxed.allowed-origins:*}")
  private String allowedOrigins;

  @Value("${letterboxed.ws-message-size-limit:8192}")
  private int messageSizeLimit;

  @Override
  public void configureMessageBroker(MessageBrokerRegistry r) {
    r.enableSimpleBroker("/queue");
    r.setApplicationDestinationPrefixes("/app");
    r.setUserDestinationPrefix("/user");
  }

  @Override
  public void registerStompEndpoints(StompEndpointRegistry r) {
    String[] origins = allowedOrigins.split("\\s*,\\s*");
    r.addEndpoint("/ws")
      .setAllowedOriginPatterns(origins)
      .withSockJS();
  }

  @Override
  public void configureWebSocketTransport(WebSocketTransportRegistration r) {
    // boards are a few dozen bytes; anything larger is not a solve request
    r.setMessageSizeLimit(messageSizeLimit);
  }
}
