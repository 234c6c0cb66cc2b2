package com.github.spud.chatagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories
@SpringBootApplication
public class ChatAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatAgentApplication.class, args);
  }

}
