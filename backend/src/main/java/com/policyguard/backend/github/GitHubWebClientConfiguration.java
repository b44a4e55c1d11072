package com.policyguard.backend.github;

import com.policyguard.backend.config.GitHubAppProperties;
import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
class GitHubWebClientConfiguration {

  @Bean
  WebClient gitHubWebClient(GitHubAppProperties properties) {
    Duration connectTimeout = properties.getConnectTimeout();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .responseTimeout(properties.getReadTimeout());
    return WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
        .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
        .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }
}
