package io.github.drompincen.fieldsync.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.fieldsync.runtime.config.RemoteEndpoints;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.HttpFieldServerClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class RemoteClientConfig {

    @Bean
    RestClient fieldServerRestClient(
            @Value("${fieldsync.remote.base-url:http://localhost:9000}") String baseUrl,
            @Value("${fieldsync.remote.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${fieldsync.remote.read-timeout-ms:30000}") long readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    FieldServerClient fieldServerClient(RestClient fieldServerRestClient,
                                        RemoteEndpoints remoteEndpoints,
                                        ObjectMapper objectMapper,
                                        @Value("${fieldsync.remote.username:}") String username,
                                        @Value("${fieldsync.remote.authorization:}") String authorization) {
        Map<String, String> identity = new LinkedHashMap<>();
        identity.put("X-USERNAME", username);
        identity.put("Authorization", authorization);
        return new HttpFieldServerClient(fieldServerRestClient, remoteEndpoints, objectMapper, identity);
    }
}
