package org.rostilos.atlassian.restcore.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class OkHttpConfig {

    @Bean
    public OkHttpClient.Builder okHttpClientBuilder(
            @Value("${atlassian.http.timeout.connect:30}") long connectTimeout,
            @Value("${atlassian.http.timeout.read:60}") long readTimeout,
            @Value("${atlassian.http.timeout.write:60}") long writeTimeout
    ) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout, TimeUnit.SECONDS)
                .readTimeout(readTimeout, TimeUnit.SECONDS)
                .writeTimeout(writeTimeout, TimeUnit.SECONDS);
    }
}
