package io.github.drompincen.sreflow.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.sreflow.protocol.ws.FrameCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    ObjectMapper objectMapper() {
        return FrameCodec.defaultMapper();
    }

    @Bean
    FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }
}
