package com.example.diversifier.provisioning;

import com.example.diversifier.kv.InMemoryKvClient;
import com.example.diversifier.kv.KvClient;
import com.example.diversifier.kv.RedisKvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class ProvisioningConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProvisioningConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KvClient kvClient(@Value("${app.session.backend:redis}") String backend,
                             ObjectProvider<StringRedisTemplate> redisTemplate, Clock clock) {
        switch (backend.trim().toLowerCase()) {
            case "memory":
                logger.info("Sessions kept in process memory");
                return new InMemoryKvClient(clock);
            case "redis":
                return new RedisKvClient(redisTemplate.getObject());
            default:
                throw new IllegalArgumentException("Unknown app.session.backend: " + backend);
        }
    }
}
