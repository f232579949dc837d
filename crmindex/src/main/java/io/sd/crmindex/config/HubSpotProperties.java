package io.sd.crmindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * @param extraProperties   propriedades pedidas além das de texto de cada tipo
 * @param discoverProperties pedir também todas as propriedades que a API declara para o tipo
 */
@ConfigurationProperties("hubspot")
public record HubSpotProperties(
        String apiKey,
        @DefaultValue("https://api.hubapi.com") String baseUrl,
        @DefaultValue("100") int pageSize,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("60s") Duration readTimeout,
        @DefaultValue("90s") Duration callTimeout,
        List<String> extraProperties,
        @DefaultValue("true") boolean discoverProperties
) { }
