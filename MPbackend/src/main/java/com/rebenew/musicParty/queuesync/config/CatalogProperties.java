package com.rebenew.musicParty.queuesync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Proveedor de metadatos de canciones, bajo {@code musicparty.catalog.*}.
 * {@code provider=offline} no consulta nada y usa los datos que envía el cliente.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "musicparty.catalog")
public class CatalogProperties {
    private String provider = "offline";
    private String baseUrl = "https://api.deezer.com";
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(5);
}
