package com.paxkun.pulldb.config;

import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.InMemoryEntityStore;
import com.paxkun.pulldb.store.VaultEntityStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Picks the entity store backend from {@code pulldb.store.type}.
 *
 * Author: Pax
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "pulldb.store.type", havingValue = "memory", matchIfMissing = true)
    public EntityStore inMemoryEntityStore() {
        log.info("Using the in-memory entity store. Records are lost on restart.");
        return new InMemoryEntityStore();
    }

    @Bean
    @ConditionalOnProperty(name = "pulldb.store.type", havingValue = "vault")
    public EntityStore vaultEntityStore(@Value("${vault.url:http://noona-vault:3005}") String vaultUrl,
                                        @Value("${vault.apiToken:${VAULT_API_TOKEN:}}") String vaultApiToken) {
        log.info("Using the Vault entity store at {}", vaultUrl);
        return new VaultEntityStore(WebClient.builder().build(), vaultUrl, vaultApiToken);
    }
}
