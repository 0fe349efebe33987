package com.markettracker.ingestion.client;

import com.markettracker.domain.ApiKey;
import com.markettracker.domain.ApiKeyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads API keys from api_keys on every call; no caching, so a rotated key is used by the next request.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyProvider {

    private final ApiKeyRepository apiKeyRepository;

    public Optional<String> apiKeyFor(String service) {
        return apiKeyRepository.findByService(service)
                .map(ApiKey::getApiKey)
                .filter(k -> !k.isBlank());
    }
}
