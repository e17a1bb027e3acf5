package com.hedgedata.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hedgedata.core.model.DataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Provider selection, credentials, endpoints and cache location.
 *
 * Each value is resolved from a Java system property, then an environment
 * variable, then the optional YAML file {@code ~/.hedgedata/providers.yaml}:
 *
 * <pre>
 * provider: finnhub
 * cacheDir: /var/cache/hedgedata
 * providers:
 *   finnhub:
 *     apiKey: ...
 *   financial_datasets:
 *     apiKey: ...
 *     baseUrl: https://api.financialdatasets.ai
 * </pre>
 *
 * A missing credential is not an error here; it only makes the provider
 * unavailable for default selection.
 */
public class ProviderSettings {

    private static final Logger log = LoggerFactory.getLogger(ProviderSettings.class);

    private static final String DEFAULT_CONFIG_FILE =
        System.getProperty("user.home") + "/.hedgedata/providers.yaml";

    private final String defaultProvider;
    private final Map<DataProvider, String> apiKeys;
    private final Map<DataProvider, String> baseUrls;
    private final Path cacheDir;

    private ProviderSettings(Builder builder) {
        this.defaultProvider = builder.defaultProvider;
        this.apiKeys = new EnumMap<>(DataProvider.class);
        this.apiKeys.putAll(builder.apiKeys);
        this.baseUrls = new EnumMap<>(DataProvider.class);
        this.baseUrls.putAll(builder.baseUrls);
        this.cacheDir = builder.cacheDir;
    }

    /**
     * Resolve settings from system properties, the environment and the YAML file.
     */
    public static ProviderSettings load() {
        return load(System::getProperty, System::getenv);
    }

    static ProviderSettings load(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        String configPath = firstNonBlank(properties.apply("hedgedata.config"),
            environment.apply("HEDGEDATA_CONFIG"), DEFAULT_CONFIG_FILE);
        ConfigFileModel file = readConfigFile(Paths.get(configPath));

        Builder builder = builder();
        builder.defaultProvider(firstNonBlank(properties.apply("hedgedata.provider"),
            environment.apply("API_PROVIDER"), file.provider));

        for (DataProvider provider : DataProvider.values()) {
            String prefix = "hedgedata." + provider.getConfigKey();
            String envPrefix = provider.getConfigKey().toUpperCase();
            ProviderYaml yaml = file.providers != null ? file.providers.get(provider.getConfigKey()) : null;

            String apiKey = firstNonBlank(properties.apply(prefix + ".apiKey"),
                environment.apply(provider.getCredentialKey()), yaml != null ? yaml.apiKey : null);
            if (apiKey != null) {
                builder.apiKey(provider, apiKey);
            }
            String baseUrl = firstNonBlank(properties.apply(prefix + ".baseUrl"),
                environment.apply(envPrefix + "_BASE_URL"), yaml != null ? yaml.baseUrl : null);
            if (baseUrl != null) {
                builder.baseUrl(provider, baseUrl);
            }
        }

        String cacheDir = firstNonBlank(properties.apply("hedgedata.cache.dir"),
            environment.apply("HEDGEDATA_CACHE_DIR"), file.cacheDir);
        if (cacheDir != null) {
            builder.cacheDir(Paths.get(cacheDir));
        }
        return builder.build();
    }

    private static ConfigFileModel readConfigFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return new ConfigFileModel();
        }
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            ConfigFileModel model = yamlMapper.readValue(path.toFile(), ConfigFileModel.class);
            log.info("Loaded provider configuration from {}", path);
            return model != null ? model : new ConfigFileModel();
        } catch (IOException e) {
            log.error("Failed to load provider configuration from {}: {}", path, e.getMessage());
            return new ConfigFileModel();
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Explicitly configured default provider id, not yet validated.
     */
    public Optional<String> getDefaultProviderId() {
        return Optional.ofNullable(defaultProvider);
    }

    public Optional<String> getApiKey(DataProvider provider) {
        return Optional.ofNullable(apiKeys.get(provider));
    }

    public boolean hasCredential(DataProvider provider) {
        return apiKeys.containsKey(provider);
    }

    /**
     * Base URL override; clients fall back to the provider's public endpoint.
     */
    public Optional<String> getBaseUrl(DataProvider provider) {
        return Optional.ofNullable(baseUrls.get(provider));
    }

    /**
     * Directory for the on-disk cache; empty keeps the cache in memory only.
     */
    public Optional<Path> getCacheDir() {
        return Optional.ofNullable(cacheDir);
    }

    public static class Builder {
        private String defaultProvider;
        private final Map<DataProvider, String> apiKeys = new EnumMap<>(DataProvider.class);
        private final Map<DataProvider, String> baseUrls = new EnumMap<>(DataProvider.class);
        private Path cacheDir;

        private Builder() {
        }

        public Builder defaultProvider(String providerId) {
            this.defaultProvider = providerId;
            return this;
        }

        public Builder apiKey(DataProvider provider, String apiKey) {
            if (apiKey == null || apiKey.isBlank()) {
                apiKeys.remove(provider);
            } else {
                apiKeys.put(provider, apiKey);
            }
            return this;
        }

        public Builder baseUrl(DataProvider provider, String baseUrl) {
            baseUrls.put(provider, baseUrl);
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public ProviderSettings build() {
            return new ProviderSettings(this);
        }
    }

    // ========== YAML Model Classes ==========

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ConfigFileModel {
        @JsonProperty("provider")
        String provider;

        @JsonProperty("cacheDir")
        String cacheDir;

        @JsonProperty("providers")
        Map<String, ProviderYaml> providers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ProviderYaml {
        @JsonProperty("apiKey")
        String apiKey;

        @JsonProperty("baseUrl")
        String baseUrl;
    }
}
