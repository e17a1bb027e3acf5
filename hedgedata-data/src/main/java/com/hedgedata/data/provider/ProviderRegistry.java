package com.hedgedata.data.provider;

import com.hedgedata.core.model.DataProvider;
import com.hedgedata.data.ProviderSettings;
import com.hedgedata.data.cache.InMemoryRecordCache;
import com.hedgedata.data.cache.JsonFileRecordCache;
import com.hedgedata.data.cache.RecordCache;
import com.hedgedata.data.exception.ProviderConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns one client per provider for the lifetime of the registry and decides
 * which provider is the default.
 *
 * Clients are created on first request and reused afterwards. The default is,
 * in order: an explicit override ({@link #setDefaultProvider} or the configured
 * provider id), the first provider in priority order whose credential is
 * configured, then the first provider that works without a credential.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    /**
     * Creates the client for a provider; fails when the provider cannot be configured.
     */
    @FunctionalInterface
    public interface ClientFactory {
        DataProviderClient create(DataProvider provider, ProviderSettings settings, RecordCache cache)
            throws ProviderConfigurationException;
    }

    private final ProviderSettings settings;
    private final RecordCache cache;
    private final ClientFactory factory;
    private final Map<DataProvider, DataProviderClient> clients = new EnumMap<>(DataProvider.class);
    private DataProvider defaultOverride;

    public ProviderRegistry(ProviderSettings settings, RecordCache cache) {
        this(settings, cache, ProviderRegistry::createClient);
    }

    public ProviderRegistry(ProviderSettings settings, RecordCache cache, ClientFactory factory) {
        this.settings = settings;
        this.cache = cache;
        this.factory = factory;
    }

    /**
     * Registry with the cache the settings ask for: on disk when a cache
     * directory is configured, otherwise in memory.
     */
    public static ProviderRegistry create(ProviderSettings settings) {
        RecordCache cache = settings.getCacheDir()
            .<RecordCache>map(JsonFileRecordCache::new)
            .orElseGet(InMemoryRecordCache::new);
        return new ProviderRegistry(settings, cache);
    }

    /**
     * The client factory used by default: the provider's own client class over {@code cache}.
     */
    public static DataProviderClient createClient(DataProvider provider, ProviderSettings settings,
                                                  RecordCache cache) throws ProviderConfigurationException {
        return switch (provider) {
            case FINNHUB -> new FinnhubClient(settings, cache);
            case FINANCIAL_DATASETS -> new FinancialDatasetsClient(settings, cache);
        };
    }

    public RecordCache getCache() {
        return cache;
    }

    /**
     * Client of the default provider.
     */
    public DataProviderClient getClient() throws ProviderConfigurationException {
        return getClient(getDefaultProvider());
    }

    /**
     * Client for a provider id such as "finnhub".
     *
     * @throws ProviderConfigurationException if the id is unknown or the client cannot be configured
     */
    public DataProviderClient getClient(String providerId) throws ProviderConfigurationException {
        return getClient(parse(providerId));
    }

    public synchronized DataProviderClient getClient(DataProvider provider) throws ProviderConfigurationException {
        DataProviderClient client = clients.get(provider);
        if (client == null) {
            client = factory.create(provider, settings, cache);
            clients.put(provider, client);
            log.info("Initialized client for {}", provider.getDisplayName());
        }
        return client;
    }

    public synchronized DataProvider getDefaultProvider() throws ProviderConfigurationException {
        if (defaultOverride != null) {
            return defaultOverride;
        }
        Optional<String> configured = settings.getDefaultProviderId();
        if (configured.isPresent()) {
            DataProvider provider = DataProvider.fromConfigKey(configured.get());
            if (provider != null) {
                return provider;
            }
            log.warn("Ignoring unknown provider '{}' in configuration", configured.get());
        }
        for (DataProvider provider : DataProvider.values()) {
            if (settings.hasCredential(provider)) {
                return provider;
            }
        }
        for (DataProvider provider : DataProvider.values()) {
            if (!provider.isCredentialRequired()) {
                return provider;
            }
        }
        throw new ProviderConfigurationException("No data provider is configured");
    }

    /**
     * Override the default provider for the rest of this registry's lifetime.
     */
    public synchronized void setDefaultProvider(DataProvider provider) {
        this.defaultOverride = provider;
        log.info("Default data provider set to {}", provider != null ? provider.getDisplayName() : "<auto>");
    }

    public void setDefaultProvider(String providerId) throws ProviderConfigurationException {
        setDefaultProvider(parse(providerId));
    }

    /**
     * Provider to retry with after {@code primary} failed: the first other
     * provider in priority order.
     */
    public Optional<DataProvider> getFallbackProvider(DataProvider primary) {
        for (DataProvider provider : DataProvider.values()) {
            if (provider != primary) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    private static DataProvider parse(String providerId) throws ProviderConfigurationException {
        DataProvider provider = DataProvider.fromConfigKey(providerId);
        if (provider == null) {
            throw new ProviderConfigurationException("Unsupported data provider: " + providerId);
        }
        return provider;
    }
}
