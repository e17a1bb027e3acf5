package com.hedgedata.core.model;

/**
 * Supported external financial data providers.
 * Declaration order is the priority used when picking a default provider.
 */
public enum DataProvider {
    FINNHUB("Finnhub", "finnhub", "FINNHUB_API_KEY", true),
    FINANCIAL_DATASETS("Financial Datasets", "financial_datasets", "FINANCIAL_DATASETS_API_KEY", false);

    private final String displayName;
    private final String configKey;
    private final String credentialKey;
    private final boolean credentialRequired;

    DataProvider(String displayName, String configKey, String credentialKey, boolean credentialRequired) {
        this.displayName = displayName;
        this.configKey = configKey;
        this.credentialKey = credentialKey;
        this.credentialRequired = credentialRequired;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getConfigKey() {
        return configKey;
    }

    /**
     * Name of the environment variable holding this provider's API key.
     */
    public String getCredentialKey() {
        return credentialKey;
    }

    /**
     * False for providers that serve (some) data without an API key.
     */
    public boolean isCredentialRequired() {
        return credentialRequired;
    }

    /**
     * Parse provider from config key (case-insensitive)
     */
    public static DataProvider fromConfigKey(String key) {
        if (key == null) return null;
        String lower = key.trim().toLowerCase();
        for (DataProvider p : values()) {
            if (p.configKey.equals(lower)) {
                return p;
            }
        }
        return null;
    }
}
