package com.delta.propertytracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-property-tracker/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Defaults defaults = new Defaults();
    private Resolver resolver = new Resolver();
    private TaxList taxList = new TaxList();
    private Notices notices = new Notices();
    private Seed seed = new Seed();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public TaxList getTaxList() {
        return taxList;
    }

    public void setTaxList(TaxList taxList) {
        this.taxList = taxList;
    }

    public Notices getNotices() {
        return notices;
    }

    public void setNotices(Notices notices) {
        this.notices = notices;
    }

    public Seed getSeed() {
        return seed;
    }

    public void setSeed(Seed seed) {
        this.seed = seed;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Defaults {
        private String city = "Winnemucca";
        private String state = "NV";
        private String zip = "89445";

        public String getCity() {
            return city;
        }

        public void setCity(String city) {
            this.city = city;
        }

        public String getState() {
            return state;
        }

        public void setState(String state) {
            this.state = state;
        }

        public String getZip() {
            return zip;
        }

        public void setZip(String zip) {
            this.zip = zip;
        }
    }

    public static class Resolver {
        private int defaultBatchSize = 25;
        private int maxBatchSize = 200;
        private int concurrency = 1;
        private int lookupTimeoutSeconds = 15;
        private String lookupUrlTemplate = "https://humboldtcountynv.gov/assessor/parcel-search?parcel={apn}";

        public int getDefaultBatchSize() {
            return Math.max(1, defaultBatchSize);
        }

        public void setDefaultBatchSize(int defaultBatchSize) {
            this.defaultBatchSize = Math.max(1, defaultBatchSize);
        }

        public int getMaxBatchSize() {
            return Math.max(1, maxBatchSize);
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = Math.max(1, maxBatchSize);
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getLookupTimeoutSeconds() {
            return Math.max(1, lookupTimeoutSeconds);
        }

        public void setLookupTimeoutSeconds(int lookupTimeoutSeconds) {
            this.lookupTimeoutSeconds = Math.max(1, lookupTimeoutSeconds);
        }

        public String getLookupUrlTemplate() {
            return lookupUrlTemplate;
        }

        public void setLookupUrlTemplate(String lookupUrlTemplate) {
            this.lookupUrlTemplate = lookupUrlTemplate;
        }
    }

    public static class TaxList {
        private String listPageUrl = "https://www.humboldtcountynv.gov/213/Parcel-List";
        private String fallbackDocumentUrl =
            "https://www.humboldtcountynv.gov/DocumentCenter/View/8026/2025-Delinquent-Sale-Parcel-List";
        private String docType = "Delinquent Tax Sale Parcel List";

        public String getListPageUrl() {
            return listPageUrl;
        }

        public void setListPageUrl(String listPageUrl) {
            this.listPageUrl = listPageUrl;
        }

        public String getFallbackDocumentUrl() {
            return fallbackDocumentUrl;
        }

        public void setFallbackDocumentUrl(String fallbackDocumentUrl) {
            this.fallbackDocumentUrl = fallbackDocumentUrl;
        }

        public String getDocType() {
            return docType;
        }

        public void setDocType(String docType) {
            this.docType = docType;
        }
    }

    public static class Notices {
        private String docType = "Notice of Trustee Sale";

        public String getDocType() {
            return docType;
        }

        public void setDocType(String docType) {
            this.docType = docType;
        }
    }

    public static class Seed {
        private boolean enabled = true;
        private String location = "classpath:seed/seed_tax_examples.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean refreshTaxList = true;
        private int resolveLimit = 25;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isRefreshTaxList() {
            return refreshTaxList;
        }

        public void setRefreshTaxList(boolean refreshTaxList) {
            this.refreshTaxList = refreshTaxList;
        }

        public int getResolveLimit() {
            return Math.max(0, resolveLimit);
        }

        public void setResolveLimit(int resolveLimit) {
            this.resolveLimit = Math.max(0, resolveLimit);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
