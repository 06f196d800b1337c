package org.mimir.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the artifact cache, its installer tiers and team analysis.
 * <p>
 * Defaults are small and safe for a developer machine: a local cache under the user's home,
 * no registry, no HTTP sources and only the native tier enabled.
 */
@ConfigurationProperties(prefix = "mimir")
public class MimirProperties {

    private Cache cache = new Cache();
    private Registry registry = new Registry();
    private Http http = new Http();
    private NativeTier nativeTier = new NativeTier();
    private Team team = new Team();
    private List<TeamEntry> teams = new ArrayList<>();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public NativeTier getNativeTier() {
        return nativeTier;
    }

    public void setNativeTier(NativeTier nativeTier) {
        this.nativeTier = nativeTier;
    }

    public Team getTeam() {
        return team;
    }

    public void setTeam(Team team) {
        this.team = team;
    }

    public List<TeamEntry> getTeams() {
        return teams;
    }

    public void setTeams(List<TeamEntry> teams) {
        this.teams = teams;
    }

    public static class Cache {
        /** Root of the content-addressed store. */
        private String rootDir = System.getProperty("user.home") + "/.cache/mimir";

        /**
         * Size limit for eviction, as a data-size expression ("5GB", "512MiB", "4*1024*1024").
         * Unset means the largest limit among the configured teams' strategies.
         */
        private String maxSize;

        /** Age limit for eviction when {@code evictionMode} is AGE. Unset means the longest team strategy retention. */
        private Duration retention;

        /** SIZE (least recently used first) or AGE. */
        private String evictionMode = "SIZE";

        /** Re-hash blobs on every cache hit. */
        private boolean verifyOnHit = true;

        /** Threads running shared fetches. */
        private int fetchThreads = 4;

        /** Delay between maintenance runs. */
        private Duration maintenanceInterval = Duration.ofMinutes(10);

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }

        public String getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(String maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public String getEvictionMode() {
            return evictionMode;
        }

        public void setEvictionMode(String evictionMode) {
            this.evictionMode = evictionMode;
        }

        public boolean isVerifyOnHit() {
            return verifyOnHit;
        }

        public void setVerifyOnHit(boolean verifyOnHit) {
            this.verifyOnHit = verifyOnHit;
        }

        public int getFetchThreads() {
            return fetchThreads;
        }

        public void setFetchThreads(int fetchThreads) {
            this.fetchThreads = fetchThreads;
        }

        public Duration getMaintenanceInterval() {
            return maintenanceInterval;
        }

        public void setMaintenanceInterval(Duration maintenanceInterval) {
            this.maintenanceInterval = maintenanceInterval;
        }
    }

    public static class Registry {
        /** Bucket of the team registry; blank disables the registry tier. */
        private String bucket;
        private String prefix = "mimir";
        private String region = "us-east-1";
        /** Endpoint override for S3-compatible stores (MinIO, LocalStack). */
        private String endpoint;
        private boolean pathStyleAccess = false;
        private Duration apiCallTimeout = Duration.ofSeconds(60);

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public Duration getApiCallTimeout() {
            return apiCallTimeout;
        }

        public void setApiCallTimeout(Duration apiCallTimeout) {
            this.apiCallTimeout = apiCallTimeout;
        }
    }

    public static class Http {
        private Duration timeout = Duration.ofMinutes(5);
        /** Allow downloads that have no configured checksum. */
        private boolean allowUnverified = false;
        /** Download sources keyed by repository ({@code ecosystem/namespace/name}). */
        private Map<String, Source> sources = new LinkedHashMap<>();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isAllowUnverified() {
            return allowUnverified;
        }

        public void setAllowUnverified(boolean allowUnverified) {
            this.allowUnverified = allowUnverified;
        }

        public Map<String, Source> getSources() {
            return sources;
        }

        public void setSources(Map<String, Source> sources) {
            this.sources = sources;
        }
    }

    public static class Source {
        private String url;
        /** sha256 per tag ({@code version[-platform]}). */
        private Map<String, String> checksums = new LinkedHashMap<>();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Map<String, String> getChecksums() {
            return checksums;
        }

        public void setChecksums(Map<String, String> checksums) {
            this.checksums = checksums;
        }
    }

    public static class NativeTier {
        private boolean enabled = true;
        private Duration timeout = Duration.ofMinutes(10);
        private List<String> managers = new ArrayList<>(List.of("npm", "cargo"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public List<String> getManagers() {
            return managers;
        }

        public void setManagers(List<String> managers) {
            this.managers = managers;
        }
    }

    public static class Team {
        private Duration analysisWindow = Duration.ofDays(7);
        /** Width of the buckets in which two pulls count as used together. */
        private Duration pairWindow = Duration.ofHours(1);
        private double bundleThreshold = 0.7;
        private long minPairUsage = 3;
        private int warmHours = 3;
        private Duration warmLeadTime = Duration.ofMinutes(30);
        private Duration eventRetention = Duration.ofDays(30);
        /** Where usage events are persisted; blank keeps them in memory only. */
        private String eventLogDir;
        private String zone = "UTC";

        public Duration getAnalysisWindow() {
            return analysisWindow;
        }

        public void setAnalysisWindow(Duration analysisWindow) {
            this.analysisWindow = analysisWindow;
        }

        public Duration getPairWindow() {
            return pairWindow;
        }

        public void setPairWindow(Duration pairWindow) {
            this.pairWindow = pairWindow;
        }

        public double getBundleThreshold() {
            return bundleThreshold;
        }

        public void setBundleThreshold(double bundleThreshold) {
            this.bundleThreshold = bundleThreshold;
        }

        public long getMinPairUsage() {
            return minPairUsage;
        }

        public void setMinPairUsage(long minPairUsage) {
            this.minPairUsage = minPairUsage;
        }

        public int getWarmHours() {
            return warmHours;
        }

        public void setWarmHours(int warmHours) {
            this.warmHours = warmHours;
        }

        public Duration getWarmLeadTime() {
            return warmLeadTime;
        }

        public void setWarmLeadTime(Duration warmLeadTime) {
            this.warmLeadTime = warmLeadTime;
        }

        public Duration getEventRetention() {
            return eventRetention;
        }

        public void setEventRetention(Duration eventRetention) {
            this.eventRetention = eventRetention;
        }

        public String getEventLogDir() {
            return eventLogDir;
        }

        public void setEventLogDir(String eventLogDir) {
            this.eventLogDir = eventLogDir;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class TeamEntry {
        private String name;
        private List<String> members = new ArrayList<>();
        /** AGGRESSIVE, BALANCED or CONSERVATIVE. */
        private String strategy = "BALANCED";
        /** References the team already ships together. */
        private List<String> bundleDependencies = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getMembers() {
            return members;
        }

        public void setMembers(List<String> members) {
            this.members = members;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public List<String> getBundleDependencies() {
            return bundleDependencies;
        }

        public void setBundleDependencies(List<String> bundleDependencies) {
            this.bundleDependencies = bundleDependencies;
        }
    }
}
