package com.kmesh.router.config;

import com.kmesh.router.classify.ClassifierMode;
import com.kmesh.router.registry.DomainRegistration;
import com.kmesh.router.registry.RegistrySourceType;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "router")
public class RouterProperties {
    private double primaryThreshold = 0.6;
    private double secondaryThreshold = 0.3;
    private int maxDomains = 4;
    private int maxQueryLength = 4000;
    private int rewriteTokenBudget = 256;
    private long agentTimeoutMs = 5000;
    private int poolSize = 16;
    private int maxPoolSize = 256;
    private Classifier classifier = new Classifier();
    private Registry registry = new Registry();
    private Events events = new Events();
    private Resilience resilience = new Resilience();

    public double getPrimaryThreshold() {
        return primaryThreshold;
    }

    public void setPrimaryThreshold(double primaryThreshold) {
        this.primaryThreshold = primaryThreshold;
    }

    public double getSecondaryThreshold() {
        return secondaryThreshold;
    }

    public void setSecondaryThreshold(double secondaryThreshold) {
        this.secondaryThreshold = secondaryThreshold;
    }

    public int getMaxDomains() {
        return maxDomains;
    }

    public void setMaxDomains(int maxDomains) {
        this.maxDomains = maxDomains;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getRewriteTokenBudget() {
        return rewriteTokenBudget;
    }

    public void setRewriteTokenBudget(int rewriteTokenBudget) {
        this.rewriteTokenBudget = rewriteTokenBudget;
    }

    public long getAgentTimeoutMs() {
        return agentTimeoutMs;
    }

    public void setAgentTimeoutMs(long agentTimeoutMs) {
        this.agentTimeoutMs = agentTimeoutMs;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public void setResilience(Resilience resilience) {
        this.resilience = resilience;
    }

    public static class Classifier {
        private ClassifierMode mode = ClassifierMode.KEYWORD;
        private String baseUrl = "http://localhost:8095";
        private long budgetMs = 2000;

        public ClassifierMode getMode() {
            return mode;
        }

        public void setMode(ClassifierMode mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getBudgetMs() {
            return budgetMs;
        }

        public void setBudgetMs(long budgetMs) {
            this.budgetMs = budgetMs;
        }
    }

    public static class Registry {
        private RegistrySourceType source = RegistrySourceType.STATIC;
        private String baseUrl = "http://localhost:8070";
        private int timeoutMs = 1000;
        private long ttlMs = 30000;
        private long refreshIntervalMs = 15000;
        private List<DomainRegistration> agents = new ArrayList<>();

        public RegistrySourceType getSource() {
            return source;
        }

        public void setSource(RegistrySourceType source) {
            this.source = source;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public List<DomainRegistration> getAgents() {
            return agents;
        }

        public void setAgents(List<DomainRegistration> agents) {
            this.agents = agents;
        }
    }

    public static class Events {
        private boolean enabled = false;
        private String topic = "kmesh.routing.feedback";
        private long sendTimeoutMs = 5000;
        private int poolSize = 2;
        private int queueCapacity = 256;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public long getSendTimeoutMs() {
            return sendTimeoutMs;
        }

        public void setSendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Resilience {
        private int failureThreshold = 3;
        private long openMs = 30000;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getOpenMs() {
            return openMs;
        }

        public void setOpenMs(long openMs) {
            this.openMs = openMs;
        }
    }
}
