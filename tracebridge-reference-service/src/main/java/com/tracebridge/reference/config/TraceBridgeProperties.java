package com.tracebridge.reference.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the reference service.
 *
 * <pre>{@code
 * tracebridge:
 *   rabbitmq:
 *     host: localhost
 *     queue: webqueue
 *   consumer:
 *     enabled: true
 *     backoff: 3s
 *   api-url: http://localhost:8080
 *   zipkin:
 *     url: http://localhost:9411/api/v2/spans   # optional
 *   logging-exporter:
 *     enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "tracebridge")
public class TraceBridgeProperties {

    private final RabbitMq rabbitmq = new RabbitMq();
    private final Consumer consumer = new Consumer();
    private final Zipkin zipkin = new Zipkin();
    private final LoggingExporter loggingExporter = new LoggingExporter();

    /** Base URL of the service answering {@code /api/time/dbtime}. */
    private String apiUrl = "http://localhost:8080";

    public RabbitMq getRabbitmq() {
        return rabbitmq;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Zipkin getZipkin() {
        return zipkin;
    }

    public LoggingExporter getLoggingExporter() {
        return loggingExporter;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public static class RabbitMq {
        private String host = "localhost";
        private String queue = "webqueue";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }
    }

    public static class Consumer {
        private boolean enabled = true;
        private Duration backoff = Duration.ofSeconds(3);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }

    public static class Zipkin {
        /** Span endpoint, e.g. {@code http://zipkin:9411/api/v2/spans}. Zipkin export is off when unset. */
        private String url;

        private String serviceName = "tracebridge-reference";

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getServiceName() {
            return serviceName;
        }

        public void setServiceName(String serviceName) {
            this.serviceName = serviceName;
        }
    }

    public static class LoggingExporter {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
