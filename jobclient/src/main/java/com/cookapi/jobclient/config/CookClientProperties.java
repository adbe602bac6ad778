package com.cookapi.jobclient.config;

import com.cookapi.jobclient.model.JobSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for a {@link com.cookapi.jobclient.client.JobClient}.
 *
 * Bound from {@code cook.client.*} when running inside Spring Boot; can also be
 * populated by hand:
 * <pre>
 *   CookClientProperties props = new CookClientProperties();
 *   props.setUrl("http://cook.example.com:12321");
 *   props.setHttpUser("alice");
 *   props.setHttpPassword("secret");
 *   JobClient client = new JobClient(props);
 * </pre>
 */
@ConfigurationProperties(prefix = "cook.client")
public class CookClientProperties {

    /** Scheduler REST base URL, e.g. {@code http://localhost:12321}. */
    private String url;

    /** {@code http_basic} or {@code kerberos}. */
    private String auth = "http_basic";

    private String httpUser;
    private String httpPassword;

    /** Maximum number of job ids sent in one batched GET or DELETE. */
    private int batchRequestSize = 32;

    private Duration requestTimeout = Duration.ofSeconds(60);
    private Duration connectTimeout = Duration.ofSeconds(10);

    private Wait wait = new Wait();
    private Kerberos kerberos = new Kerberos();
    private Defaults defaults = new Defaults();

    public String   getUrl()                      { return url; }
    public void     setUrl(String url)            { this.url = url; }
    public String   getAuth()                     { return auth; }
    public void     setAuth(String auth)          { this.auth = auth; }
    public String   getHttpUser()                 { return httpUser; }
    public void     setHttpUser(String v)         { this.httpUser = v; }
    public String   getHttpPassword()             { return httpPassword; }
    public void     setHttpPassword(String v)     { this.httpPassword = v; }
    public int      getBatchRequestSize()         { return batchRequestSize; }
    public void     setBatchRequestSize(int v)    { this.batchRequestSize = v; }
    public Duration getRequestTimeout()           { return requestTimeout; }
    public void     setRequestTimeout(Duration v) { this.requestTimeout = v; }
    public Duration getConnectTimeout()           { return connectTimeout; }
    public void     setConnectTimeout(Duration v) { this.connectTimeout = v; }
    public Wait     getWait()                     { return wait; }
    public void     setWait(Wait wait)            { this.wait = wait; }
    public Kerberos getKerberos()                 { return kerberos; }
    public void     setKerberos(Kerberos v)       { this.kerberos = v; }
    public Defaults getDefaults()                 { return defaults; }
    public void     setDefaults(Defaults v)       { this.defaults = v; }

    public static class Wait {

        /** Delay between two status polls. */
        private Duration pollInterval = Duration.ofSeconds(10);

        /** Upper bound on a single wait; zero or null waits forever. */
        private Duration timeout = Duration.ofHours(1);

        public Duration getPollInterval()           { return pollInterval; }
        public void     setPollInterval(Duration v) { this.pollInterval = v; }
        public Duration getTimeout()                { return timeout; }
        public void     setTimeout(Duration v)      { this.timeout = v; }
    }

    public static class Kerberos {

        /** Service part of the host-based principal, {@code HTTP@<scheduler host>}. */
        private String serviceName = "HTTP";

        public String getServiceName()         { return serviceName; }
        public void   setServiceName(String v) { this.serviceName = v; }
    }

    /**
     * Job settings applied to every submitted descriptor that leaves them unset.
     */
    public static class Defaults {

        private Integer maxRetries = 1;
        private Long    maxRuntime;
        private Integer priority;
        private Double  cpus;
        private Double  mem;

        public Integer getMaxRetries()          { return maxRetries; }
        public void    setMaxRetries(Integer v) { this.maxRetries = v; }
        public Long    getMaxRuntime()          { return maxRuntime; }
        public void    setMaxRuntime(Long v)    { this.maxRuntime = v; }
        public Integer getPriority()            { return priority; }
        public void    setPriority(Integer v)   { this.priority = v; }
        public Double  getCpus()                { return cpus; }
        public void    setCpus(Double v)        { this.cpus = v; }
        public Double  getMem()                 { return mem; }
        public void    setMem(Double v)         { this.mem = v; }

        /** These defaults as a partial descriptor for {@link JobSpec#withDefaults}. */
        public JobSpec toJobSpec() {
            return JobSpec.builder()
                    .maxRetries(maxRetries)
                    .maxRuntime(maxRuntime)
                    .priority(priority)
                    .cpus(cpus)
                    .mem(mem)
                    .build();
        }
    }
}
