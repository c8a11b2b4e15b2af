package com.kmg.exporter.config;

import com.kmg.exporter.model.ThresholdAlignment;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "exporter")
public class ExporterProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private State state = new State();
    @NotNull
    private Source source = new Source();
    @NotNull
    private Scheduler scheduler = new Scheduler();
    @NotNull
    private Gate gate = new Gate();
    @NotNull
    private Output output = new Output();
    @NotNull
    private Logs logs = new Logs();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    /**
     * Connection settings of the analytical database the jobs extract from.
     */
    public static class Source {
        @NotBlank
        private String url;
        private String username;
        private String password;
        @Min(1)
        private int fetchSize = 5000;
        /** Vendor error codes meaning "too many sessions"; 2391 is ORA-02391. */
        private List<Integer> connectionLimitCodes = new ArrayList<>(List.of(2391));
        @NotNull
        private Duration connectionRetryDelay = Duration.ofSeconds(120);
        @NotBlank
        private String validationQuery = "SELECT 1 FROM DUAL";
        private boolean verifyOnStartup = true;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getFetchSize() {
            return fetchSize;
        }

        public void setFetchSize(int fetchSize) {
            this.fetchSize = fetchSize;
        }

        public List<Integer> getConnectionLimitCodes() {
            return connectionLimitCodes;
        }

        public void setConnectionLimitCodes(List<Integer> connectionLimitCodes) {
            this.connectionLimitCodes = connectionLimitCodes;
        }

        public Duration getConnectionRetryDelay() {
            return connectionRetryDelay;
        }

        public void setConnectionRetryDelay(Duration connectionRetryDelay) {
            this.connectionRetryDelay = connectionRetryDelay;
        }

        public String getValidationQuery() {
            return validationQuery;
        }

        public void setValidationQuery(String validationQuery) {
            this.validationQuery = validationQuery;
        }

        public boolean isVerifyOnStartup() {
            return verifyOnStartup;
        }

        public void setVerifyOnStartup(boolean verifyOnStartup) {
            this.verifyOnStartup = verifyOnStartup;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        @Min(1)
        private int workers = 5;
        @NotBlank
        private String timezone = "America/Sao_Paulo";
        @NotNull
        private Duration reloadInterval = Duration.ofHours(2);
        @NotNull
        private Duration idleCap = Duration.ofSeconds(60);
        @NotNull
        private Duration idleSleep = Duration.ofSeconds(120);
        @NotNull
        private Duration errorSleep = Duration.ofSeconds(30);
        @NotNull
        private Duration gateRetryDelay = Duration.ofMinutes(10);
        @NotNull
        private Duration shutdownTimeout = Duration.ofMinutes(30);
        @NotNull
        private Duration stopTimeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Duration getReloadInterval() {
            return reloadInterval;
        }

        public void setReloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval;
        }

        public Duration getIdleCap() {
            return idleCap;
        }

        public void setIdleCap(Duration idleCap) {
            this.idleCap = idleCap;
        }

        public Duration getIdleSleep() {
            return idleSleep;
        }

        public void setIdleSleep(Duration idleSleep) {
            this.idleSleep = idleSleep;
        }

        public Duration getErrorSleep() {
            return errorSleep;
        }

        public void setErrorSleep(Duration errorSleep) {
            this.errorSleep = errorSleep;
        }

        public Duration getGateRetryDelay() {
            return gateRetryDelay;
        }

        public void setGateRetryDelay(Duration gateRetryDelay) {
            this.gateRetryDelay = gateRetryDelay;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        /**
         * How long {@code SchedulerLoop.stop()} waits for the loop thread to exit.
         */
        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    public static class Gate {
        @NotNull
        private ThresholdAlignment thresholdAlignment = ThresholdAlignment.END_OF_MONTH;

        public ThresholdAlignment getThresholdAlignment() {
            return thresholdAlignment;
        }

        public void setThresholdAlignment(ThresholdAlignment thresholdAlignment) {
            this.thresholdAlignment = thresholdAlignment;
        }
    }

    public static class Output {
        private char csvDelimiter = ';';
        @NotBlank
        private String eventualDir;
        @NotBlank
        private String reportDir;

        public char getCsvDelimiter() {
            return csvDelimiter;
        }

        public void setCsvDelimiter(char csvDelimiter) {
            this.csvDelimiter = csvDelimiter;
        }

        public String getEventualDir() {
            return eventualDir;
        }

        public void setEventualDir(String eventualDir) {
            this.eventualDir = eventualDir;
        }

        public String getReportDir() {
            return reportDir;
        }

        public void setReportDir(String reportDir) {
            this.reportDir = reportDir;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
