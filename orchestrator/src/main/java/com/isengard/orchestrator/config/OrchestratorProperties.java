package com.isengard.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables bound from the {@code isengard.*} block of application.yml.
 *
 * Every value can be overridden with an environment variable, e.g.
 * ISENGARD_WORKER_POOL_SIZE=4 or ISENGARD_QUEUE_VISIBILITY_TIMEOUT=10m.
 */
@ConfigurationProperties(prefix = "isengard")
public class OrchestratorProperties {

    private final Worker   worker   = new Worker();
    private final Queue    queue    = new Queue();
    private final Events   events   = new Events();
    private final Progress progress = new Progress();
    private final Storage  storage  = new Storage();
    private final Engines  engines  = new Engines();

    public Worker   getWorker()   { return worker; }
    public Queue    getQueue()    { return queue; }
    public Events   getEvents()   { return events; }
    public Progress getProgress() { return progress; }
    public Storage  getStorage()  { return storage; }
    public Engines  getEngines()  { return engines; }

    public static class Worker {
        // false keeps the API up without consuming the queue
        private boolean  enabled          = true;
        // One engine subprocess per slot.
        private int      poolSize         = 2;
        private Duration pollInterval     = Duration.ofSeconds(2);
        private Duration graceKillTimeout = Duration.ofSeconds(15);
        private Duration persistInterval  = Duration.ofSeconds(2);

        public boolean  isEnabled()           { return enabled; }
        public int      getPoolSize()         { return poolSize; }
        public Duration getPollInterval()     { return pollInterval; }
        public Duration getGraceKillTimeout() { return graceKillTimeout; }
        public Duration getPersistInterval()  { return persistInterval; }

        public void setEnabled(boolean v)           { this.enabled = v; }
        public void setPoolSize(int v)              { this.poolSize = v; }
        public void setPollInterval(Duration v)     { this.pollInterval = v; }
        public void setGraceKillTimeout(Duration v) { this.graceKillTimeout = v; }
        public void setPersistInterval(Duration v)  { this.persistInterval = v; }
    }

    public static class Queue {
        private Duration visibilityTimeout = Duration.ofMinutes(5);
        private int      maxDeliveries     = 3;

        public Duration getVisibilityTimeout() { return visibilityTimeout; }
        public int      getMaxDeliveries()     { return maxDeliveries; }

        public void setVisibilityTimeout(Duration v) { this.visibilityTimeout = v; }
        public void setMaxDeliveries(int v)          { this.maxDeliveries = v; }
    }

    public static class Events {
        private int      backlogSize       = 500;
        private int      subscriberBuffer  = 256;
        private Duration keepaliveInterval = Duration.ofSeconds(15);
        private Duration retention         = Duration.ofMinutes(10);

        public int      getBacklogSize()       { return backlogSize; }
        public int      getSubscriberBuffer()  { return subscriberBuffer; }
        public Duration getKeepaliveInterval() { return keepaliveInterval; }
        public Duration getRetention()         { return retention; }

        public void setBacklogSize(int v)            { this.backlogSize = v; }
        public void setSubscriberBuffer(int v)       { this.subscriberBuffer = v; }
        public void setKeepaliveInterval(Duration v) { this.keepaliveInterval = v; }
        public void setRetention(Duration v)         { this.retention = v; }
    }

    public static class Progress {
        // How long a structured reading stays authoritative over log-derived ones.
        private Duration stalenessWindow = Duration.ofSeconds(30);
        // EMA factor for iteration speed; higher reacts faster.
        private double   smoothing       = 0.3;

        public Duration getStalenessWindow() { return stalenessWindow; }
        public double   getSmoothing()       { return smoothing; }

        public void setStalenessWindow(Duration v) { this.stalenessWindow = v; }
        public void setSmoothing(double v)         { this.smoothing = v; }
    }

    public static class Storage {
        private Path root = Path.of("./data");

        public Path getRoot()          { return root; }
        public void setRoot(Path root) { this.root = root; }
    }

    public static class Engines {
        private String trainingCommand   = "python run.py {config}";
        private String generationCommand = "python comfy_client.py {config}";

        public String getTrainingCommand()   { return trainingCommand; }
        public String getGenerationCommand() { return generationCommand; }

        public void setTrainingCommand(String v)   { this.trainingCommand = v; }
        public void setGenerationCommand(String v) { this.generationCommand = v; }
    }
}
