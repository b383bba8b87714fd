package com.gentoro.scheduler;

import com.gentoro.scheduler.endpoints.SchedulerTasksServlet;
import com.gentoro.scheduler.endpoints.TaskInvocationServlet;
import com.gentoro.scheduler.exception.ConfigException;
import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.http.EmbeddedJettyServer;
import com.gentoro.scheduler.http.HttpTaskInvoker;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.scheduler.DefaultScheduler;
import com.gentoro.scheduler.scheduler.SchedulerRunner;
import com.gentoro.scheduler.scheduler.SchedulerRunnerSettings;
import com.gentoro.scheduler.scheduler.TaskInvoker;
import com.gentoro.scheduler.scheduler.TaskSchedulingService;
import com.gentoro.scheduler.storage.DataSourceStorage;
import com.gentoro.scheduler.storage.DatabaseConfiguration;
import com.gentoro.scheduler.storage.InMemoryTaskStore;
import com.gentoro.scheduler.storage.JdbcTaskStore;
import com.gentoro.scheduler.storage.TaskStore;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskServices;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Wires the task store, the scheduler, the scheduler runner and the HTTP endpoints together, and
 * owns their lifecycle.
 */
public class SchedulerService {
  private static final Logger log = LoggingService.getLogger(SchedulerService.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private DataSourceStorage storage;
  private TaskStore taskStore;
  private DefaultScheduler scheduler;
  private TaskSchedulingService schedulingService;
  private SchedulerRunner runner;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public SchedulerService(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    this.taskStore = createTaskStore(configuration());

    TaskRegistry registry = TaskRegistry.builtIn();
    TaskServices services = TaskServices.of(taskStore);
    String password = resolved(configuration().getString("scheduler.invocation.password"));
    TaskInvoker invoker =
        password != null && resolved(configuration().getString("scheduler.invocation.url")) != null
            ? HttpTaskInvoker.fromConfiguration(configuration())
            : null;
    this.scheduler = new DefaultScheduler(registry, services, invoker);
    this.schedulingService =
        new TaskSchedulingService(taskStore, registry, scheduler, services.wallClock());

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      if (password != null) {
        httpServer.addServlet(
            new TaskInvocationServlet(scheduler.taskRunner(), password), "/api/scheduler/invoke");
      } else {
        log.warn("scheduler.invocation.password is not set, the invocation endpoint is disabled");
      }
      httpServer.addServlet(
          new SchedulerTasksServlet(taskStore, registry, schedulingService),
          "/api/scheduler/tasks");
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }

    this.runner = SchedulerRunner.getInstance();
    runner.applySettings(SchedulerRunnerSettings.fromConfiguration(configuration()));
    runner.attachScheduler(scheduler);
    runner.start();
    log.info("Scheduler service started");
  }

  /** The value, or {@code null} when it is blank or references an undefined variable. */
  private static String resolved(String value) {
    return value == null || value.isBlank() || value.startsWith("${") ? null : value;
  }

  private TaskStore createTaskStore(Configuration configuration) {
    String type = configuration.getString("storage.type", "jdbc");
    switch (type) {
      case "memory":
        log.warn("Using in-memory task storage, scheduled tasks will not survive a restart");
        return new InMemoryTaskStore();
      case "jdbc":
        this.storage =
            new DataSourceStorage(DatabaseConfiguration.fromConfiguration(configuration));
        return new JdbcTaskStore(storage);
      default:
        throw new ConfigException("Invalid storage.type: " + type);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "scheduler-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (runner != null) {
          runner.detachScheduler(scheduler);
          runner.shutdown();
        }
        closeQuietly(httpServer);
        closeQuietly(storage);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("SchedulerService not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TaskSchedulingService schedulingService() {
    return schedulingService;
  }

  public DefaultScheduler scheduler() {
    return scheduler;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
