package com.gentoro.scheduler;

import com.gentoro.scheduler.logging.LoggingService;
import org.slf4j.Logger;

public class SchedulerApp {

  private static final Logger log = LoggingService.getLogger(SchedulerApp.class);

  public static void main(String[] args) {
    try {
      SchedulerService app = new SchedulerService(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
