package io.tradedesk.opsengine.aggregation;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import org.hibernate.jpa.SpecHints;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class FanOutConfig {

  public static final String EXECUTOR_BEAN = "sourceFanOutExecutor";

  @Bean(name = EXECUTOR_BEAN)
  Executor sourceFanOutExecutor(SourceProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("source-");
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }

  /**
   * Default JDBC statement timeout for every query. A source abandoned by its fan-out deadline
   * would otherwise keep its pool thread and connection until the database answers.
   */
  @Bean
  HibernatePropertiesCustomizer sourceQueryTimeoutCustomizer(SourceProperties properties) {
    return hibernateProperties ->
        hibernateProperties.put(
            SpecHints.HINT_SPEC_QUERY_TIMEOUT, queryTimeoutMillis(properties.timeout()));
  }

  /** JDBC timeouts are whole seconds, so the deadline is rounded up to at least one second. */
  static int queryTimeoutMillis(Duration timeout) {
    long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
    return Math.toIntExact(seconds * 1000);
  }

  /** Copies the submitting thread's MDC (tenant, request id) onto the worker for the task. */
  static TaskDecorator mdcPropagatingDecorator() {
    return task -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        } else {
          MDC.clear();
        }
        try {
          task.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
