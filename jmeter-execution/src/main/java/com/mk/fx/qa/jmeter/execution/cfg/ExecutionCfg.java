package com.mk.fx.qa.jmeter.execution.cfg;

import com.mk.fx.qa.jmeter.execution.dispatch.Dispatcher;
import com.mk.fx.qa.jmeter.execution.dispatch.InMemoryDispatcher;
import com.mk.fx.qa.jmeter.execution.repository.InMemoryTaskRepository;
import com.mk.fx.qa.jmeter.execution.repository.TaskRepository;
import java.time.Clock;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.detect.Detector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the pluggable seams of the execution engine to their in-process implementations. */
@Configuration
public class ExecutionCfg {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Detector contentDetector() {
    return new DefaultDetector();
  }

  @Bean
  public TaskRepository taskRepository(Clock clock) {
    return new InMemoryTaskRepository(clock);
  }

  @Bean
  public Dispatcher dispatcher(RunnerCfg cfg) {
    return new InMemoryDispatcher(cfg.getExecution().getMaxPending());
  }
}
