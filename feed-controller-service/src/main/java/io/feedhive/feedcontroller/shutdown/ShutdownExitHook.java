package io.feedhive.feedcontroller.shutdown;

import java.util.Objects;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * JVM shutdown hook that closes the application context and then ends the process with the
 * status decided by {@link ShutdownCoordinator}: {@value ShutdownCoordinator#CLEAN} after a
 * clean drain, {@value ShutdownCoordinator#FORCED} otherwise.
 * <p>
 * It replaces Spring's own shutdown hook, which closes the context but leaves the status to the
 * JVM.
 */
public final class ShutdownExitHook implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(ShutdownExitHook.class);

  private final ConfigurableApplicationContext context;
  private final IntConsumer exit;

  ShutdownExitHook(ConfigurableApplicationContext context, IntConsumer exit) {
    this.context = Objects.requireNonNull(context, "context");
    this.exit = Objects.requireNonNull(exit, "exit");
  }

  public static void install(ConfigurableApplicationContext context) {
    // halt, not exit: System.exit from inside a shutdown hook blocks forever
    ShutdownExitHook hook = new ShutdownExitHook(context, Runtime.getRuntime()::halt);
    Runtime.getRuntime().addShutdownHook(new Thread(hook, "feed-controller-shutdown"));
  }

  @Override
  public void run() {
    if (!context.isActive()) {
      return;
    }
    ShutdownCoordinator coordinator = context.getBean(ShutdownCoordinator.class);
    context.close();
    int code = coordinator.getExitCode();
    log.info("exiting with status {}", code);
    exit.accept(code);
  }
}
