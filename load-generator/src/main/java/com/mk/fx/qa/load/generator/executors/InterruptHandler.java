package com.mk.fx.qa.load.generator.executors;

/**
 * Hooks an operator interrupt to {@link LoadCoordinator#stop()}. Installed when a run starts and
 * removed once it has been reported.
 */
public interface InterruptHandler {

  /** Handler that installs nothing, for embedded and test runs. */
  InterruptHandler NONE =
      new InterruptHandler() {
        @Override
        public void install(LoadCoordinator coordinator) {}

        @Override
        public void uninstall() {}
      };

  void install(LoadCoordinator coordinator);

  void uninstall();
}
