package com.mk.fx.qa.load.generator.executors;

/** Lifecycle of a {@link LoadCoordinator}. Transitions only move forward. */
public enum CoordinatorState {
  IDLE,
  RUNNING,
  DRAINING,
  REPORTED
}
