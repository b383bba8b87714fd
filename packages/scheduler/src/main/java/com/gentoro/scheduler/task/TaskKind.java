package com.gentoro.scheduler.task;

/** Distinguishes tasks that take no parameters from tasks that validate a parameter object. */
public enum TaskKind {
  SIMPLE,
  PARAMETERIZED
}
