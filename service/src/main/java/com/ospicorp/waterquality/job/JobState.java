package com.ospicorp.waterquality.job;

/** IDLE -> RUNNING -> {COMPLETED, SKIPPED_NO_DATA, FAILED} -> IDLE. */
public enum JobState {
  IDLE,
  RUNNING,
  COMPLETED,
  SKIPPED_NO_DATA,
  FAILED
}
