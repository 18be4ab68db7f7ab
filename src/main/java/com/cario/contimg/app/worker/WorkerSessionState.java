package com.cario.contimg.app.worker;

/** Lifecycle of the shared worker session. */
public enum WorkerSessionState {
  NOT_STARTED,
  STARTING,
  READY,
  EXECUTING,
  STOPPING,
  STOPPED
}
