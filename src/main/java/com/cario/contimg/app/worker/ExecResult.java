package com.cario.contimg.app.worker;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Captured outcome of one external command. */
@Value
@Builder
public class ExecResult {

  List<String> command;

  int exitCode;

  String stdout;

  String stderr;

  long durationMs;

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
