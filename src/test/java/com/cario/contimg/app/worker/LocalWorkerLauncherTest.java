package com.cario.contimg.app.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class LocalWorkerLauncherTest {

  @TempDir Path tmp;

  @Test
  void startCreatesWorkDirAndStopEndsSession() {
    Path work = tmp.resolve("work");
    LocalWorkerLauncher launcher =
        new LocalWorkerLauncher(
            new CommandRunner(Duration.ofSeconds(1)), work.toString(), Clock.systemUTC());

    WorkerSession session = launcher.start("s1");

    assertTrue(Files.isDirectory(work));
    assertTrue(launcher.isAlive(session));
    assertTrue(launcher.mounts().isEmpty());

    launcher.stop(session);
    assertFalse(launcher.isAlive(session));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void commandsRunInWorkDir() throws Exception {
    Path work = Files.createDirectories(tmp.resolve("work"));
    LocalWorkerLauncher launcher =
        new LocalWorkerLauncher(
            new CommandRunner(Duration.ofSeconds(1)), work.toString(), Clock.systemUTC());
    WorkerSession session = launcher.start("s1");

    ExecResult result = launcher.exec(session, List.of("pwd"), Duration.ofSeconds(10));

    assertEquals(work.toRealPath().toString(), result.getStdout().trim());
  }
}
