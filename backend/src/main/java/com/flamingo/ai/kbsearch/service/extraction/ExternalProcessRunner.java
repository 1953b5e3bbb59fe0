package com.flamingo.ai.kbsearch.service.extraction;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs external tools (document renderer, OCR engine) with a hard time budget.
 *
 * <p>Output streams are redirected to temporary files so a chatty child can never block on a full
 * pipe. A child that overruns its budget is killed forcibly together with its descendants and reported as {@link
 * TimedOutException}; a binary that cannot be started is reported as {@link StartFailedException}.
 */
@Component
@Slf4j
public class ExternalProcessRunner {

  public ProcessResult run(List<String> command, Duration timeout, Path workingDirectory)
      throws IOException, InterruptedException {
    Path stdout = Files.createTempFile("kbsearch-proc-", ".out");
    Path stderr = Files.createTempFile("kbsearch-proc-", ".err");
    try {
      ProcessBuilder builder =
          new ProcessBuilder(command)
              .redirectOutput(stdout.toFile())
              .redirectError(stderr.toFile())
              .redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));
      if (workingDirectory != null) {
        builder.directory(workingDirectory.toFile());
      }

      Process process;
      try {
        process = builder.start();
      } catch (IOException e) {
        throw new StartFailedException(command.get(0), e);
      }

      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        killTree(process);
        log.warn("[PROC] {} killed after {}ms", command.get(0), timeout.toMillis());
        throw new TimedOutException(command.get(0), timeout);
      }

      return new ProcessResult(
          process.exitValue(),
          Files.readString(stdout, StandardCharsets.UTF_8),
          Files.readString(stderr, StandardCharsets.UTF_8));
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }

  /**
   * Kills the process and every descendant it spawned. Launchers such as soffice fork the real
   * worker, which would otherwise survive the parent and keep the profile lock.
   */
  private static void killTree(Process process) throws InterruptedException {
    // Descendants must be captured before the parent dies and they are reparented
    List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
    descendants.forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    process.waitFor(5, TimeUnit.SECONDS);
    for (ProcessHandle handle : descendants) {
      try {
        handle.onExit().get(5, TimeUnit.SECONDS);
      } catch (ExecutionException | TimeoutException e) {
        log.warn("[PROC] descendant {} still alive after kill", handle.pid());
      }
    }
  }

  private static String nullDevice() {
    return System.getProperty("os.name", "").toLowerCase().startsWith("windows")
        ? "NUL"
        : "/dev/null";
  }

  /** The executable could not be launched, typically because it is not installed. */
  public static class StartFailedException extends IOException {
    public StartFailedException(String executable, IOException cause) {
      super("Unable to start '" + executable + "': " + cause.getMessage(), cause);
    }
  }

  /** The process overran its time budget and was killed. */
  public static class TimedOutException extends IOException {
    public TimedOutException(String executable, Duration timeout) {
      super("'" + executable + "' did not finish within " + timeout.toSeconds() + "s");
    }
  }
}
