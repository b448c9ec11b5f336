package ca.gc.cra.fluxbatch.infrastructure.handler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches external commands and waits for them without a timeout.
 *
 * <p>Standard output and error are merged and appended to a log file when one is given; otherwise the child inherits
 * the JVM's streams.</p>
 *
 * @since 0.1.0
 */
public class ProcessCommandRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

  private final Optional<Path> workDir;

  /**
   * Creates a runner.
   *
   * @param workDir working directory for child processes; empty to inherit the JVM's
   */
  public ProcessCommandRunner(Optional<Path> workDir) {
    this.workDir = Objects.requireNonNullElse(workDir, Optional.empty());
  }

  /**
   * Runs a command to completion.
   *
   * @param command program and arguments
   * @param logFile file receiving the merged output, or empty to inherit
   * @return process exit code
   * @throws IOException if the process cannot be started or the log file cannot be opened
   * @throws InterruptedException if interrupted while waiting; the child is destroyed
   */
  public int run(List<String> command, Optional<Path> logFile) throws IOException, InterruptedException {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    workDir.ifPresent(dir -> builder.directory(dir.toFile()));
    if (logFile.isPresent()) {
      Path target = logFile.get();
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      builder.redirectErrorStream(true);
      builder.redirectOutput(ProcessBuilder.Redirect.appendTo(target.toFile()));
    } else {
      builder.inheritIO();
    }
    log.debug("Launching {}", command);
    Process process = builder.start();
    try {
      int exit = process.waitFor();
      log.debug("{} exited with {}", command.get(0), exit);
      return exit;
    } catch (InterruptedException ex) {
      process.destroy();
      throw ex;
    }
  }
}
