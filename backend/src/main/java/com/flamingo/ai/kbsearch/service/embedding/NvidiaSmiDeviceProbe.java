package com.flamingo.ai.kbsearch.service.embedding;

import com.flamingo.ai.kbsearch.service.extraction.ExternalProcessRunner;
import com.flamingo.ai.kbsearch.service.extraction.ProcessResult;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Queries {@code nvidia-smi} for device name and free memory and reports the device with the most
 * free memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NvidiaSmiDeviceProbe implements DeviceProbe {

  private static final List<String> COMMAND =
      List.of("nvidia-smi", "--query-gpu=name,memory.free", "--format=csv,noheader,nounits");
  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final ExternalProcessRunner processRunner;

  @Override
  public DeviceCapability probe() {
    try {
      ProcessResult result = processRunner.run(COMMAND, TIMEOUT, null);
      if (!result.succeeded()) {
        log.info("[EMBED] nvidia-smi exited with {}, using CPU", result.exitCode());
        return DeviceCapability.cpuOnly();
      }
      return parse(result.stdout());
    } catch (IOException e) {
      log.info("[EMBED] No accelerator detected ({}), using CPU", e.getMessage());
      return DeviceCapability.cpuOnly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeviceCapability.cpuOnly();
    }
  }

  static DeviceCapability parse(String output) {
    DeviceCapability best = DeviceCapability.cpuOnly();
    for (String line : output.split("\\R")) {
      int comma = line.lastIndexOf(',');
      if (comma <= 0) {
        continue;
      }
      try {
        long free = Long.parseLong(line.substring(comma + 1).trim());
        if (!best.acceleratorPresent() || free > best.freeMemoryMb()) {
          best = new DeviceCapability(true, free, line.substring(0, comma).trim());
        }
      } catch (NumberFormatException e) {
        log.debug("[EMBED] Skipping unparseable nvidia-smi line '{}'", line);
      }
    }
    return best;
  }
}
