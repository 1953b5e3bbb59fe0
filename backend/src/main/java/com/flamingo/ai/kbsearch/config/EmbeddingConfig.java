package com.flamingo.ai.kbsearch.config;

import com.flamingo.ai.kbsearch.service.embedding.DeviceCapability;
import com.flamingo.ai.kbsearch.service.embedding.DeviceProbe;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Probes the embedding device once and exposes the result as a bean. */
@Configuration
@Slf4j
public class EmbeddingConfig {

  @Bean
  public DeviceCapability deviceCapability(IngestionConfig ingestionConfig, DeviceProbe probe) {
    IngestionConfig.Embedding embedding = ingestionConfig.getEmbedding();
    String device = embedding.getDevice().toLowerCase(Locale.ROOT);
    DeviceCapability capability =
        switch (device) {
          case "cpu" -> DeviceCapability.cpuOnly();
          case "accelerator" -> {
            DeviceCapability probed = probe.probe();
            yield new DeviceCapability(
                true,
                Math.max(probed.freeMemoryMb(), embedding.getMinFreeMemoryMb()),
                probed.acceleratorPresent() ? probed.deviceName() : "forced");
          }
          default -> probe.probe();
        };
    log.info(
        "[EMBED] Device: {} (accelerator={}, freeMb={}, mode={})",
        capability.deviceName(),
        capability.acceleratorPresent(),
        capability.freeMemoryMb(),
        device);
    return capability;
  }
}
