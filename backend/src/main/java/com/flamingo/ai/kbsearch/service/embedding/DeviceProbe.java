package com.flamingo.ai.kbsearch.service.embedding;

/** Detects the accelerator available to this process. */
public interface DeviceProbe {

  /** Never throws; a failed probe reports {@link DeviceCapability#cpuOnly()}. */
  DeviceCapability probe();
}
