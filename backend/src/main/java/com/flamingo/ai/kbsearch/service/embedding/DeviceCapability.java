package com.flamingo.ai.kbsearch.service.embedding;

/**
 * What the host offers for embedding work, probed once per process.
 *
 * @param acceleratorPresent whether a usable accelerator was found
 * @param freeMemoryMb free accelerator memory at probe time
 * @param deviceName accelerator name, or "cpu"
 */
public record DeviceCapability(boolean acceleratorPresent, long freeMemoryMb, String deviceName) {

  public static DeviceCapability cpuOnly() {
    return new DeviceCapability(false, 0, "cpu");
  }
}
