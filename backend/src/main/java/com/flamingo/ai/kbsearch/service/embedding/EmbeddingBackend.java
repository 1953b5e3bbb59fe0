package com.flamingo.ai.kbsearch.service.embedding;

import java.util.List;

/** A black-box text to vector function bound to one model and one execution path. */
public interface EmbeddingBackend {

  /**
   * Embeds a batch, one vector per input, in input order.
   *
   * @throws DeviceAllocationException when the device runs out of memory for this batch
   * @throws com.flamingo.ai.kbsearch.exception.EmbeddingException on any other backend failure
   */
  List<float[]> embed(List<String> texts);

  /**
   * Returns device memory held for the last batch. Called after every batch, successful or not.
   * Backends that hold no device memory (in-process CPU models, hosted APIs) keep the no-op.
   */
  default void releaseDeviceMemory() {}
}
