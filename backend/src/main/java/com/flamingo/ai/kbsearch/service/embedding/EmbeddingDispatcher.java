package com.flamingo.ai.kbsearch.service.embedding;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.EmbeddingErrorKind;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import com.google.common.primitives.Floats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns chunk texts into vectors for a model, batching according to the execution path.
 *
 * <p>The accelerated path is chosen when the probed device has at least {@code minFreeMemoryMb}
 * free. A batch that exhausts device memory is retried once as two halves; when that fails too,
 * the dispatcher stays on the CPU path until the next {@link #beginRun()}. Accelerated batches are
 * serialized through a fair lock and device memory is released after every batch.
 *
 * <p>Every returned vector has exactly the model's configured dimension.
 */
@Service
@Slf4j
public class EmbeddingDispatcher {

  private final EmbeddingModelRegistry modelRegistry;
  private final IngestionConfig.Embedding config;
  private final DeviceCapability capability;
  private final MeterRegistry meterRegistry;

  private final ReentrantLock deviceLock = new ReentrantLock(true);
  private final AtomicBoolean cpuFallback = new AtomicBoolean(false);

  public EmbeddingDispatcher(
      EmbeddingModelRegistry modelRegistry,
      IngestionConfig ingestionConfig,
      DeviceCapability capability,
      MeterRegistry meterRegistry) {
    this.modelRegistry = modelRegistry;
    this.config = ingestionConfig.getEmbedding();
    this.capability = capability;
    this.meterRegistry = meterRegistry;
  }

  /** Clears the CPU fallback of a previous run. */
  public void beginRun() {
    if (cpuFallback.getAndSet(false)) {
      log.info("[EMBED] Resetting CPU fallback for new run");
    }
  }

  public ExecutionPath currentPath() {
    boolean accelerated =
        capability.acceleratorPresent()
            && capability.freeMemoryMb() >= config.getMinFreeMemoryMb()
            && !cpuFallback.get();
    return accelerated ? ExecutionPath.ACCELERATED : ExecutionPath.CPU;
  }

  public int batchSize(ExecutionPath path) {
    return path == ExecutionPath.ACCELERATED
        ? config.getAcceleratedBatchSize()
        : config.getCpuBatchSize();
  }

  /**
   * Embeds texts with the named model, preserving input order.
   *
   * @throws EmbeddingException on unknown model, dimension mismatch, exhaustion on the CPU path or
   *     backend failure
   */
  public List<List<Float>> embed(List<String> texts, String model) {
    EmbeddingModelSpec spec = modelRegistry.spec(model);
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      int offset = 0;
      while (offset < texts.size()) {
        // Batch size is re-read each round so a mid-run fallback shrinks the remaining batches
        ExecutionPath path = currentPath();
        int end = Math.min(texts.size(), offset + batchSize(path));
        vectors.addAll(embedBatch(texts.subList(offset, end), spec, path));
        offset = end;
      }
      meterRegistry.counter("embedding.texts", "model", spec.name()).increment(texts.size());
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration", "model", spec.name()));
    }
  }

  /**
   * Embeds one search query on the CPU path.
   *
   * <p>Queries never take the device lock, never release device memory and never touch the run's
   * fallback state, so concurrent searches cannot change the path an ingestion run is on.
   */
  public List<Float> embedQuery(String query, String model) {
    EmbeddingModelSpec spec = modelRegistry.spec(model);
    EmbeddingBackend backend = modelRegistry.backend(spec.name(), ExecutionPath.CPU);
    try {
      return validate(backend.embed(List.of(query)), 1, spec).get(0);
    } catch (DeviceAllocationException e) {
      throw new EmbeddingException(
          EmbeddingErrorKind.DEVICE_EXHAUSTED, spec.name(), "Memory exhausted embedding a query", e);
    }
  }

  private List<List<Float>> embedBatch(
      List<String> batch, EmbeddingModelSpec spec, ExecutionPath path) {
    if (path == ExecutionPath.CPU) {
      return embedOnCpu(batch, spec);
    }
    try {
      return runBatch(batch, spec, ExecutionPath.ACCELERATED);
    } catch (DeviceAllocationException first) {
      log.warn(
          "[EMBED] Device exhausted on batch of {} for '{}', retrying in halves",
          batch.size(),
          spec.name());
      meterRegistry.counter("embedding.device.exhausted", "model", spec.name()).increment();
    }

    try {
      int mid = batch.size() / 2;
      List<List<Float>> vectors = new ArrayList<>(batch.size());
      if (mid > 0) {
        vectors.addAll(runBatch(batch.subList(0, mid), spec, ExecutionPath.ACCELERATED));
      }
      vectors.addAll(runBatch(batch.subList(mid, batch.size()), spec, ExecutionPath.ACCELERATED));
      return vectors;
    } catch (DeviceAllocationException second) {
      cpuFallback.set(true);
      meterRegistry.counter("embedding.device.fallback", "model", spec.name()).increment();
      log.warn(
          "[EMBED] Device still exhausted after split for '{}', using CPU for the rest of the run",
          spec.name());
      return embedOnCpu(batch, spec);
    }
  }

  private List<List<Float>> embedOnCpu(List<String> batch, EmbeddingModelSpec spec) {
    try {
      return runBatch(batch, spec, ExecutionPath.CPU);
    } catch (DeviceAllocationException e) {
      throw new EmbeddingException(
          EmbeddingErrorKind.DEVICE_EXHAUSTED,
          spec.name(),
          "Memory exhausted on the CPU path for a batch of " + batch.size(),
          e);
    }
  }

  private List<List<Float>> runBatch(
      List<String> batch, EmbeddingModelSpec spec, ExecutionPath path) {
    EmbeddingBackend backend = modelRegistry.backend(spec.name(), path);
    boolean locked = false;
    if (path == ExecutionPath.ACCELERATED) {
      deviceLock.lock();
      locked = true;
    }
    try {
      List<float[]> raw = backend.embed(batch);
      return validate(raw, batch.size(), spec);
    } finally {
      try {
        backend.releaseDeviceMemory();
      } finally {
        if (locked) {
          deviceLock.unlock();
        }
      }
    }
  }

  private List<List<Float>> validate(List<float[]> raw, int expected, EmbeddingModelSpec spec) {
    if (raw == null || raw.size() != expected) {
      throw new EmbeddingException(
          EmbeddingErrorKind.BACKEND_FAILURE,
          spec.name(),
          "Backend returned " + (raw == null ? 0 : raw.size()) + " vectors for " + expected
              + " texts");
    }
    List<List<Float>> vectors = new ArrayList<>(raw.size());
    for (float[] vector : raw) {
      if (vector.length != spec.dimensions()) {
        throw new EmbeddingException(
            EmbeddingErrorKind.DIMENSION_MISMATCH,
            spec.name(),
            "Expected " + spec.dimensions() + " dimensions but got " + vector.length);
      }
      vectors.add(new ArrayList<>(Floats.asList(vector)));
    }
    return vectors;
  }
}
