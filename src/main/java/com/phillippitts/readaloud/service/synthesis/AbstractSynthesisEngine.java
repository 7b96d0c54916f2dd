package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.exception.SynthesisException;
import jakarta.annotation.PreDestroy;

/**
 * Base class providing thread-safe lifecycle and health state for synthesis engines.
 *
 * <p>{@link #initialize()} and {@link #close()} are idempotent. Subclasses implement
 * {@link #doInitialize()} and {@link #doClose()}, and call {@link #ensureInitialized()} at the
 * start of every synthesis call.
 */
public abstract class AbstractSynthesisEngine implements SynthesisEngine {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Engine-specific initialization, called under {@link #lock}.
     *
     * @throws SynthesisException if the engine cannot be prepared
     */
    protected abstract void doInitialize();

    @Override
    public boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called under {@link #lock}. Must not throw.
     */
    protected abstract void doClose();

    /**
     * @throws SynthesisException if the engine is not initialized or already closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new SynthesisException(getEngineName() + " engine not initialized or closed",
                        getEngineName(), FailureReason.ENGINE_ERROR);
            }
        }
    }
}
