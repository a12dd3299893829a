package com.phillippitts.sessionscribe.service.stt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reference-counted cache of engines shared across sessions.
 *
 * <p>{@link #acquire(EngineKey)} creates the engine on first use and increments its count;
 * {@link #release(EngineKey)} decrements it and closes the engine when the count reaches zero.
 * A session's teardown therefore never closes an engine another session still uses.
 *
 * <p>Thread-safe: all operations synchronise on the registry.
 */
public class EngineRegistry implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(EngineRegistry.class);

    private final Function<EngineKey, SttEngine> factory;
    private final Map<EngineKey, Entry> entries = new HashMap<>();

    public EngineRegistry(Function<EngineKey, SttEngine> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Returns the shared engine for the key, creating it if needed.
     *
     * @throws com.phillippitts.sessionscribe.exception.TranscriptionException if creation fails;
     *         no reference is taken in that case
     */
    public synchronized SttEngine acquire(EngineKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            LOG.info("Creating STT engine {}", key);
            entry = new Entry(factory.apply(key));
            entries.put(key, entry);
        }
        entry.references++;
        LOG.debug("Engine {} acquired (refs={})", key, entry.references);
        return entry.engine;
    }

    /**
     * Drops one reference. Releasing an unknown key is a no-op.
     */
    public synchronized void release(EngineKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            LOG.debug("Release of unknown engine {} ignored", key);
            return;
        }
        entry.references--;
        if (entry.references > 0) {
            LOG.debug("Engine {} released (refs={})", key, entry.references);
            return;
        }
        entries.remove(key);
        closeQuietly(key, entry.engine);
    }

    public synchronized int referenceCount(EngineKey key) {
        Entry entry = entries.get(key);
        return entry == null ? 0 : entry.references;
    }

    /**
     * Closes every engine regardless of outstanding references. Used on shutdown.
     */
    public synchronized void closeAll() {
        entries.forEach(this::closeEntry);
        entries.clear();
    }

    @Override
    public void close() {
        closeAll();
    }

    private void closeEntry(EngineKey key, Entry entry) {
        closeQuietly(key, entry.engine);
    }

    private static void closeQuietly(EngineKey key, SttEngine engine) {
        try {
            engine.close();
            LOG.info("STT engine {} closed", key);
        } catch (RuntimeException e) {
            LOG.warn("Error closing STT engine {}", key, e);
        }
    }

    private static final class Entry {
        private final SttEngine engine;
        private int references;

        private Entry(SttEngine engine) {
            this.engine = engine;
        }
    }
}
