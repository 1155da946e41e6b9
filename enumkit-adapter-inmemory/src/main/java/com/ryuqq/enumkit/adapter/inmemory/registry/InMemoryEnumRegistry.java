package com.ryuqq.enumkit.adapter.inmemory.registry;

import com.ryuqq.enumkit.core.exception.DuplicateEnumException;
import com.ryuqq.enumkit.core.exception.InvalidArgumentTypeException;
import com.ryuqq.enumkit.core.model.Enumeration;
import com.ryuqq.enumkit.core.spi.EnumRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link EnumRegistry} SPI.
 *
 * <p>This implementation provides a thread-safe, write-once name → {@link Enumeration}
 * store backed by {@link ConcurrentHashMap}. It is the registry behind the process-wide
 * {@code Enums} accessor.</p>
 *
 * <p><strong>Write-Once Guarantee:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#putIfAbsent} performs check-then-insert atomically</li>
 *   <li>Concurrent registrations of one name produce exactly one winner</li>
 *   <li>Losers receive {@link DuplicateEnumException}; the winner is never replaced</li>
 * </ul>
 *
 * <p><strong>Visibility:</strong> Enumerations are immutable and published through the
 * concurrent map, so every thread that can look one up sees it fully constructed.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No removal or reset (entries live as long as the registry)</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EnumRegistry registry = new InMemoryEnumRegistry();
 * registry.register(Enumeration.builder("Color").add(red).build());
 *
 * Enumeration color = registry.get("Color");
 * Map&lt;String, Enumeration&gt; all = registry.getEnums(); // independent copy
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEnumRegistry implements EnumRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEnumRegistry.class);

    /**
     * Registered enumerations.
     * Key: enum name, Value: Enumeration
     */
    private final ConcurrentHashMap<String, Enumeration> enums;

    /**
     * Creates a new InMemoryEnumRegistry with empty storage.
     */
    public InMemoryEnumRegistry() {
        this.enums = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Uses {@link ConcurrentHashMap#putIfAbsent} for atomic write-once insertion</li>
     *   <li>Logs accepted registrations at INFO, rejected duplicates at WARN</li>
     * </ul>
     */
    @Override
    public void register(Enumeration enumeration) {
        if (enumeration == null) {
            throw new InvalidArgumentTypeException("enumeration cannot be null");
        }

        String name = enumeration.getName();
        Enumeration existing = enums.putIfAbsent(name, enumeration);
        if (existing != null) {
            log.warn("Rejected duplicate registration of {}", enumeration);
            throw new DuplicateEnumException("enum " + name + " is already registered");
        }

        log.info("Registered {} with {} members", enumeration, enumeration.size());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Enumeration get(String name) {
        if (name == null) {
            return null;
        }
        return enums.get(name);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The copy is sorted by enum name.</p>
     */
    @Override
    public Map<String, Enumeration> getEnums() {
        return new TreeMap<>(enums);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int size() {
        return enums.size();
    }
}
