package dev.shortcuts.registry;

import dev.shortcuts.model.ActionTypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current registry snapshot. Reload and append swap the reference atomically,
 * so callers that read {@link #current()} once per operation always see one consistent
 * registry.
 */
public final class RegistryHolder {

    private static final Logger logger = LoggerFactory.getLogger(RegistryHolder.class);

    private final AtomicReference<ActionRegistry> current;

    public RegistryHolder(ActionRegistry initial) {
        this.current = new AtomicReference<>(initial);
    }

    public static RegistryHolder load(RegistrySource source) throws IOException {
        var holder = new RegistryHolder(ActionRegistry.empty());
        holder.reload(source);
        return holder;
    }

    public ActionRegistry current() {
        return current.get();
    }

    /** Replace the registry with freshly loaded data. The old snapshot stays valid for its readers. */
    public ActionRegistry reload(RegistrySource source) throws IOException {
        ActionRegistry loaded = ActionRegistry.of(source.loadRegistry().values());
        ActionRegistry previous = current.getAndSet(loaded);
        logger.info("Action registry loaded: {} types ({} before reload)", loaded.size(), previous.size());
        return loaded;
    }

    /**
     * Register additional types on top of the current snapshot.
     *
     * @throws IllegalArgumentException if any type is already registered
     */
    public ActionRegistry append(Collection<ActionTypeDescriptor> descriptors) {
        ActionRegistry updated = current.updateAndGet(registry -> registry.extendedWith(descriptors));
        logger.debug("Appended {} action types, registry now has {}", descriptors.size(), updated.size());
        return updated;
    }
}
