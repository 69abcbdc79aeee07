package dev.shortcuts.registry;

import dev.shortcuts.model.ActionTypeDescriptor;

import java.io.IOException;
import java.util.Map;

/**
 * Provides registry data, keyed by action type. Consumed once per (re)load.
 */
@FunctionalInterface
public interface RegistrySource {

    Map<String, ActionTypeDescriptor> loadRegistry() throws IOException;
}
