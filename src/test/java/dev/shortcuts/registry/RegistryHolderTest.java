package dev.shortcuts.registry;

import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.Confidence;
import dev.shortcuts.model.Permission;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryHolderTest {

    private static ActionTypeDescriptor descriptor(String type) {
        return new ActionTypeDescriptor(type, "test." + type, type, "text", List.of(), Permission.NONE,
            Set.of(), Set.of(), Confidence.HIGH);
    }

    @Test
    void reloadSwapsTheSnapshot() throws Exception {
        RegistryHolder holder = RegistryHolder.load(JsonRegistrySource.classpath());
        ActionRegistry before = holder.current();

        holder.reload(() -> Map.of("only", descriptor("only")));

        assertThat(holder.current().size()).isEqualTo(1);
        assertThat(before.size()).isEqualTo(26);
        assertThat(before.lookup("url")).isPresent();
    }

    @Test
    void appendExtendsTheCurrentSnapshot() {
        RegistryHolder holder = new RegistryHolder(ActionRegistry.empty());

        holder.append(List.of(descriptor("a")));
        holder.append(List.of(descriptor("b")));

        assertThat(holder.current().all()).extracting(ActionTypeDescriptor::type).containsExactly("a", "b");
    }
}
