package dev.shortcuts.cli;

import dev.shortcuts.model.ActionTypeDescriptor;
import dev.shortcuts.model.Permission;
import dev.shortcuts.registry.ActionRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "actions", mixinStandardHelpOptions = true,
    description = "List registered action types by category.")
class ActionsCommand implements Callable<Integer> {

    @ParentCommand
    private ShortcutIrCli root;

    @Spec
    private CommandSpec spec;

    @Option(names = "--category", description = "Only list this category")
    private String category;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        ActionRegistry registry = root.pipeline().registry();
        List<String> categories = category == null ? List.copyOf(registry.categories()) : List.of(category);
        for (String name : categories) {
            List<ActionTypeDescriptor> descriptors = registry.allByCategory(name);
            if (descriptors.isEmpty()) {
                continue;
            }
            out.println(name + ":");
            for (ActionTypeDescriptor descriptor : descriptors) {
                String permission = descriptor.requiredPermission() == Permission.NONE
                    ? ""
                    : "  [" + descriptor.requiredPermission().wireName() + "]";
                out.printf("  %-20s %s%s%n", descriptor.type(), descriptor.identifier(), permission);
            }
        }
        out.println(registry.size() + " action types");
        return 0;
    }
}
