package org.blocksync.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import org.blocksync.catalog.ToolboxCatalog;
import org.blocksync.registry.BlockKindRegistry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Lists the toolbox categories and the block kinds they offer.
 */
@Command(
    name = "catalog",
    description = "List toolbox categories and block kinds"
)
public class CatalogCommand implements Callable<Integer> {

    @Option(names = {"--category"}, description = "Only list this category, e.g. Loops")
    private String category;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        ToolboxCatalog catalog = new ToolboxCatalog(BlockKindRegistry.defaults());
        List<ToolboxCatalog.Entry> entries;
        if (category != null) {
            try {
                var selected = ToolboxCatalog.category(category);
                entries = catalog.categories().stream().filter(e -> e.category() == selected).toList();
            } catch (IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                err.flush();
                return 1;
            }
        } else {
            entries = catalog.categories();
        }

        for (ToolboxCatalog.Entry entry : entries) {
            out.printf("%s (%s)%n", entry.displayName(), entry.colour());
            for (ToolboxCatalog.KindEntry kind : entry.kinds()) {
                out.printf("  %-24s %s%n", kind.tag(), kind.tooltip());
            }
        }
        out.flush();
        return 0;
    }
}
