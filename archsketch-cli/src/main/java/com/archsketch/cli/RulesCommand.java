package com.archsketch.cli;

import com.archsketch.core.config.ConfigLoader;
import com.archsketch.core.config.ProjectConfig;
import com.archsketch.core.config.RuleTables;
import com.archsketch.core.rules.PatternRule;
import com.archsketch.core.rules.RuleEntry;
import com.archsketch.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Prints the effective rule tables, built-in entries plus configured extensions.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archsketch rules
 * archsketch rules -c my-archsketch.yaml
 * }</pre>
 */
@Command(
    name = "rules",
    description = "Print the generic and CGRA rule tables",
    mixinStandardHelpOptions = true
)
public class RulesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RulesCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: archsketch.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            ProjectConfig config = ConfigLoader.load(configPath);

            System.out.println("Generic rules:");
            System.out.println();
            printTable(RuleTables.generic(config));

            System.out.println("CGRA rules (priority order):");
            System.out.println();
            printTable(RuleTables.cgra(config));
            return 0;
        } catch (Exception e) {
            log.error("Failed to print rule tables", e);
            System.err.println("✗ Failed to print rule tables: " + e.getMessage());
            return 1;
        }
    }

    private <C extends Enum<C>> void printTable(RuleTable<C> table) {
        int position = 1;
        for (RuleEntry<C> entry : table.entries()) {
            PatternRule rule = entry.rule();
            System.out.printf("  %d. %s%n", position++, entry.category().name());
            System.out.printf("     Keywords:   %s%n", String.join(", ", rule.identifierKeywords()));
            if (!rule.nodeKinds().isEmpty()) {
                System.out.printf("     Node kinds: %s%n", String.join(", ", rule.nodeKinds()));
            }
        }
        System.out.println();
    }
}
