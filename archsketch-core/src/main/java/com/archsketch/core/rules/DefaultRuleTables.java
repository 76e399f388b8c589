package com.archsketch.core.rules;

import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.PatternCategory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Built-in rule tables.
 *
 * <p>The generic table drives component, control-flow, data-flow and state extraction.
 * The CGRA table lists categories in classification priority order.
 */
public final class DefaultRuleTables {

    private static final RuleTable<PatternCategory> GENERIC = RuleTable.of(PatternCategory.class, List.of(
        new RuleEntry<>(PatternCategory.COMPONENT, new PatternRule(
            orderedSet("component", "module", "unit", "block", "element",
                "processor", "core", "engine", "accelerator"),
            orderedSet("struct_type", "interface_type", "class_declaration", "type_declaration"))),
        new RuleEntry<>(PatternCategory.CONTROL_FLOW, new PatternRule(
            orderedSet("control", "schedule", "dispatch", "orchestrate",
                "execute", "step", "cycle", "tick", "clock"),
            orderedSet("function_declaration", "method_declaration",
                "if_statement", "switch_statement", "for_statement"))),
        new RuleEntry<>(PatternCategory.DATA_FLOW, new PatternRule(
            orderedSet("data", "input", "output", "stream", "flow", "buffer",
                "queue", "channel", "port", "signal"),
            orderedSet("field_declaration", "variable_declaration", "channel_type", "array_type"))),
        new RuleEntry<>(PatternCategory.STATE, new PatternRule(
            orderedSet("state", "status", "mode", "configuration", "setting",
                "parameter", "register"),
            orderedSet("field_declaration", "variable_declaration", "const_declaration")))
    ));

    private static final RuleTable<CgraComponentCategory> CGRA = RuleTable.of(CgraComponentCategory.class, List.of(
        new RuleEntry<>(CgraComponentCategory.PROCESSING_ELEMENT,
            PatternRule.keywords("ProcessingElement", "PE", "ALU", "FunctionalUnit")),
        new RuleEntry<>(CgraComponentCategory.INTERCONNECT,
            PatternRule.keywords("Network", "Interconnect", "Router", "Switch")),
        new RuleEntry<>(CgraComponentCategory.MEMORY,
            PatternRule.keywords("Memory", "Buffer", "Cache", "Register")),
        new RuleEntry<>(CgraComponentCategory.CONTROL,
            PatternRule.keywords("Controller", "Scheduler", "Mapper")),
        new RuleEntry<>(CgraComponentCategory.CONFIGURATION,
            PatternRule.keywords("Config", "Configuration", "Setting"))
    ));

    private DefaultRuleTables() {
        // Utility class
    }

    /**
     * Returns the generic architecture rule table.
     *
     * @return generic table
     */
    public static RuleTable<PatternCategory> generic() {
        return GENERIC;
    }

    /**
     * Returns the CGRA taxonomy table in priority order.
     *
     * @return CGRA table
     */
    public static RuleTable<CgraComponentCategory> cgra() {
        return CGRA;
    }

    private static Set<String> orderedSet(String... values) {
        return new LinkedHashSet<>(List.of(values));
    }
}
