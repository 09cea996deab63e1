package com.questrail.conformance.validation;

/**
 * Renders a {@link ValidationReport} as the text block printed after each
 * state.
 *
 * <p>Summary form prints {@code attribute: N/M} per attribute; detailed form
 * lists each rule label under its attribute. An attribute is green when all
 * of its rules passed, yellow when some did and red when none did.</p>
 */
public final class ReportRenderer
{
    private static final String HEADER = "Validation Results";
    private static final String RULE = "-".repeat(HEADER.length());
    private static final String INDENT = "    ";

    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    private final boolean colorize;

    public ReportRenderer(boolean colorize) {
        this.colorize = colorize;
    }

    public String render(ValidationReport report, boolean detailed) {
        StringBuilder out = new StringBuilder();
        out.append('\n').append(RULE).append('\n')
                .append(HEADER).append('\n')
                .append(RULE).append('\n');

        for (ValidationReport.AttributeResult attribute : report.attributes()) {
            String colour = colourFor(attribute);
            if (detailed) {
                out.append(paint(attribute.attribute(), colour)).append(":\n");
                for (ValidationReport.RuleOutcome rule : attribute.rules()) {
                    out.append(INDENT)
                            .append(paint(rule.label(), rule.passed() ? GREEN : RED))
                            .append('\n');
                }
            } else {
                out.append(paint(attribute.attribute(), colour))
                        .append(": ")
                        .append(paint(attribute.matched() + "/" + attribute.total(), colour))
                        .append('\n');
            }
        }

        int matched = report.matched();
        int failures = report.failures();
        out.append(RULE).append('\n')
                .append("Matched: ")
                .append(matched > 0 ? paint(String.valueOf(matched), GREEN) : String.valueOf(matched))
                .append('/')
                .append(report.total())
                .append(" (failures: ")
                .append(failures > 0 ? paint(String.valueOf(failures), RED) : String.valueOf(failures))
                .append(")\n")
                .append(RULE).append('\n');
        return out.toString();
    }

    private static String colourFor(ValidationReport.AttributeResult attribute) {
        if (attribute.matched() == attribute.total()) {
            return GREEN;
        }
        return attribute.matched() > 0 ? YELLOW : RED;
    }

    private String paint(String text, String colour) {
        return colorize ? colour + text + RESET : text;
    }
}
