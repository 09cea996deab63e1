package com.questrail.conformance.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleCompilerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final RuleCompiler compiler = new RuleCompiler(false);

    private static JsonNode json(String text) throws Exception {
        return JSON.readTree(text);
    }

    @Test
    void aliasesResolveToTheSameKind() throws Exception {
        assertEquals(RuleKind.FIRE, compiler.compile("pass", null).kind());
        assertEquals(RuleKind.FIRE, compiler.compile("FIRE", null).kind());
        assertEquals(RuleKind.NEVER_FIRE, compiler.compile("never_fire", null).kind());
        assertEquals(RuleKind.PATTERN, compiler.compile("regex", json("\"^a\"")).kind());
        assertEquals(RuleKind.RANGE, compiler.compile("within_range", json("[1, 2]")).kind());
        assertEquals(RuleKind.ALL, compiler.compile("all_pass", json("{\"pass\": null}")).kind());
        assertEquals(RuleKind.ANY, compiler.compile("any_pass", json("{\"pass\": null}")).kind());
    }

    @Test
    void trackingFollowsConditionName() throws Exception {
        assertEquals(TrackingPolicy.REQUIRED, compiler.compile("pattern", json("\"x\"")).tracking());
        assertEquals(TrackingPolicy.FORBIDDEN, compiler.compile("fail", null).tracking());
        assertEquals(TrackingPolicy.ADVISORY, compiler.compile("may_pattern", json("\"x\"")).tracking());
    }

    @Test
    void labelsRenderParameters() throws Exception {
        assertEquals("pattern: reg_pattern=^Access",
                compiler.compile("Pattern", json("{\"reg_pattern\": \"^Access\"}")).label());
        assertEquals("range: 5, 15", compiler.compile("range", json("[5, 15]")).label());
        assertEquals("range: minimum=1, maximum=3",
                compiler.compile("range", json("{\"minimum\": 1, \"maximum\": 3}")).label());
        assertEquals("pass", compiler.compile("pass", null).label());
    }

    @Test
    void combinatorLabelListsChildren() throws Exception {
        Rule all = compiler.compile("all", json("{\"pattern\": \"^a\", \"range\": [1, 2]}"));
        assertEquals("all: pattern: ^a, range: 1, 2", all.label());
    }

    @Test
    void rangeAcceptsEveryParameterShape() throws Exception {
        Rule.Range list = (Rule.Range) compiler.compile("range", json("[5, 15]"));
        Rule.Range longForm = (Rule.Range) compiler.compile("range", json("{\"minimum\": 5, \"maximum\": 15}"));
        Rule.Range shortForm = (Rule.Range) compiler.compile("range", json("{\"min\": 5, \"max\": 15}"));

        for (Rule.Range r : List.of(list, longForm, shortForm)) {
            assertEquals(5.0, r.minimum());
            assertEquals(15.0, r.maximum());
        }
    }

    @Test
    void invertedRangeIsRejected() throws Exception {
        assertThrows(RuleConfigurationException.class, () -> compiler.compile("range", json("[15, 5]")));
    }

    @Test
    void unknownConditionIsAConfigurationError() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> compiler.compile("sometimes", null));
        assertTrue(e.getMessage().contains("sometimes"));
    }

    @Test
    void codeRulesNeedScriptingEnabled() throws Exception {
        JsonNode block = json("\"return true;\"");
        assertThrows(RuleConfigurationException.class, () -> compiler.compile("code", block));

        Rule rule = new RuleCompiler(true).compile("code", json("{\"block\": \"return true;\"}"));
        assertEquals("code: code block", rule.label());
        assertEquals("return true;", ((Rule.Script) rule).source());
    }

    @Test
    void invalidRegexIsAConfigurationError() throws Exception {
        assertThrows(RuleConfigurationException.class, () -> compiler.compile("pattern", json("\"([a\"")));
    }

    @Test
    void compileTriggersKeepsDeclarationOrder() throws Exception {
        JsonNode triggers = json("["
                + "{\"Packet-Type\": {\"pattern\": \"Access-Accept\"}},"
                + "{\"Reply-Message\": {\"may_pattern\": \"hello\", \"pass\": null}},"
                + "{\"Packet-Type\": {\"never_fire\": null}},"
                + "{\"Ignored\": null}"
                + "]");

        RuleMap map = compiler.compileTriggers(triggers);

        assertEquals(List.of("Packet-Type", "Reply-Message", "Ignored"), List.copyOf(map.attributes()));
        assertEquals(2, map.rulesFor("Packet-Type").size());
        assertEquals(RuleKind.NEVER_FIRE, map.rulesFor("Packet-Type").get(1).kind());
        assertEquals(2, map.rulesFor("Reply-Message").size());
        assertTrue(map.rulesFor("Ignored").isEmpty());
        assertTrue(map.hasRequiredRules());
    }

    @Test
    void triggersMustBeAList() throws Exception {
        assertThrows(RuleConfigurationException.class,
                () -> compiler.compileTriggers(json("{\"a\": {\"pass\": null}}")));
    }

    @Test
    void jsonFieldRulesCannotBeModified() throws Exception {
        Rule.Json rule = (Rule.Json) compiler.compile("json", json("{\"user\": {\"pattern\": \"bob\"}}"));

        List<Rule> userRules = rule.fields().get("user");
        assertEquals(1, userRules.size());
        assertThrows(UnsupportedOperationException.class, () -> userRules.add(userRules.get(0)));
        assertThrows(UnsupportedOperationException.class, () -> rule.fields().remove("user"));
    }
}
