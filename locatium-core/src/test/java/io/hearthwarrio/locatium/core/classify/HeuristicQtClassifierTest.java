package io.hearthwarrio.locatium.core.classify;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HeuristicQtClassifierTest {
    private final HeuristicQtClassifier classifier = new HeuristicQtClassifier();

    @Test
    void exactNamesWinBeforeSuffixAndSubstringRules() {
        assertEquals(QtArchetypes.PUSH_BUTTON, classifier.classify("button"));
        assertEquals(QtArchetypes.SCROLL_VIEW, classifier.classify("container"));
        assertEquals(QtArchetypes.MODULE, classifier.classify("form"));
        assertEquals(QtArchetypes.TEXT_FIELD, classifier.classify("textfield"));
    }

    @Test
    void isCaseInsensitive() {
        assertEquals(QtArchetypes.PUSH_BUTTON, classifier.classify("BUTTON"));
        assertEquals(QtArchetypes.CHECK_BOX, classifier.classify("QCheckBox"));
    }

    @Test
    void suffixRulesFollowTheirListOrder() {
        // "radiobutton" also ends with "button", which is listed first
        assertEquals(QtArchetypes.PUSH_BUTTON, classifier.classify("radiobutton"));
        assertEquals(QtArchetypes.COMBO_BOX, classifier.classify("countryComboBox"));
        assertEquals(QtArchetypes.SLIDER, classifier.classify("volumeSlider"));
        assertEquals(QtArchetypes.SCROLL_VIEW, classifier.classify("listview"));
        assertEquals(QtArchetypes.TEXT_FIELD, classifier.classify("nameField"));
    }

    @Test
    void suffixRuleWinsOverSubstringRule() {
        // contains "text" but ends with "label"
        assertEquals(QtArchetypes.LABEL, classifier.classify("textlabel"));
    }

    @Test
    void substringRulesApplyLast() {
        assertEquals(QtArchetypes.PUSH_BUTTON, classifier.classify("buttonPanel"));
        assertEquals(QtArchetypes.TEXT_FIELD, classifier.classify("fieldset"));
        assertEquals(QtArchetypes.TEXT_FIELD, classifier.classify("text()"));
        assertEquals(QtArchetypes.SCROLL_VIEW, classifier.classify("containerBox"));
        assertEquals(QtArchetypes.SCROLL_VIEW, classifier.classify("sidepanel"));
        assertEquals(QtArchetypes.MODULE, classifier.classify("formlayout"));
    }

    @Test
    void fallsBackForUnknownTags() {
        assertEquals(QtArchetypes.WIDGET, classifier.classify("div"));
        assertEquals(QtArchetypes.WIDGET, classifier.classify("*"));
        assertEquals(QtArchetypes.WIDGET, classifier.classify(""));
        assertEquals(QtArchetypes.WIDGET, classifier.classify(null));
    }

    @Test
    void customRulesRunBeforeBuiltInRules() {
        HeuristicQtClassifier custom = classifier.withRules(List.of(
                ClassificationRule.exact("div", "FrameQT"),
                new ClassificationRule("tool-button", 0, ClassificationRule.Match.CONTAINS, "button", "ToolButtonQT")
        ));

        assertEquals("FrameQT", custom.classify("DIV"));
        assertEquals("ToolButtonQT", custom.classify("button"));
        assertEquals(QtArchetypes.TEXT_FIELD, custom.classify("textfield"));
        // original classifier is untouched
        assertEquals(QtArchetypes.PUSH_BUTTON, classifier.classify("button"));
    }

    @Test
    void customRulesAreOrderedAndLastDuplicateWins() {
        ClassificationRule late = new ClassificationRule("late", 10, ClassificationRule.Match.SUFFIX, "box", "LateQT");
        ClassificationRule replaced = new ClassificationRule("early", 20, ClassificationRule.Match.EXACT, "x", "DupQT");
        ClassificationRule early = new ClassificationRule("early", -5, ClassificationRule.Match.CONTAINS, "box", "EarlyQT");

        HeuristicQtClassifier custom = classifier.withRules(Arrays.asList(late, null, replaced, early));

        assertEquals("EarlyQT", custom.classify("checkbox"));
        assertEquals(QtArchetypes.WIDGET, custom.classify("x"));
        assertEquals(2 + HeuristicQtClassifier.DEFAULT_RULES.size(), custom.getRules().size());
        assertSame(early, custom.getRules().get(0));
        assertSame(late, custom.getRules().get(1));
    }

    @Test
    void ruleWithBuiltInIdReplacesItInPlace() {
        ClassificationRule plainText = ClassificationRule.contains("text", "PlainTextQT");
        assertEquals("contains:text", plainText.id());

        HeuristicQtClassifier custom = classifier.withRules(List.of(plainText));

        assertEquals("PlainTextQT", custom.classify("richText"));
        // keeps its slot: exact and suffix rules still run before it
        assertEquals(QtArchetypes.TEXT_FIELD, custom.classify("textfield"));
        assertEquals(QtArchetypes.LABEL, custom.classify("textlabel"));

        List<ClassificationRule> rules = custom.getRules();
        assertEquals(HeuristicQtClassifier.DEFAULT_RULES.size(), rules.size());
        for (int i = 0; i < rules.size(); i++) {
            ClassificationRule builtIn = HeuristicQtClassifier.DEFAULT_RULES.get(i);
            assertEquals(builtIn.id(), rules.get(i).id());
            if (builtIn.id().equals("contains:text")) {
                assertSame(plainText, rules.get(i));
            }
        }
    }

    @Test
    void ruleWithNewIdStillRunsFirst() {
        ClassificationRule plainText = new ClassificationRule("plain-text", 0, ClassificationRule.Match.CONTAINS, "text", "PlainTextQT");

        HeuristicQtClassifier custom = classifier.withRules(List.of(plainText));

        assertEquals("PlainTextQT", custom.classify("textfield"));
        assertEquals(1 + HeuristicQtClassifier.DEFAULT_RULES.size(), custom.getRules().size());
    }

    @Test
    void fallbackLabelIsConfigurable() {
        HeuristicQtClassifier custom = classifier.withFallbackLabel("QObject");

        assertEquals("QObject", custom.classify("div"));
        assertEquals(QtArchetypes.PUSH_BUTTON, custom.classify("button"));
    }
}
