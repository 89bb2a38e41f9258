package io.hearthwarrio.locatium.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.hearthwarrio.locatium.core.classify.HeuristicQtClassifier;
import io.hearthwarrio.locatium.core.classify.TagClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link LocatorConverter}: classifies every step and chains each locator to the
 * one emitted before it.
 * <p>
 * UID = canonical form of {@code [previous uid] _ tag _ archetype (_ attrName _ attrValue)*},
 * where a wildcard tag is written as {@code any}.
 * <p>
 * The chain follows emission order only; axes do not change which locator is the container.
 */
public final class QtLocatorConverter implements LocatorConverter {

    public static final String ARCHETYPE_KEY = "archetype";
    public static final String OCCURRENCE_KEY = "occurrence";
    public static final String VISIBLE_KEY = "visible";
    public static final String WILDCARD_TOKEN = "any";

    private final TagClassifier classifier;

    public QtLocatorConverter() {
        this(new HeuristicQtClassifier());
    }

    public QtLocatorConverter(TagClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public List<Locator> convert(List<LocationStep> steps) {
        Objects.requireNonNull(steps, "steps must not be null");

        List<Locator> out = new ArrayList<>(steps.size());
        String container = "";
        for (LocationStep step : steps) {
            String archetype = classifier.classify(step.getNodeTest());
            String uid = uid(container, step, archetype);
            Locator locator = new Locator(uid, metadata(step, archetype), container);
            out.add(locator);
            container = locator.getUid();
        }
        return Collections.unmodifiableList(out);
    }

    private static String uid(String container, LocationStep step, String archetype) {
        String token = step.isWildcard() ? WILDCARD_TOKEN : step.getNodeTest();

        StringBuilder raw = new StringBuilder();
        if (!container.isEmpty()) {
            raw.append(container).append('_');
        }
        raw.append(token).append('_').append(archetype);

        step.getPredicate().ifPresent(p -> {
            for (AttributeCondition a : p.attributeConditions()) {
                raw.append('_').append(a.getName()).append('_').append(a.getValue());
            }
        });
        return Uids.canonicalize(raw.toString());
    }

    private static ObjectNode metadata(LocationStep step, String archetype) {
        ObjectNode meta = JsonNodeFactory.instance.objectNode();
        meta.put(ARCHETYPE_KEY, archetype);

        step.getPredicate().ifPresent(p -> {
            for (PredicateCondition c : p.getConditions()) {
                switch (c.kind()) {
                    case ATTRIBUTE -> {
                        AttributeCondition a = (AttributeCondition) c;
                        meta.put(a.getName(), a.getValue());
                    }
                    case POSITION -> {
                        int index = ((PositionCondition) c).getIndex();
                        if (index > 1) {
                            meta.put(OCCURRENCE_KEY, index);
                        }
                    }
                }
            }
        });

        meta.put(VISIBLE_KEY, 1);
        return meta;
    }
}
